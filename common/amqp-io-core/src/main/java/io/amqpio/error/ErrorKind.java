package io.amqpio.error;

/**
 * Closed set of failure categories raised by the facade.
 */
public enum ErrorKind {
    /** Connecting, disconnecting or any other I/O against the broker connection failed. */
    CONNECTION,
    /** An exchange or queue could not be declared or bound. */
    DECLARATION,
    /** The broker refused a published message or did not confirm it in time. */
    PUBLISH,
    /** A payload could not be converted to or from its text encoding. */
    SERIALIZATION
}
