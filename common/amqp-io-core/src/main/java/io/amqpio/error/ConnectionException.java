package io.amqpio.error;

/**
 * Indicates that the broker connection or its channel could not be used.
 */
public class ConnectionException extends AmqpIoException {

    public ConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
