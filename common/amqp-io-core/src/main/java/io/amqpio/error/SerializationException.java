package io.amqpio.error;

/**
 * Raised when a structured payload cannot be encoded to JSON, or a delivery body cannot be read
 * back into the requested type.
 */
public class SerializationException extends AmqpIoException {

    public SerializationException(String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION, message, cause);
    }
}
