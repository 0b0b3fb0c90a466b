package io.amqpio.error;

/**
 * Indicates that the broker rejected an exchange declaration, queue declaration or binding.
 */
public class DeclarationException extends AmqpIoException {

    public DeclarationException(String message, Throwable cause) {
        super(ErrorKind.DECLARATION, message, cause);
    }
}
