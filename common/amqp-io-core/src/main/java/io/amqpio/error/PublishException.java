package io.amqpio.error;

/**
 * Raised when the broker negatively confirms a published message or the confirm does not arrive
 * within the configured write timeout.
 */
public class PublishException extends AmqpIoException {

    private final String exchange;
    private final String routingKey;

    public PublishException(String exchange, String routingKey, String message) {
        super(ErrorKind.PUBLISH, message);
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public PublishException(String exchange, String routingKey, String message, Throwable cause) {
        super(ErrorKind.PUBLISH, message, cause);
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }
}
