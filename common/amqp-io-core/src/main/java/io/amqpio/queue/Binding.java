package io.amqpio.queue;

import java.util.Objects;

/**
 * A queue-to-exchange binding as sent to the broker, with the routing key already namespaced.
 */
public record Binding(String exchange, String routingKey) {

    public Binding {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(routingKey, "routingKey");
    }
}
