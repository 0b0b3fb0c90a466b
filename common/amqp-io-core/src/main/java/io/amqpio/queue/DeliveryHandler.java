package io.amqpio.queue;

/**
 * Callback invoked by {@link AmqpIoQueue#consume} for every delivery.
 */
@FunctionalInterface
public interface DeliveryHandler {

    /**
     * Handles one delivery. Unless the consumer runs with auto-ack, the handler acknowledges the
     * delivery itself through {@link AmqpIoQueue#ack(long)} or {@link AmqpIoQueue#nack(long, boolean)}.
     *
     * @return {@code true} to keep consuming, {@code false} to cancel the consumer and return
     */
    boolean handle(AmqpIoDelivery delivery, AmqpIoQueue queue);
}
