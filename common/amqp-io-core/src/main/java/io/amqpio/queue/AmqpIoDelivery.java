package io.amqpio.queue;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import io.amqpio.messaging.PayloadCodec;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A message received from a queue.
 */
public final class AmqpIoDelivery {

    private static final byte[] EMPTY = new byte[0];

    private final long deliveryTag;
    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private final PayloadCodec codec;

    private AmqpIoDelivery(Envelope envelope, AMQP.BasicProperties properties, byte[] body, PayloadCodec codec) {
        Objects.requireNonNull(envelope, "envelope");
        this.deliveryTag = envelope.getDeliveryTag();
        this.exchange = envelope.getExchange();
        this.routingKey = envelope.getRoutingKey();
        this.redelivered = envelope.isRedeliver();
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.body = body == null ? EMPTY : body;
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    static AmqpIoDelivery from(Delivery delivery, PayloadCodec codec) {
        return new AmqpIoDelivery(delivery.getEnvelope(), delivery.getProperties(), delivery.getBody(), codec);
    }

    static AmqpIoDelivery from(GetResponse response, PayloadCodec codec) {
        return new AmqpIoDelivery(response.getEnvelope(), response.getProps(), response.getBody(), codec);
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }

    public boolean redelivered() {
        return redelivered;
    }

    public AMQP.BasicProperties properties() {
        return properties;
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Reads the body as JSON into {@code type}.
     *
     * @throws io.amqpio.error.SerializationException if the body is not valid JSON for the type
     */
    public <T> T bodyAs(Class<T> type) {
        return codec.decode(body, type);
    }

    @Override
    public String toString() {
        return "AmqpIoDelivery[tag=" + deliveryTag
            + ", exchange=" + exchange
            + ", routingKey=" + routingKey
            + ", redelivered=" + redelivered
            + ", bytes=" + body.length + "]";
    }
}
