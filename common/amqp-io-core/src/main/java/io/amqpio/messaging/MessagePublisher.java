package io.amqpio.messaging;

import com.rabbitmq.client.Channel;
import io.amqpio.ChannelProvider;
import io.amqpio.error.ConnectionException;
import io.amqpio.error.PublishException;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes a payload and publishes it on the shared channel.
 *
 * <p>With publisher confirms enabled the channel is expected to be in confirm mode and every
 * publish blocks until the broker acks it; a nack or a missing confirm raises
 * {@link PublishException}. A confirm timeout of zero waits indefinitely.
 */
public final class MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);

    private final ChannelProvider channels;
    private final PayloadCodec codec;
    private final boolean publisherConfirms;
    private final Supplier<Duration> confirmTimeout;

    public MessagePublisher(ChannelProvider channels,
                            PayloadCodec codec,
                            boolean publisherConfirms,
                            Supplier<Duration> confirmTimeout) {
        this.channels = Objects.requireNonNull(channels, "channels");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.publisherConfirms = publisherConfirms;
        this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout");
    }

    public PayloadCodec codec() {
        return codec;
    }

    public void publish(String exchange,
                        String routingKey,
                        Object data,
                        Set<PublishFlag> flags,
                        MessageAttributes attributes) {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(routingKey, "routingKey");
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(attributes, "attributes");
        byte[] body = codec.encode(data);
        Channel channel = channels.channel();
        try {
            channel.basicPublish(
                exchange,
                routingKey,
                flags.contains(PublishFlag.MANDATORY),
                flags.contains(PublishFlag.IMMEDIATE),
                attributes.toProperties(),
                body);
        } catch (IOException ex) {
            throw new ConnectionException(
                "Cannot publish to exchange '" + exchange + "' with routing key '" + routingKey + "'", ex);
        }
        if (publisherConfirms) {
            awaitConfirm(channel, exchange, routingKey);
        }
        log.debug("Published {} bytes to exchange={} routingKey={}", body.length, exchange, routingKey);
    }

    private void awaitConfirm(Channel channel, String exchange, String routingKey) {
        Duration timeout = confirmTimeout.get();
        boolean acked;
        try {
            acked = channel.waitForConfirms(timeout.toMillis());
        } catch (TimeoutException ex) {
            throw new PublishException(exchange, routingKey,
                "Broker did not confirm message within " + timeout, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PublishException(exchange, routingKey,
                "Interrupted while waiting for publish confirm", ex);
        }
        if (!acked) {
            throw new PublishException(exchange, routingKey,
                "Cannot publish a message into AMQP exchange '" + exchange + "'");
        }
    }
}
