package io.amqpio.queue;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import io.amqpio.ChannelProvider;
import io.amqpio.DeclareFlag;
import io.amqpio.error.ConnectionException;
import io.amqpio.error.DeclarationException;
import io.amqpio.exchange.ExchangeKind;
import io.amqpio.messaging.PayloadCodec;
import io.amqpio.naming.NamespaceResolver;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A declared queue and the bindings made through this handle.
 *
 * <p>Handles are immutable: {@link #bind} performs the binding on the broker and returns a new
 * handle that also lists it, so calls chain as {@code queue.bindDirect("a").bindTopic("b.*")}.
 */
public final class AmqpIoQueue {

    private static final Logger log = LoggerFactory.getLogger(AmqpIoQueue.class);

    private final ChannelProvider channels;
    private final NamespaceResolver names;
    private final PayloadCodec codec;
    private final String name;
    private final Set<DeclareFlag> flags;
    private final List<Binding> bindings;

    private AmqpIoQueue(ChannelProvider channels,
                        NamespaceResolver names,
                        PayloadCodec codec,
                        String name,
                        Set<DeclareFlag> flags,
                        List<Binding> bindings) {
        this.channels = channels;
        this.names = names;
        this.codec = codec;
        this.name = name;
        this.flags = flags;
        this.bindings = bindings;
    }

    /**
     * Declares the namespaced form of {@code queueName} and returns a handle without bindings.
     * Nothing is cached: declaring the same queue twice sends two declarations.
     *
     * @throws DeclarationException if the broker rejects the declaration
     */
    public static AmqpIoQueue declare(ChannelProvider channels,
                                      NamespaceResolver names,
                                      PayloadCodec codec,
                                      String queueName,
                                      Set<DeclareFlag> flags,
                                      Map<String, Object> arguments) {
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(flags, "flags");
        String resolved = names.resolveQueueName(queueName);
        Channel channel = channels.channel();
        try {
            if (flags.contains(DeclareFlag.PASSIVE)) {
                channel.queueDeclarePassive(resolved);
            } else {
                channel.queueDeclare(
                    resolved,
                    flags.contains(DeclareFlag.DURABLE),
                    flags.contains(DeclareFlag.EXCLUSIVE),
                    flags.contains(DeclareFlag.AUTO_DELETE),
                    arguments == null || arguments.isEmpty() ? null : arguments);
            }
        } catch (IOException ex) {
            throw new DeclarationException("Cannot declare queue '" + resolved + "'", ex);
        }
        log.debug("Declared queue {} flags={}", resolved, flags);
        return new AmqpIoQueue(channels, names, codec, resolved, DeclareFlag.copyOf(flags), List.of());
    }

    public String getName() {
        return name;
    }

    public Set<DeclareFlag> flags() {
        return flags;
    }

    public List<Binding> bindings() {
        return bindings;
    }

    /**
     * Binds this queue to {@code exchangeName} under the namespaced form of {@code subroute}.
     *
     * @return a handle that additionally lists the new binding
     * @throws DeclarationException if the broker rejects the binding
     */
    public AmqpIoQueue bind(String exchangeName, String subroute) {
        Objects.requireNonNull(exchangeName, "exchangeName");
        String routingKey = names.resolveRouteName(subroute);
        try {
            channels.channel().queueBind(name, exchangeName, routingKey);
        } catch (IOException ex) {
            throw new DeclarationException(
                "Cannot bind queue '" + name + "' to exchange '" + exchangeName + "' with routing key '"
                    + routingKey + "'", ex);
        }
        log.debug("Bound queue {} to exchange {} routingKey={}", name, exchangeName, routingKey);
        List<Binding> next = new ArrayList<>(bindings.size() + 1);
        next.addAll(bindings);
        next.add(new Binding(exchangeName, routingKey));
        return new AmqpIoQueue(channels, names, codec, name, flags, Collections.unmodifiableList(next));
    }

    public AmqpIoQueue bindDirect(String subroute) {
        return bind(ExchangeKind.DIRECT.builtInExchange(), subroute);
    }

    public AmqpIoQueue bindTopic(String subroute) {
        return bind(ExchangeKind.TOPIC.builtInExchange(), subroute);
    }

    public AmqpIoQueue bindFanout(String subroute) {
        return bind(ExchangeKind.FANOUT.builtInExchange(), subroute);
    }

    /**
     * Consumes with manual acknowledgement; see {@link #consume(DeliveryHandler, boolean)}.
     */
    public void consume(DeliveryHandler handler) {
        consume(handler, false);
    }

    /**
     * Starts a consumer and blocks the calling thread, passing each delivery to {@code handler}
     * until it returns {@code false}. The loop also ends when the broker cancels the consumer or
     * the calling thread is interrupted (the interrupt flag stays set). The consumer is cancelled
     * before returning.
     *
     * <p>The client may already have pushed more deliveries than the handler saw. With manual
     * acknowledgement these are nacked with requeue once the consumer is cancelled, so the broker
     * can hand them to another consumer. With {@code autoAck} the broker considers them delivered
     * and they are dropped.
     *
     * @throws ConnectionException if the consumer cannot be started or its channel shuts down
     */
    public void consume(DeliveryHandler handler, boolean autoAck) {
        Objects.requireNonNull(handler, "handler");
        Channel channel = channels.channel();
        BlockingQueue<ConsumerEvent> events = new LinkedBlockingQueue<>();
        String consumerTag;
        try {
            consumerTag = channel.basicConsume(
                name,
                autoAck,
                (tag, delivery) -> events.add(ConsumerEvent.delivered(AmqpIoDelivery.from(delivery, codec))),
                tag -> events.add(ConsumerEvent.cancelled()),
                (tag, signal) -> events.add(ConsumerEvent.shutdown(signal)));
        } catch (IOException ex) {
            throw new ConnectionException("Cannot start consumer on queue '" + name + "'", ex);
        }
        log.debug("Consuming from queue {} consumerTag={} autoAck={}", name, consumerTag, autoAck);
        ConsumeOutcome outcome;
        try {
            outcome = drain(events, handler);
        } catch (RuntimeException ex) {
            try {
                stop(channel, consumerTag, events, autoAck);
            } catch (RuntimeException stopFailure) {
                ex.addSuppressed(stopFailure);
            }
            throw ex;
        }
        if (outcome != ConsumeOutcome.CANCELLED_BY_BROKER) {
            stop(channel, consumerTag, events, autoAck);
        }
        log.debug("Stopped consuming from queue {}: {}", name, outcome);
    }

    public Optional<AmqpIoDelivery> get() {
        return get(false);
    }

    /**
     * Fetches a single message without waiting.
     */
    public Optional<AmqpIoDelivery> get(boolean autoAck) {
        GetResponse response;
        try {
            response = channels.channel().basicGet(name, autoAck);
        } catch (IOException ex) {
            throw new ConnectionException("Cannot get a message from queue '" + name + "'", ex);
        }
        return response == null ? Optional.empty() : Optional.of(AmqpIoDelivery.from(response, codec));
    }

    public void ack(long deliveryTag) {
        try {
            channels.channel().basicAck(deliveryTag, false);
        } catch (IOException ex) {
            throw new ConnectionException("Cannot ack delivery " + deliveryTag + " on queue '" + name + "'", ex);
        }
    }

    public void nack(long deliveryTag, boolean requeue) {
        try {
            channels.channel().basicNack(deliveryTag, false, requeue);
        } catch (IOException ex) {
            throw new ConnectionException("Cannot nack delivery " + deliveryTag + " on queue '" + name + "'", ex);
        }
    }

    @Override
    public String toString() {
        return "AmqpIoQueue[" + name + ", " + flags + ", bindings=" + bindings + "]";
    }

    private ConsumeOutcome drain(BlockingQueue<ConsumerEvent> events, DeliveryHandler handler) {
        try {
            while (true) {
                ConsumerEvent event = events.take();
                if (event.delivery() != null) {
                    if (!handler.handle(event.delivery(), this)) {
                        return ConsumeOutcome.STOPPED_BY_HANDLER;
                    }
                } else if (event.signal() != null) {
                    throw new ConnectionException(
                        "Consumer on queue '" + name + "' stopped because its channel shut down", event.signal());
                } else {
                    log.info("Consumer on queue {} was cancelled by the broker", name);
                    return ConsumeOutcome.CANCELLED_BY_BROKER;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ConsumeOutcome.INTERRUPTED;
        }
    }

    private void stop(Channel channel, String consumerTag, BlockingQueue<ConsumerEvent> events, boolean autoAck) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.basicCancel(consumerTag);
        } catch (IOException ex) {
            throw new ConnectionException("Cannot cancel consumer " + consumerTag + " on queue '" + name + "'", ex);
        }
        List<ConsumerEvent> unhandled = new ArrayList<>();
        events.drainTo(unhandled);
        int dropped = 0;
        for (ConsumerEvent event : unhandled) {
            if (event.delivery() == null) {
                continue;
            }
            if (autoAck) {
                dropped++;
            } else {
                requeue(channel, event.delivery().deliveryTag());
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} auto-acked deliveries buffered for queue {}", dropped, name);
        }
    }

    private void requeue(Channel channel, long deliveryTag) {
        try {
            channel.basicNack(deliveryTag, false, true);
        } catch (IOException ex) {
            throw new ConnectionException(
                "Cannot requeue delivery " + deliveryTag + " on queue '" + name + "'", ex);
        }
        log.debug("Requeued unhandled delivery {} on queue {}", deliveryTag, name);
    }

    private enum ConsumeOutcome {
        STOPPED_BY_HANDLER,
        CANCELLED_BY_BROKER,
        INTERRUPTED
    }

    private record ConsumerEvent(AmqpIoDelivery delivery, ShutdownSignalException signal) {

        static ConsumerEvent delivered(AmqpIoDelivery delivery) {
            return new ConsumerEvent(delivery, null);
        }

        static ConsumerEvent cancelled() {
            return new ConsumerEvent(null, null);
        }

        static ConsumerEvent shutdown(ShutdownSignalException signal) {
            return new ConsumerEvent(null, signal);
        }
    }
}
