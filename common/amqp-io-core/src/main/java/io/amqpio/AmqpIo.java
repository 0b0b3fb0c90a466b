package io.amqpio;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.amqpio.config.AmqpIoConfig;
import io.amqpio.config.ConnectionOptions;
import io.amqpio.error.ConnectionException;
import io.amqpio.exchange.AmqpIoExchange;
import io.amqpio.exchange.ExchangeKind;
import io.amqpio.exchange.ExchangeRegistry;
import io.amqpio.messaging.MessagePublisher;
import io.amqpio.messaging.PayloadCodec;
import io.amqpio.naming.NamespaceResolver;
import io.amqpio.queue.AmqpIoQueue;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one broker connection and its single channel, and hands out namespaced queues and cached
 * exchanges on top of them.
 *
 * <p>Every entry point connects lazily, so a manager may be created disconnected and used straight
 * away. After {@link #disconnect()} the next call reconnects with the options last used. Handles
 * obtained from a manager share its channel; the manager is not thread-safe.
 */
public class AmqpIo implements ChannelProvider, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AmqpIo.class);

    private final AmqpIoConfig config;
    private final ConnectionFactory connectionFactory;
    private final NamespaceResolver names;
    private final PayloadCodec codec;
    private final ExchangeRegistry exchanges;

    private ConnectionOptions options;
    private Connection connection;
    private Channel channel;

    public AmqpIo(AmqpIoConfig config) {
        this(config, new ConnectionFactory());
    }

    public AmqpIo(AmqpIoConfig config, ConnectionFactory connectionFactory) {
        this(config, connectionFactory, new PayloadCodec());
    }

    public AmqpIo(AmqpIoConfig config, ConnectionFactory connectionFactory, PayloadCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.options = config.connection();
        this.names = new NamespaceResolver(config.instanceName());
        MessagePublisher publisher = new MessagePublisher(
            this, codec, config.publisherConfirms(), () -> this.options.writeTimeout());
        this.exchanges = new ExchangeRegistry(this, names, publisher);
    }

    /**
     * Creates a manager and connects it immediately.
     *
     * @throws ConnectionException if the broker cannot be reached
     */
    public static AmqpIo open(AmqpIoConfig config) {
        AmqpIo amqpIo = new AmqpIo(config);
        amqpIo.connect();
        return amqpIo;
    }

    public AmqpIoConfig config() {
        return config;
    }

    public String instanceName() {
        return names.instanceName();
    }

    public NamespaceResolver names() {
        return names;
    }

    public void connect() {
        connect(options);
    }

    /**
     * Opens the connection and its channel unless already connected. The options are kept for
     * later lazy reconnects.
     *
     * @throws ConnectionException if the broker cannot be reached or refuses the credentials
     */
    public void connect(ConnectionOptions options) {
        Objects.requireNonNull(options, "options");
        if (isConnected()) {
            return;
        }
        this.options = options;
        options.applyTo(connectionFactory);
        try {
            connection = connectionFactory.newConnection(names.instanceName());
        } catch (IOException | TimeoutException ex) {
            connection = null;
            throw new ConnectionException("Cannot connect to AMQP broker at " + options.describe(), ex);
        }
        channel = openChannel(connection);
        log.info("Connected instance {} to AMQP broker at {}", names.instanceName(), options.describe());
    }

    public void disconnect() {
        if (!isConnected()) {
            return;
        }
        Connection current = connection;
        connection = null;
        channel = null;
        try {
            current.close();
        } catch (IOException ex) {
            throw new ConnectionException("Cannot close AMQP connection to " + options.describe(), ex);
        }
        log.info("Disconnected instance {} from AMQP broker at {}", names.instanceName(), options.describe());
    }

    public boolean isConnected() {
        return connection != null && connection.isOpen();
    }

    /**
     * Returns the open channel, connecting first if needed. A channel closed by the broker after a
     * channel-level error is replaced with a fresh one on the same connection.
     */
    @Override
    public Channel channel() {
        connect();
        if (channel == null || !channel.isOpen()) {
            channel = openChannel(connection);
        }
        return channel;
    }

    public AmqpIoExchange getExchange(String name, ExchangeKind kind) {
        return getExchange(name, kind, DeclareFlag.durable());
    }

    /**
     * Returns the cached exchange handle for {@code name}, declaring it on first use. The kind and
     * flags of the first request win.
     *
     * @throws io.amqpio.error.DeclarationException if the broker rejects the declaration
     */
    public AmqpIoExchange getExchange(String name, ExchangeKind kind, Set<DeclareFlag> flags) {
        connect();
        return exchanges.getExchange(name, kind, flags);
    }

    public AmqpIoExchange getExchangeDirect() {
        return getExchange(ExchangeKind.DIRECT.builtInExchange(), ExchangeKind.DIRECT, DeclareFlag.durable());
    }

    public AmqpIoExchange getExchangeTopic() {
        return getExchange(ExchangeKind.TOPIC.builtInExchange(), ExchangeKind.TOPIC, DeclareFlag.durable());
    }

    public AmqpIoExchange getExchangeFanout() {
        return getExchange(ExchangeKind.FANOUT.builtInExchange(), ExchangeKind.FANOUT, DeclareFlag.durable());
    }

    public AmqpIoQueue initQueue(String queueName) {
        return initQueue(queueName, DeclareFlag.none(), Map.of());
    }

    public AmqpIoQueue initQueue(String queueName, Set<DeclareFlag> flags) {
        return initQueue(queueName, flags, Map.of());
    }

    /**
     * Declares the namespaced queue and returns a new handle for it. Repeated calls re-declare.
     *
     * @throws io.amqpio.error.DeclarationException if the broker rejects the declaration
     */
    public AmqpIoQueue initQueue(String queueName, Set<DeclareFlag> flags, Map<String, Object> arguments) {
        connect();
        return AmqpIoQueue.declare(this, names, codec, queueName, flags, arguments);
    }

    public String resolveRouteName(String subroute) {
        return names.resolveRouteName(subroute);
    }

    public String resolveQueueName(String queueName) {
        return names.resolveQueueName(queueName);
    }

    @Override
    public void close() {
        disconnect();
    }

    private Channel openChannel(Connection connection) {
        Channel opened;
        try {
            opened = connection.createChannel();
            if (opened == null) {
                throw new ConnectionException("No channel available on connection to " + options.describe());
            }
            if (config.publisherConfirms()) {
                opened.confirmSelect();
            }
        } catch (IOException ex) {
            throw new ConnectionException("Cannot open channel on connection to " + options.describe(), ex);
        }
        log.debug("Opened channel {} for instance {}", opened.getChannelNumber(), names.instanceName());
        return opened;
    }
}
