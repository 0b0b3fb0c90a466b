package io.amqpio.exchange;

import com.rabbitmq.client.Channel;
import io.amqpio.ChannelProvider;
import io.amqpio.DeclareFlag;
import io.amqpio.error.DeclarationException;
import io.amqpio.messaging.MessagePublisher;
import io.amqpio.naming.NamespaceResolver;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares exchanges on first use and caches one handle per name.
 *
 * <p>The first request for a name decides its kind and flags; later requests for the same name get
 * the cached handle whatever they ask for. Reserved {@code amq.*} exchanges and the default
 * exchange are only checked passively because the broker refuses to (re)declare them.
 * Not thread-safe.
 */
public final class ExchangeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRegistry.class);

    static final String RESERVED_PREFIX = "amq.";

    private final ChannelProvider channels;
    private final NamespaceResolver names;
    private final MessagePublisher publisher;
    private final Map<String, AmqpIoExchange> exchanges = new LinkedHashMap<>();

    public ExchangeRegistry(ChannelProvider channels, NamespaceResolver names, MessagePublisher publisher) {
        this.channels = Objects.requireNonNull(channels, "channels");
        this.names = Objects.requireNonNull(names, "names");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    public AmqpIoExchange getExchange(String name, ExchangeKind kind, Set<DeclareFlag> flags) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(flags, "flags");
        AmqpIoExchange cached = exchanges.get(name);
        if (cached != null) {
            return cached;
        }
        declare(channels.channel(), name, kind, flags);
        AmqpIoExchange exchange = new AmqpIoExchange(name, kind, flags, names, publisher);
        exchanges.put(name, exchange);
        return exchange;
    }

    public boolean contains(String name) {
        return exchanges.containsKey(name);
    }

    public int size() {
        return exchanges.size();
    }

    private void declare(Channel channel, String name, ExchangeKind kind, Set<DeclareFlag> flags) {
        try {
            if (name.isEmpty()) {
                return;
            }
            if (flags.contains(DeclareFlag.PASSIVE) || name.startsWith(RESERVED_PREFIX)) {
                channel.exchangeDeclarePassive(name);
                log.debug("Checked exchange {} exists", name);
                return;
            }
            channel.exchangeDeclare(
                name,
                kind.type(),
                flags.contains(DeclareFlag.DURABLE),
                flags.contains(DeclareFlag.AUTO_DELETE),
                flags.contains(DeclareFlag.INTERNAL),
                null);
            log.debug("Declared exchange {} type={} flags={}", name, kind.type().getType(), flags);
        } catch (IOException ex) {
            throw new DeclarationException("Cannot declare exchange '" + name + "'", ex);
        }
    }
}
