package io.amqpio.exchange;

import io.amqpio.DeclareFlag;
import io.amqpio.messaging.MessageAttributes;
import io.amqpio.messaging.MessagePublisher;
import io.amqpio.messaging.PublishFlag;
import io.amqpio.naming.NamespaceResolver;
import java.util.Objects;
import java.util.Set;

/**
 * A declared exchange. Handles are created and cached by {@link ExchangeRegistry} and never change
 * after creation.
 */
public final class AmqpIoExchange {

    private final String name;
    private final ExchangeKind kind;
    private final Set<DeclareFlag> flags;
    private final NamespaceResolver names;
    private final MessagePublisher publisher;

    AmqpIoExchange(String name,
                   ExchangeKind kind,
                   Set<DeclareFlag> flags,
                   NamespaceResolver names,
                   MessagePublisher publisher) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.flags = DeclareFlag.copyOf(flags);
        this.names = Objects.requireNonNull(names, "names");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    public String getName() {
        return name;
    }

    public ExchangeKind kind() {
        return kind;
    }

    public Set<DeclareFlag> flags() {
        return flags;
    }

    public void sendMessage(Object data, String subroute) {
        sendMessage(data, subroute, PublishFlag.none(), MessageAttributes.empty());
    }

    public void sendMessage(Object data, String subroute, Set<PublishFlag> flags) {
        sendMessage(data, subroute, flags, MessageAttributes.empty());
    }

    /**
     * Publishes {@code data} under the namespaced form of {@code subroute}.
     *
     * @throws io.amqpio.error.SerializationException if a structured payload cannot be encoded
     * @throws io.amqpio.error.PublishException if the broker does not confirm the message
     * @throws io.amqpio.error.ConnectionException if the channel fails while publishing
     */
    public void sendMessage(Object data, String subroute, Set<PublishFlag> flags, MessageAttributes attributes) {
        publisher.publish(name, names.resolveRouteName(subroute), data, flags, attributes);
    }

    @Override
    public String toString() {
        return "AmqpIoExchange[" + name + ", " + kind + ", " + flags + "]";
    }
}
