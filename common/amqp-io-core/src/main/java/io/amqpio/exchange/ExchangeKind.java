package io.amqpio.exchange;

import com.rabbitmq.client.BuiltinExchangeType;

/**
 * Exchange types together with the broker's pre-declared {@code amq.*} exchange of each type.
 */
public enum ExchangeKind {
    DIRECT(BuiltinExchangeType.DIRECT),
    TOPIC(BuiltinExchangeType.TOPIC),
    FANOUT(BuiltinExchangeType.FANOUT),
    HEADERS(BuiltinExchangeType.HEADERS);

    private final BuiltinExchangeType type;

    ExchangeKind(BuiltinExchangeType type) {
        this.type = type;
    }

    public BuiltinExchangeType type() {
        return type;
    }

    /**
     * Name of the exchange of this type every broker declares up front, e.g. {@code amq.direct}.
     */
    public String builtInExchange() {
        return "amq." + type.getType();
    }
}
