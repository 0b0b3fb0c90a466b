package io.amqpio.messaging;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-message publish flags.
 */
public enum PublishFlag {
    /** Ask the broker to return the message when no queue is bound for its routing key. */
    MANDATORY,
    /** Legacy AMQP 0-9-1 flag; RabbitMQ 3.0 and later close the connection when it is set. */
    IMMEDIATE;

    public static Set<PublishFlag> none() {
        return Collections.unmodifiableSet(EnumSet.noneOf(PublishFlag.class));
    }
}
