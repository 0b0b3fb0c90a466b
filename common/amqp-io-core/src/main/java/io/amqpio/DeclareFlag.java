package io.amqpio;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Declaration flags shared by exchanges and queues. An empty set declares a transient,
 * non-exclusive entity that outlives its consumers.
 */
public enum DeclareFlag {
    /** Survives a broker restart. */
    DURABLE,
    /** Only checks that the entity exists; fails if it does not. */
    PASSIVE,
    /** Queue only: usable by the declaring connection alone, deleted when it closes. */
    EXCLUSIVE,
    /** Deleted once its last binding (exchange) or consumer (queue) is gone. */
    AUTO_DELETE,
    /** Exchange only: cannot be published to directly, only through exchange-to-exchange bindings. */
    INTERNAL;

    public static Set<DeclareFlag> none() {
        return Collections.unmodifiableSet(EnumSet.noneOf(DeclareFlag.class));
    }

    public static Set<DeclareFlag> durable() {
        return Collections.unmodifiableSet(EnumSet.of(DURABLE));
    }

    public static Set<DeclareFlag> of(DeclareFlag first, DeclareFlag... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public static Set<DeclareFlag> copyOf(Set<DeclareFlag> flags) {
        return flags.isEmpty() ? none() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }
}
