package io.amqpio.naming;

import java.util.Objects;

/**
 * Derives broker-visible names by prefixing the instance identity.
 *
 * <p>Every queue name and routing key handed to the broker client goes through one of these
 * methods, so two instances with different identities never share a queue or a route by accident.
 */
public final class NamespaceResolver {

    private static final String SEPARATOR = ".";

    private final String instanceName;

    public NamespaceResolver(String instanceName) {
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
    }

    public String instanceName() {
        return instanceName;
    }

    public String resolveRouteName(String subroute) {
        Objects.requireNonNull(subroute, "subroute");
        return instanceName + SEPARATOR + subroute;
    }

    public String resolveQueueName(String queueName) {
        Objects.requireNonNull(queueName, "queueName");
        return instanceName + SEPARATOR + queueName;
    }

    @Override
    public String toString() {
        return "NamespaceResolver[" + instanceName + "]";
    }
}
