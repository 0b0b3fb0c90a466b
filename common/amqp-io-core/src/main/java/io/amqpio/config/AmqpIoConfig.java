package io.amqpio.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of one {@link io.amqpio.AmqpIo} instance: the instance identity used
 * as namespace prefix, the connection options and whether publishes wait for broker confirms.
 */
public record AmqpIoConfig(
    String instanceName,
    ConnectionOptions connection,
    boolean publisherConfirms
) {

    public static final String DEFAULT_INSTANCE_NAME = "unknown";
    public static final String PROPERTY_PREFIX = "amqpio.";
    public static final String INSTANCE_NAME_PROPERTY = PROPERTY_PREFIX + "instance-name";
    public static final String PUBLISHER_CONFIRMS_PROPERTY = PROPERTY_PREFIX + "publisher-confirms";

    public AmqpIoConfig {
        Objects.requireNonNull(instanceName, "instanceName");
        Objects.requireNonNull(connection, "connection");
        if (instanceName.isBlank()) {
            throw new IllegalArgumentException("instanceName must not be blank");
        }
        for (int i = 0; i < instanceName.length(); i++) {
            char c = instanceName.charAt(i);
            if (Character.isWhitespace(c) || c == '*' || c == '#') {
                throw new IllegalArgumentException(
                    "instanceName must not contain whitespace or topic wildcards, got: '" + instanceName + "'");
            }
        }
    }

    public static AmqpIoConfig defaults() {
        return builder().build();
    }

    public static AmqpIoConfig of(String instanceName, ConnectionOptions connection) {
        return builder().instanceName(instanceName).connection(connection).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code amqpio.*} keys: {@code amqpio.instance-name}, {@code amqpio.publisher-confirms}
     * and every connection option understood by {@link ConnectionOptions#fromMap(Map)}, for example
     * {@code amqpio.host} or {@code amqpio.connect-timeout}.
     */
    public static AmqpIoConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, Object> credentials = new LinkedHashMap<>();
        Builder builder = builder();
        for (String name : properties.stringPropertyNames()) {
            if (!name.startsWith(PROPERTY_PREFIX)) {
                continue;
            }
            String value = properties.getProperty(name).trim();
            if (name.equals(INSTANCE_NAME_PROPERTY)) {
                builder.instanceName(value);
            } else if (name.equals(PUBLISHER_CONFIRMS_PROPERTY)) {
                builder.publisherConfirms(Boolean.parseBoolean(value));
            } else {
                credentials.put(name.substring(PROPERTY_PREFIX.length()), value);
            }
        }
        return builder.connection(ConnectionOptions.fromMap(credentials)).build();
    }

    /**
     * Loads a properties file from the classpath and parses it with {@link #fromProperties}.
     */
    public static AmqpIoConfig load(String resource) {
        Objects.requireNonNull(resource, "resource");
        Properties properties = new Properties();
        try (InputStream in = AmqpIoConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Configuration resource not found on classpath: " + resource);
            }
            properties.load(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read configuration resource " + resource, ex);
        }
        return fromProperties(properties);
    }

    public static final class Builder {
        private String instanceName = DEFAULT_INSTANCE_NAME;
        private ConnectionOptions connection = ConnectionOptions.defaults();
        private boolean publisherConfirms = true;

        private Builder() {
        }

        public Builder instanceName(String instanceName) {
            this.instanceName = instanceName;
            return this;
        }

        public Builder connection(ConnectionOptions connection) {
            this.connection = connection;
            return this;
        }

        public Builder credentials(Map<String, ?> credentials) {
            this.connection = ConnectionOptions.fromMap(credentials);
            return this;
        }

        public Builder publisherConfirms(boolean publisherConfirms) {
            this.publisherConfirms = publisherConfirms;
            return this;
        }

        public AmqpIoConfig build() {
            return new AmqpIoConfig(instanceName, connection, publisherConfirms);
        }
    }
}
