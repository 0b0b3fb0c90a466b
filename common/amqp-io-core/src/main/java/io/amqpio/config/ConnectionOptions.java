package io.amqpio.config;

import com.rabbitmq.client.ConnectionFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable broker credentials and timeouts used to open a connection.
 *
 * <p>The read timeout bounds every synchronous channel RPC (declarations, bindings). The write
 * timeout bounds the wait for a publisher confirm after each publish.
 */
public record ConnectionOptions(
    String host,
    int port,
    String vhost,
    String login,
    String password,
    Duration readTimeout,
    Duration writeTimeout,
    Duration connectTimeout,
    Duration heartbeat
) {

    private static final Logger log = LoggerFactory.getLogger(ConnectionOptions.class);

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = ConnectionFactory.DEFAULT_AMQP_PORT;
    public static final String DEFAULT_VHOST = ConnectionFactory.DEFAULT_VHOST;
    public static final String DEFAULT_LOGIN = ConnectionFactory.DEFAULT_USER;
    public static final String DEFAULT_PASSWORD = ConnectionFactory.DEFAULT_PASS;
    public static final Duration DEFAULT_READ_TIMEOUT =
        Duration.ofMillis(ConnectionFactory.DEFAULT_CHANNEL_RPC_TIMEOUT);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT =
        Duration.ofMillis(ConnectionFactory.DEFAULT_CONNECTION_TIMEOUT);
    public static final Duration DEFAULT_HEARTBEAT =
        Duration.ofSeconds(ConnectionFactory.DEFAULT_HEARTBEAT);

    public ConnectionOptions {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(vhost, "vhost");
        Objects.requireNonNull(login, "login");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(heartbeat, "heartbeat");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, got: " + port);
        }
        requireNonNegative("readTimeout", readTimeout);
        requireNonNegative("writeTimeout", writeTimeout);
        requireNonNegative("connectTimeout", connectTimeout);
        requireNonNegative("heartbeat", heartbeat);
    }

    public static ConnectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds options from a credentials map. Recognised keys are {@code host}, {@code port},
     * {@code vhost}, {@code login}, {@code password}, {@code read_timeout}, {@code write_timeout},
     * {@code connect_timeout} and {@code heartbeat}; the timeout keys are also accepted in camel
     * case. Timeouts are given in seconds and may be fractional. Absent keys keep their defaults.
     */
    public static ConnectionOptions fromMap(Map<String, ?> credentials) {
        Objects.requireNonNull(credentials, "credentials");
        Builder builder = builder();
        credentials.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            switch (normaliseKey(key)) {
                case "host" -> builder.host(value.toString());
                case "port" -> builder.port(toInt(key, value));
                case "vhost" -> builder.vhost(value.toString());
                case "login" -> builder.login(value.toString());
                case "password" -> builder.password(value.toString());
                case "readtimeout" -> builder.readTimeout(toSeconds(key, value));
                case "writetimeout" -> builder.writeTimeout(toSeconds(key, value));
                case "connecttimeout" -> builder.connectTimeout(toSeconds(key, value));
                case "heartbeat" -> builder.heartbeat(toSeconds(key, value));
                default -> log.warn("Ignoring unknown connection option '{}'", key);
            }
        });
        return builder.build();
    }

    /**
     * Copies these options onto a client connection factory. Automatic recovery is always switched
     * off: reconnecting is left to the caller.
     */
    public void applyTo(ConnectionFactory factory) {
        Objects.requireNonNull(factory, "factory");
        factory.setHost(host);
        factory.setPort(port);
        factory.setVirtualHost(vhost);
        factory.setUsername(login);
        factory.setPassword(password);
        factory.setConnectionTimeout(toMillis(connectTimeout));
        factory.setHandshakeTimeout(toMillis(connectTimeout));
        factory.setChannelRpcTimeout(toMillis(readTimeout));
        factory.setRequestedHeartbeat(heartbeatSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
    }

    /**
     * Address without credentials, for log and exception messages.
     */
    public String describe() {
        return login + "@" + host + ":" + port + vhostSuffix();
    }

    @Override
    public String toString() {
        return "ConnectionOptions[" + describe()
            + ", readTimeout=" + readTimeout
            + ", writeTimeout=" + writeTimeout
            + ", connectTimeout=" + connectTimeout
            + ", heartbeat=" + heartbeat + "]";
    }

    /**
     * Whole seconds for the client, rounded up so that a sub-second heartbeat does not turn into
     * zero, which would disable heartbeats.
     */
    private int heartbeatSeconds() {
        long seconds = heartbeat.toSeconds();
        if (heartbeat.toNanosPart() > 0) {
            seconds++;
        }
        return seconds > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) seconds;
    }

    private String vhostSuffix() {
        return vhost.startsWith("/") ? vhost : "/" + vhost;
    }

    private static String normaliseKey(String key) {
        return key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number number) {
            long whole = number.longValue();
            if (number.doubleValue() != whole || whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(
                    "Connection option '" + key + "' must be an integer, got: " + value);
            }
            return (int) whole;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Connection option '" + key + "' must be an integer, got: " + value, ex);
        }
    }

    private static Duration toSeconds(String key, Object value) {
        if (value instanceof Duration duration) {
            return duration;
        }
        double seconds;
        if (value instanceof Number number) {
            seconds = number.doubleValue();
        } else {
            try {
                seconds = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                    "Connection option '" + key + "' must be a number of seconds, got: " + value, ex);
            }
        }
        return Duration.ofMillis(Math.round(seconds * 1000d));
    }

    private static int toMillis(Duration duration) {
        long millis = duration.toMillis();
        return millis > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) millis;
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + value);
        }
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String vhost = DEFAULT_VHOST;
        private String login = DEFAULT_LOGIN;
        private String password = DEFAULT_PASSWORD;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration heartbeat = DEFAULT_HEARTBEAT;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder vhost(String vhost) {
            this.vhost = vhost;
            return this;
        }

        public Builder login(String login) {
            this.login = login;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder writeTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder heartbeat(Duration heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(
                host,
                port,
                vhost,
                login,
                password,
                readTimeout,
                writeTimeout,
                connectTimeout,
                heartbeat
            );
        }
    }
}
