package io.amqpio.messaging;

import com.rabbitmq.client.AMQP;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Message properties attached to a publish. All fields are optional.
 */
public record MessageAttributes(
    String contentType,
    String contentEncoding,
    String messageId,
    String correlationId,
    String replyTo,
    String expiration,
    String type,
    String appId,
    String userId,
    Integer priority,
    Integer deliveryMode,
    Instant timestamp,
    Map<String, Object> headers
) {

    public static final int DELIVERY_MODE_TRANSIENT = 1;
    public static final int DELIVERY_MODE_PERSISTENT = 2;

    private static final MessageAttributes EMPTY = builder().build();

    public MessageAttributes {
        headers = headers == null || headers.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        if (priority != null && (priority < 0 || priority > 255)) {
            throw new IllegalArgumentException("priority must be between 0 and 255, got: " + priority);
        }
        if (deliveryMode != null
            && deliveryMode != DELIVERY_MODE_TRANSIENT
            && deliveryMode != DELIVERY_MODE_PERSISTENT) {
            throw new IllegalArgumentException("deliveryMode must be 1 or 2, got: " + deliveryMode);
        }
    }

    public static MessageAttributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds attributes from a map keyed by AMQP property names, e.g. {@code content_type},
     * {@code delivery_mode}, {@code headers}. Keys are also accepted in camel case.
     *
     * @throws IllegalArgumentException on an unknown key or a value of the wrong type
     */
    public static MessageAttributes fromMap(Map<String, ?> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        Builder builder = builder();
        attributes.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            switch (key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT)) {
                case "contenttype" -> builder.contentType(value.toString());
                case "contentencoding" -> builder.contentEncoding(value.toString());
                case "messageid" -> builder.messageId(value.toString());
                case "correlationid" -> builder.correlationId(value.toString());
                case "replyto" -> builder.replyTo(value.toString());
                case "expiration" -> builder.expiration(value.toString());
                case "type" -> builder.type(value.toString());
                case "appid" -> builder.appId(value.toString());
                case "userid" -> builder.userId(value.toString());
                case "priority" -> builder.priority(toInt(key, value));
                case "deliverymode" -> builder.deliveryMode(toInt(key, value));
                case "timestamp" -> builder.timestamp(toInstant(key, value));
                case "headers" -> builder.headers(toHeaders(key, value));
                default -> throw new IllegalArgumentException("Unknown message attribute '" + key + "'");
            }
        });
        return builder.build();
    }

    public AMQP.BasicProperties toProperties() {
        return new AMQP.BasicProperties.Builder()
            .contentType(contentType)
            .contentEncoding(contentEncoding)
            .messageId(messageId)
            .correlationId(correlationId)
            .replyTo(replyTo)
            .expiration(expiration)
            .type(type)
            .appId(appId)
            .userId(userId)
            .priority(priority)
            .deliveryMode(deliveryMode)
            .timestamp(timestamp == null ? null : Date.from(timestamp))
            .headers(headers.isEmpty() ? null : headers)
            .build();
    }

    private static Integer toInt(String key, Object value) {
        if (value instanceof Number number) {
            long whole = number.longValue();
            if (number.doubleValue() != whole || whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(
                    "Message attribute '" + key + "' must be an integer, got: " + value);
            }
            return (int) whole;
        }
        try {
            return Integer.valueOf(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Message attribute '" + key + "' must be an integer, got: " + value, ex);
        }
    }

    private static Instant toInstant(String key, Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return Instant.ofEpochSecond(number.longValue());
        }
        throw new IllegalArgumentException("Message attribute '" + key + "' must be a timestamp, got: " + value);
    }

    private static Map<String, Object> toHeaders(String key, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Message attribute '" + key + "' must be a map, got: " + value);
        }
        Map<String, Object> headers = new LinkedHashMap<>();
        map.forEach((name, header) -> {
            if (name != null) {
                headers.put(name.toString(), header);
            }
        });
        return headers;
    }

    public static final class Builder {
        private String contentType;
        private String contentEncoding;
        private String messageId;
        private String correlationId;
        private String replyTo;
        private String expiration;
        private String type;
        private String appId;
        private String userId;
        private Integer priority;
        private Integer deliveryMode;
        private Instant timestamp;
        private final Map<String, Object> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder contentEncoding(String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder expiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder deliveryMode(Integer deliveryMode) {
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder persistent() {
            return deliveryMode(DELIVERY_MODE_PERSISTENT);
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder header(String name, Object value) {
            headers.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers.putAll(Objects.requireNonNull(headers, "headers"));
            return this;
        }

        public MessageAttributes build() {
            return new MessageAttributes(
                contentType,
                contentEncoding,
                messageId,
                correlationId,
                replyTo,
                expiration,
                type,
                appId,
                userId,
                priority,
                deliveryMode,
                timestamp,
                headers
            );
        }
    }
}
