package io.amqpio.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.amqpio.error.SerializationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts publish payloads to message bodies and delivery bodies back to objects.
 *
 * <p>Text and raw bytes pass through untouched, other scalars are sent as their string form and
 * anything structured (maps, lists, records, beans) is written as JSON.
 */
public final class PayloadCodec {

    private static final byte[] EMPTY = new byte[0];

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public byte[] encode(Object data) {
        if (data == null) {
            return EMPTY;
        }
        if (data instanceof byte[] bytes) {
            return bytes;
        }
        if (isScalar(data)) {
            return data.toString().getBytes(StandardCharsets.UTF_8);
        }
        try {
            return mapper.writeValueAsBytes(data);
        } catch (JsonProcessingException ex) {
            throw new SerializationException(
                "Cannot encode payload of type " + data.getClass().getName() + " as JSON", ex);
        }
    }

    public <T> T decode(byte[] body, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (type == String.class) {
            return type.cast(new String(body, StandardCharsets.UTF_8));
        }
        if (type == byte[].class) {
            return type.cast(body.clone());
        }
        try {
            return mapper.readValue(body, type);
        } catch (IOException ex) {
            throw new SerializationException("Cannot decode message body as " + type.getName(), ex);
        }
    }

    static boolean isScalar(Object data) {
        return data instanceof CharSequence
            || data instanceof Number
            || data instanceof Boolean
            || data instanceof Character;
    }
}
