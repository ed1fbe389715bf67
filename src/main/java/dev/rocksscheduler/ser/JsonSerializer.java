package dev.rocksscheduler.ser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

public class JsonSerializer<T> implements Serializer<T> {
    private static final ObjectMapper SHARED = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonSerializer(Class<T> type) {
        this(type, SHARED);
    }

    public JsonSerializer(Class<T> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    @Override
    public byte[] serialize(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize value to JSON", e);
        }
    }

    @Override
    public T deserialize(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (Exception e) {
            throw new RuntimeException("Failed to deserialize JSON to type " + type.getName(), e);
        }
    }

    /**
     * Renders an arbitrary value as a JSON string, for log lines.
     */
    public static String toJson(Object value) {
        try {
            return SHARED.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
