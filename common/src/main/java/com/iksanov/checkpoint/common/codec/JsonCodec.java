package com.iksanov.checkpoint.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.iksanov.checkpoint.common.exception.SerializationException;

import java.util.Objects;

/**
 * JSON text codec shared by every persisted value.
 * <p>
 * Values are stored as UTF-8 JSON text, one document per storage key. Decoding failures are
 * reported as {@link SerializationException}; callers decide whether a malformed payload is
 * fatal or treated as absent.
 */
public final class JsonCodec {

    private static final JsonCodec DEFAULT = new JsonCodec(defaultMapper());
    private final ObjectMapper mapper;

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static JsonCodec defaultCodec() {
        return DEFAULT;
    }

    private static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public String encode(Object value) {
        Objects.requireNonNull(value, "value");
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(String json, Class<T> type) {
        Objects.requireNonNull(json, "json");
        try {
            T value = mapper.readValue(json, type);
            if (value == null) throw new SerializationException("Payload decoded to null: " + type.getSimpleName());
            return value;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    public <T> T decode(String json, TypeReference<T> type) {
        Objects.requireNonNull(json, "json");
        try {
            T value = mapper.readValue(json, type);
            if (value == null) throw new SerializationException("Payload decoded to null: " + type.getType());
            return value;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to decode " + type.getType(), e);
        }
    }

    public ObjectNode parseObject(String json) {
        Objects.requireNonNull(json, "json");
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) throw new SerializationException("Expected a JSON object");
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to parse JSON object", e);
        }
    }

    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    public ObjectNode createObjectNode() {
        return mapper.createObjectNode();
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
