package com.iksanov.checkpoint.node.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.iksanov.checkpoint.common.codec.JsonCodec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The application's entire persisted state as one JSON object.
 * <p>
 * Instances are immutable: the wrapped tree is copied on construction and every accessor hands
 * out copies, so a document held by a snapshot can never observe later changes to the live state.
 * Equality is structural.
 */
public final class StateDocument {

    public static final String SETTINGS = "settings";
    public static final String MEMORY = "memory";
    public static final String CONTEXT = "context";
    public static final String CHAT_HISTORY = "chatHistory";
    public static final String LAST_SAVED = "lastSaved";

    private static final JsonCodec CODEC = JsonCodec.defaultCodec();
    private final ObjectNode root;

    private StateDocument(ObjectNode root) {
        this.root = root;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StateDocument of(ObjectNode json) {
        Objects.requireNonNull(json, "json");
        return new StateDocument(normalized(json));
    }

    public static StateDocument empty() {
        return new StateDocument(CODEC.createObjectNode());
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    public Optional<JsonNode> get(String field) {
        JsonNode node = root.get(field);
        return node == null ? Optional.empty() : Optional.of(node.deepCopy());
    }

    public <T> Optional<T> get(String field, Class<T> type) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return Optional.empty();
        return Optional.of(CODEC.mapper().convertValue(node, type));
    }

    public Optional<StateSettings> settings() {
        return get(SETTINGS, StateSettings.class);
    }

    public Optional<Instant> lastSaved() {
        JsonNode node = root.get(LAST_SAVED);
        if (node == null || !node.isTextual()) return Optional.empty();
        try {
            return Optional.of(Instant.parse(node.asText()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public boolean has(String field) {
        return root.has(field);
    }

    public Set<String> fieldNames() {
        Set<String> names = new TreeSet<>();
        root.fieldNames().forEachRemaining(names::add);
        return names;
    }

    public int size() {
        return root.size();
    }

    public StateDocument with(String field, Object value) {
        Objects.requireNonNull(field, "field");
        ObjectNode copy = root.deepCopy();
        copy.set(field, CODEC.toTree(value));
        return new StateDocument(normalized(copy));
    }

    public StateDocument without(String field) {
        if (!root.has(field)) return this;
        ObjectNode copy = root.deepCopy();
        copy.remove(field);
        return new StateDocument(copy);
    }

    public StateDocument withLastSaved(Instant instant) {
        return with(LAST_SAVED, instant.toString());
    }

    // Re-reads the tree from its text form so numeric node types match what a decoded document holds.
    private static ObjectNode normalized(ObjectNode node) {
        return CODEC.parseObject(CODEC.encode(node));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateDocument)) return false;
        return root.equals(((StateDocument) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "StateDocument" + fieldNames();
    }

    public static final class Builder {
        private final ObjectNode node = CODEC.createObjectNode();

        private Builder() {}

        public Builder settings(StateSettings settings) {
            return put(SETTINGS, settings);
        }

        public Builder memory(Object memory) {
            return put(MEMORY, memory);
        }

        public Builder context(List<?> context) {
            return put(CONTEXT, new ArrayList<>(context));
        }

        public Builder chatHistory(Object chatHistory) {
            return put(CHAT_HISTORY, chatHistory);
        }

        public Builder lastSaved(Instant instant) {
            return put(LAST_SAVED, instant.toString());
        }

        public Builder put(String field, Object value) {
            Objects.requireNonNull(field, "field");
            node.set(field, CODEC.toTree(value));
            return this;
        }

        public StateDocument build() {
            return new StateDocument(normalized(node));
        }
    }
}
