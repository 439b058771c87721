package com.iksanov.checkpoint.node.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.common.exception.PersistenceException;
import com.iksanov.checkpoint.common.exception.SerializationException;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One storage key bound to one JSON-encoded type.
 * <p>
 * Writes always replace the whole value. A missing or malformed payload reads as absent; a medium
 * that cannot be read raises {@link PersistenceException} so callers never mistake it for no data.
 */
public final class JsonSlot<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonSlot.class);
    private final StorageMedium medium;
    private final String key;
    private final JsonCodec codec;
    private final Function<String, T> decoder;
    private final CheckpointMetrics metrics;

    private JsonSlot(StorageMedium medium, String key, JsonCodec codec, Function<String, T> decoder, CheckpointMetrics metrics) {
        this.medium = Objects.requireNonNull(medium, "medium");
        this.key = Objects.requireNonNull(key, "key");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.decoder = decoder;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static <T> JsonSlot<T> of(StorageMedium medium, String key, JsonCodec codec, Class<T> type, CheckpointMetrics metrics) {
        Objects.requireNonNull(type, "type");
        return new JsonSlot<>(medium, key, codec, json -> codec.decode(json, type), metrics);
    }

    public static <T> JsonSlot<T> of(StorageMedium medium, String key, JsonCodec codec, TypeReference<T> type, CheckpointMetrics metrics) {
        Objects.requireNonNull(type, "type");
        return new JsonSlot<>(medium, key, codec, json -> codec.decode(json, type), metrics);
    }

    /**
     * @throws PersistenceException if the medium could not be read
     */
    public Optional<T> read() {
        Optional<String> raw;
        try {
            raw = medium.get(key);
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure();
            log.error("Failed to read '{}' from storage: {}", key, e.getMessage());
            throw e;
        }
        if (raw.isEmpty()) return Optional.empty();

        try {
            return Optional.of(decoder.apply(raw.get()));
        } catch (SerializationException e) {
            log.warn("Stored value under '{}' is malformed, treating as absent: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(T value) {
        Objects.requireNonNull(value, "value");
        String json;
        try {
            json = codec.encode(value);
        } catch (SerializationException e) {
            metrics.recordPersistenceFailure();
            throw new PersistenceException(PersistenceException.Reason.SERIALIZATION_FAILED,
                    "Failed to serialize value for '" + key + "'", e);
        }

        Timer.Sample sample = metrics.startWriteTimer();
        try {
            medium.set(key, json);
            log.trace("Wrote '{}' ({} chars)", key, json.length());
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure();
            if (e.isQuotaExceeded()) metrics.recordQuotaExceeded();
            throw e;
        } finally {
            metrics.stopWriteTimer(sample);
        }
    }

    public void clear() {
        try {
            medium.remove(key);
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure();
            throw e;
        }
    }

    public String key() {
        return key;
    }
}
