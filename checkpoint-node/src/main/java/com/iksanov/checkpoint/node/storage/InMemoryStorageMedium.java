package com.iksanov.checkpoint.node.storage;

import com.iksanov.checkpoint.common.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed medium with a byte quota, the local-storage analogue.
 * Usage is counted as UTF-8 bytes of every key plus its value.
 */
public class InMemoryStorageMedium implements StorageMedium {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageMedium.class);
    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final long quotaBytes;
    private long usedBytes;
    private volatile boolean closed;

    public InMemoryStorageMedium() {
        this(0);
    }

    /**
     * @param quotaBytes maximum total size, {@code 0} for unbounded
     */
    public InMemoryStorageMedium(long quotaBytes) {
        if (quotaBytes < 0) throw new IllegalArgumentException("quotaBytes must be >= 0");
        this.quotaBytes = quotaBytes;
        log.debug("InMemoryStorageMedium initialized: quota={} bytes", quotaBytes == 0 ? "unbounded" : quotaBytes);
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key");
        ensureOpen();
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public synchronized void set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        ensureOpen();

        String previous = data.get(key);
        long delta = sizeOf(key, value) - (previous == null ? 0 : sizeOf(key, previous));
        if (quotaBytes > 0 && usedBytes + delta > quotaBytes) {
            throw PersistenceException.quotaExceeded(String.format(
                    "Storage quota exceeded writing '%s': used=%d, delta=%d, quota=%d", key, usedBytes, delta, quotaBytes));
        }
        data.put(key, value);
        usedBytes += delta;
    }

    @Override
    public synchronized void remove(String key) {
        Objects.requireNonNull(key, "key");
        ensureOpen();
        String previous = data.remove(key);
        if (previous != null) usedBytes -= sizeOf(key, previous);
    }

    @Override
    public Set<String> keys() {
        ensureOpen();
        return Set.copyOf(data.keySet());
    }

    @Override
    public synchronized long usedBytes() {
        return usedBytes;
    }

    public long quotaBytes() {
        return quotaBytes;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) throw PersistenceException.unavailable("Storage medium is closed", null);
    }

    private static long sizeOf(String key, String value) {
        return key.getBytes(StandardCharsets.UTF_8).length + (long) value.getBytes(StandardCharsets.UTF_8).length;
    }
}
