package com.iksanov.checkpoint.node.storage;

import java.util.Optional;
import java.util.Set;

/**
 * Opaque string key-value medium with a bounded capacity.
 * <p>
 * Implementations must replace a value atomically: a reader sees either the previous value or
 * the new one, never a partial write. A write rejected for lack of space throws
 * {@link com.iksanov.checkpoint.common.exception.PersistenceException} with reason
 * {@code QUOTA_EXCEEDED} and leaves the previous value in place.
 */
public interface StorageMedium extends AutoCloseable {

    Optional<String> get(String key);
    void set(String key, String value);
    void remove(String key);
    Set<String> keys();
    long usedBytes();

    @Override
    void close();
}
