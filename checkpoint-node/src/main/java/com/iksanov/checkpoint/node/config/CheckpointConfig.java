package com.iksanov.checkpoint.node.config;

import com.iksanov.checkpoint.common.exception.ConfigurationException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables for the checkpoint node.
 * Simple and immutable, loaded from the environment or taken from {@link #defaults()}.
 */
public record CheckpointConfig(
        int maxSnapshots,
        int maxDocuments,
        long autoRollbackDeadlineMs,
        long autoSaveIntervalMs,
        Path storageDirectory,
        long storageQuotaBytes
) {
    public static final int DEFAULT_MAX_SNAPSHOTS = 10;
    public static final int DEFAULT_MAX_DOCUMENTS = 100;
    public static final long DEFAULT_AUTO_ROLLBACK_DEADLINE_MS = 5 * 60 * 1000L;
    public static final long DEFAULT_AUTO_SAVE_INTERVAL_MS = 5 * 60 * 1000L;
    public static final long DEFAULT_STORAGE_QUOTA_BYTES = 5L * 1024 * 1024;
    public static final String DEFAULT_STORAGE_DIRECTORY = "checkpoint-data";

    public CheckpointConfig {
        if (maxSnapshots < 1) throw new ConfigurationException("maxSnapshots must be >= 1");
        if (maxDocuments < 2) throw new ConfigurationException("maxDocuments must be >= 2");
        if (autoRollbackDeadlineMs <= 0) throw new ConfigurationException("autoRollbackDeadlineMs must be > 0");
        if (autoSaveIntervalMs <= 0) throw new ConfigurationException("autoSaveIntervalMs must be > 0");
        if (storageDirectory == null) throw new ConfigurationException("storageDirectory cannot be null");
        if (storageQuotaBytes < 0) throw new ConfigurationException("storageQuotaBytes must be >= 0 (0 disables the quota)");
    }

    public static CheckpointConfig defaults() {
        return new CheckpointConfig(
                DEFAULT_MAX_SNAPSHOTS,
                DEFAULT_MAX_DOCUMENTS,
                DEFAULT_AUTO_ROLLBACK_DEADLINE_MS,
                DEFAULT_AUTO_SAVE_INTERVAL_MS,
                Path.of(DEFAULT_STORAGE_DIRECTORY),
                DEFAULT_STORAGE_QUOTA_BYTES
        );
    }

    public static CheckpointConfig fromEnv() {
        return new CheckpointConfig(
                getEnvInt("CHECKPOINT_MAX_SNAPSHOTS", DEFAULT_MAX_SNAPSHOTS),
                getEnvInt("CHECKPOINT_MAX_DOCUMENTS", DEFAULT_MAX_DOCUMENTS),
                getEnvLong("CHECKPOINT_AUTO_ROLLBACK_DEADLINE_MS", DEFAULT_AUTO_ROLLBACK_DEADLINE_MS),
                getEnvLong("CHECKPOINT_AUTO_SAVE_INTERVAL_MS", DEFAULT_AUTO_SAVE_INTERVAL_MS),
                Path.of(getEnv("CHECKPOINT_STORAGE_DIR", DEFAULT_STORAGE_DIRECTORY)),
                getEnvLong("CHECKPOINT_STORAGE_QUOTA_BYTES", DEFAULT_STORAGE_QUOTA_BYTES)
        );
    }

    public CheckpointConfig withMaxSnapshots(int value) {
        return new CheckpointConfig(value, maxDocuments, autoRollbackDeadlineMs, autoSaveIntervalMs, storageDirectory, storageQuotaBytes);
    }

    public CheckpointConfig withMaxDocuments(int value) {
        return new CheckpointConfig(maxSnapshots, value, autoRollbackDeadlineMs, autoSaveIntervalMs, storageDirectory, storageQuotaBytes);
    }

    public CheckpointConfig withAutoRollbackDeadlineMs(long value) {
        return new CheckpointConfig(maxSnapshots, maxDocuments, value, autoSaveIntervalMs, storageDirectory, storageQuotaBytes);
    }

    public CheckpointConfig withStorageDirectory(Path value) {
        return new CheckpointConfig(maxSnapshots, maxDocuments, autoRollbackDeadlineMs, autoSaveIntervalMs, value, storageQuotaBytes);
    }

    public CheckpointConfig withStorageQuotaBytes(long value) {
        return new CheckpointConfig(maxSnapshots, maxDocuments, autoRollbackDeadlineMs, autoSaveIntervalMs, storageDirectory, value);
    }

    public Duration autoRollbackDeadline() {
        return Duration.ofMillis(autoRollbackDeadlineMs);
    }

    public Duration autoSaveInterval() {
        return Duration.ofMillis(autoSaveIntervalMs);
    }

    @Override
    public String toString() {
        return String.format("CheckpointConfig[snapshots<=%d, documents<=%d, rollbackDeadline=%dms, autoSave=%dms, dir=%s, quota=%d bytes]",
                maxSnapshots, maxDocuments, autoRollbackDeadlineMs, autoSaveIntervalMs, storageDirectory, storageQuotaBytes);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private static int getEnvInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long getEnvLong(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
