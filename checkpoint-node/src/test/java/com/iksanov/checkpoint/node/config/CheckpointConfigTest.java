package com.iksanov.checkpoint.node.config;

import com.iksanov.checkpoint.common.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointConfigTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaultsShouldMatchDocumentedValues() {
        CheckpointConfig config = CheckpointConfig.defaults();

        assertEquals(10, config.maxSnapshots());
        assertEquals(100, config.maxDocuments());
        assertEquals(Duration.ofMinutes(5), config.autoRollbackDeadline());
        assertEquals(Duration.ofMinutes(5), config.autoSaveInterval());
        assertEquals(Path.of("checkpoint-data"), config.storageDirectory());
        assertEquals(5L * 1024 * 1024, config.storageQuotaBytes());
    }

    @Test
    @DisplayName("Invalid tunables are rejected")
    void shouldRejectInvalidValues() {
        CheckpointConfig defaults = CheckpointConfig.defaults();

        assertThrows(ConfigurationException.class, () -> defaults.withMaxSnapshots(0));
        assertThrows(ConfigurationException.class, () -> defaults.withMaxDocuments(1));
        assertThrows(ConfigurationException.class, () -> defaults.withAutoRollbackDeadlineMs(0));
        assertThrows(ConfigurationException.class, () -> defaults.withStorageQuotaBytes(-1));
        assertThrows(ConfigurationException.class, () -> defaults.withStorageDirectory(null));
    }

    @Test
    @DisplayName("Withers change only their own field")
    void withersShouldChangeOneField() {
        CheckpointConfig config = CheckpointConfig.defaults().withMaxSnapshots(3).withStorageQuotaBytes(0);

        assertEquals(3, config.maxSnapshots());
        assertEquals(0, config.storageQuotaBytes());
        assertEquals(100, config.maxDocuments());
    }

    @Test
    @DisplayName("fromEnv() yields a valid config")
    void fromEnvShouldProduceValidConfig() {
        CheckpointConfig config = assertDoesNotThrow(CheckpointConfig::fromEnv);
        assertTrue(config.maxSnapshots() >= 1);
    }
}
