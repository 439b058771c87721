package com.iksanov.checkpoint.node.document;

import java.time.Instant;

/**
 * @param oldestCreatedAt {@code null} when the store is empty
 * @param newestCreatedAt {@code null} when the store is empty
 */
public record DocumentStats(int totalDocuments, int totalEntries, Instant oldestCreatedAt, Instant newestCreatedAt) {
    public static DocumentStats empty() {
        return new DocumentStats(0, 0, null, null);
    }
}
