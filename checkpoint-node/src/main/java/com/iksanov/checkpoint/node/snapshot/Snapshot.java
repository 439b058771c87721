package com.iksanov.checkpoint.node.snapshot;

import com.iksanov.checkpoint.node.storage.StateDocument;

/**
 * Immutable, timestamped copy of the full persisted state.
 */
public record Snapshot(String id, long timestamp, String description, StateDocument state) {

    public Snapshot {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id cannot be null or blank");
        if (description == null) throw new IllegalArgumentException("description cannot be null");
        if (state == null) throw new IllegalArgumentException("state cannot be null");
    }

    public SnapshotInfo info() {
        return new SnapshotInfo(id, timestamp, description);
    }
}
