package com.iksanov.checkpoint.node.event;

import com.iksanov.checkpoint.node.storage.StateDocument;

import java.util.List;

/**
 * Host-side observer of checkpoint events. All methods default to no-ops.
 * <p>
 * {@link #onStateReplaced} is the host's cue to drop in-memory caches and reinitialize from the
 * restored state; the core performs no restart of its own.
 */
public interface CheckpointListener {

    default void onStateReplaced(StateDocument newState) {}

    default void onSnapshotCreated(String snapshotId) {}

    default void onSnapshotEvicted(String snapshotId) {}

    default void onDocumentsPruned(List<String> documentIds) {}
}
