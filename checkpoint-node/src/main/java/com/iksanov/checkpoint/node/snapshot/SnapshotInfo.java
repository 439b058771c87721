package com.iksanov.checkpoint.node.snapshot;

/**
 * Listing view of a snapshot, without its state payload.
 */
public record SnapshotInfo(String id, long timestamp, String description) {}
