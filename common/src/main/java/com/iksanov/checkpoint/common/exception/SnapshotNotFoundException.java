package com.iksanov.checkpoint.common.exception;

public class SnapshotNotFoundException extends CheckpointException {
    private final String snapshotId;

    public SnapshotNotFoundException(String snapshotId) {
        super("Snapshot with ID " + snapshotId + " not found");
        this.snapshotId = snapshotId;
    }

    public String snapshotId() {
        return snapshotId;
    }
}
