package com.iksanov.checkpoint.common.exception;

import java.util.Objects;

/**
 * A rollback that did not replace the current state.
 * The durable state is left exactly as it was before the attempt.
 */
public class RollbackException extends CheckpointException {

    public enum Reason {
        NOT_FOUND,
        WRITE_FAILED
    }

    private final Reason reason;
    private final String snapshotId;

    public RollbackException(Reason reason, String snapshotId, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.snapshotId = snapshotId;
    }

    public static RollbackException notFound(String snapshotId) {
        return new RollbackException(Reason.NOT_FOUND, snapshotId, "Snapshot not found: " + snapshotId,
                new SnapshotNotFoundException(snapshotId));
    }

    public static RollbackException writeFailed(String snapshotId, PersistenceException cause) {
        return new RollbackException(Reason.WRITE_FAILED, snapshotId,
                "Failed to apply snapshot state " + snapshotId + ": " + cause.getMessage(), cause);
    }

    public Reason reason() {
        return reason;
    }

    public String snapshotId() {
        return snapshotId;
    }
}
