package com.iksanov.checkpoint.common.exception;

import java.util.Objects;

/**
 * Failure to write to, read from or reach the storage medium.
 * <p>
 * {@link Reason#QUOTA_EXCEEDED} is the only reason callers are expected to recover from
 * locally (by pruning and retrying once); everything else is surfaced as-is.
 */
public class PersistenceException extends CheckpointException {

    public enum Reason {
        QUOTA_EXCEEDED,
        SERIALIZATION_FAILED,
        MEDIUM_UNAVAILABLE
    }

    private final Reason reason;

    public PersistenceException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public PersistenceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public static PersistenceException quotaExceeded(String message) {
        return new PersistenceException(Reason.QUOTA_EXCEEDED, message);
    }

    public static PersistenceException unavailable(String message, Throwable cause) {
        return new PersistenceException(Reason.MEDIUM_UNAVAILABLE, message, cause);
    }

    public Reason reason() {
        return reason;
    }

    public boolean isQuotaExceeded() {
        return reason == Reason.QUOTA_EXCEEDED;
    }
}
