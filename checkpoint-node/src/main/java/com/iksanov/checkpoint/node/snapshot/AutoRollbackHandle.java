package com.iksanov.checkpoint.node.snapshot;

import com.iksanov.checkpoint.node.scheduling.ScheduledTask;

import java.util.Optional;

/**
 * Watchdog armed by {@link SnapshotManager#prepareAutoRollback(String)}.
 * <p>
 * Moves from {@code ARMED} to exactly one of {@code DISARMED} or {@code FIRED}; the transition is
 * made under the manager's lock, so a disarm racing the deadline has a single winner.
 * A handle created when there was nothing to checkpoint is {@code INACTIVE} and ignores
 * {@link #disarm()}.
 */
public final class AutoRollbackHandle {

    public enum State {
        ARMED,
        DISARMED,
        FIRED,
        INACTIVE
    }

    private final String snapshotId;
    private final String operation;
    private final SnapshotManager owner;
    private volatile State state;
    private ScheduledTask task;

    AutoRollbackHandle(String snapshotId, String operation, SnapshotManager owner) {
        this.snapshotId = snapshotId;
        this.operation = operation;
        this.owner = owner;
        this.state = owner == null ? State.INACTIVE : State.ARMED;
    }

    static AutoRollbackHandle inactive(String operation) {
        return new AutoRollbackHandle(null, operation, null);
    }

    /**
     * Cancels the pending rollback. Safe to call any number of times, including after the
     * deadline has already fired.
     */
    public void disarm() {
        if (owner != null) owner.disarm(this);
    }

    public Optional<String> snapshotId() {
        return Optional.ofNullable(snapshotId);
    }

    public String operation() {
        return operation;
    }

    public State state() {
        return state;
    }

    public boolean isArmed() {
        return state == State.ARMED;
    }

    // Callers hold the manager lock.
    boolean transition(State from, State to) {
        if (state != from) return false;
        state = to;
        return true;
    }

    void attach(ScheduledTask task) {
        this.task = task;
    }

    ScheduledTask task() {
        return task;
    }

    @Override
    public String toString() {
        return "AutoRollbackHandle[" + operation + ", snapshot=" + snapshotId + ", " + state + "]";
    }
}
