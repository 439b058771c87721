package com.iksanov.checkpoint.node.scheduling;

/**
 * Handle to a one-shot delayed task.
 */
public interface ScheduledTask {

    /**
     * Prevents the task from running if it has not started yet.
     *
     * @return {@code true} if this call cancelled a pending task
     */
    boolean cancel();

    boolean isDone();
}
