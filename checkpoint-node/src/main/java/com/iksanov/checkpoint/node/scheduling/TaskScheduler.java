package com.iksanov.checkpoint.node.scheduling;

import java.time.Duration;

/**
 * Source of delayed one-shot and periodic tasks.
 * Production code uses {@link ExecutorTaskScheduler}; tests substitute a manually advanced clock.
 */
public interface TaskScheduler extends AutoCloseable {

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    @Override
    void close();
}
