package com.iksanov.checkpoint.node.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single daemon thread.
 */
public class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 2;
    private final ScheduledExecutorService executor;
    private final String name;

    public ExecutorTaskScheduler(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(name);
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Uncaught exception in scheduler thread {}: {}", t.getName(), e.getMessage(), e));
            return thread;
        });
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        ScheduledFuture<?> future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        Objects.requireNonNull(task, "task");
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(task, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        if (executor.isShutdown()) return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scheduler {} did not terminate within {}s", name, SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Scheduler {} stopped", name);
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {
        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
