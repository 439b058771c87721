package com.iksanov.checkpoint.node.save;

import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import com.iksanov.checkpoint.node.scheduling.ScheduledTask;
import com.iksanov.checkpoint.node.scheduling.TaskScheduler;
import com.iksanov.checkpoint.node.storage.DurableStateStore;
import com.iksanov.checkpoint.node.storage.StateDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Periodically saves the host's live state through the {@link DurableStateStore}.
 * Each save stamps {@code lastSaved}. Failures in the periodic task are logged and counted.
 * <p>
 * The state source is read under the store's write lock, so a rollback that replaces the state
 * is never overwritten by a value read before it.
 */
public class AutoSaver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutoSaver.class);
    private final DurableStateStore stateStore;
    private final Supplier<StateDocument> stateSource;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final CheckpointMetrics metrics;
    private final Object monitor = new Object();
    private Duration interval;
    private ScheduledTask task;
    private volatile Instant lastSavedAt;

    public AutoSaver(DurableStateStore stateStore,
                     Supplier<StateDocument> stateSource,
                     TaskScheduler scheduler,
                     Duration interval,
                     Clock clock,
                     CheckpointMetrics metrics) {
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore cannot be null");
        this.stateSource = Objects.requireNonNull(stateSource, "stateSource cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.interval = requirePositive(interval);
    }

    public void start() {
        synchronized (monitor) {
            if (task != null) {
                log.debug("AutoSaver already running");
                return;
            }
            task = scheduler.scheduleAtFixedRate(() -> saveNow(false), interval, interval);
            log.info("AutoSaver started (interval={}ms)", interval.toMillis());
        }
    }

    public void stop() {
        synchronized (monitor) {
            if (task == null) return;
            task.cancel();
            task = null;
            log.info("AutoSaver stopped");
        }
    }

    /**
     * Changes the period. A running saver is restarted with the new interval.
     */
    public void setInterval(Duration newInterval) {
        Duration checked = requirePositive(newInterval);
        synchronized (monitor) {
            interval = checked;
            if (task != null) {
                task.cancel();
                task = scheduler.scheduleAtFixedRate(() -> saveNow(false), interval, interval);
                log.info("AutoSaver interval changed to {}ms", interval.toMillis());
            }
        }
    }

    /**
     * Saves the current state immediately.
     *
     * @param manual {@code true} when requested by the user, only affects logging
     * @return whether the state was written
     */
    public boolean saveNow(boolean manual) {
        try {
            Instant now = clock.instant();
            Optional<StateDocument> saved = stateStore.saveFrom(() -> {
                StateDocument current = stateSource.get();
                return current == null ? null : current.withLastSaved(now);
            });
            if (saved.isEmpty()) {
                log.debug("No state to save");
                return false;
            }
            lastSavedAt = now;
            if (manual) {
                log.info("State saved manually at {}", now);
            } else {
                log.debug("State auto-saved at {}", now);
            }
            return true;
        } catch (RuntimeException e) {
            metrics.recordPersistenceFailure();
            log.error("Failed to save state ({}): {}", manual ? "manual" : "auto", e.getMessage(), e);
            return false;
        }
    }

    public boolean isRunning() {
        synchronized (monitor) {
            return task != null;
        }
    }

    public Duration interval() {
        synchronized (monitor) {
            return interval;
        }
    }

    /**
     * @return the instant of the last successful save by this saver, or {@code null}
     */
    public Instant lastSavedAt() {
        return lastSavedAt;
    }

    @Override
    public void close() {
        stop();
    }

    private static Duration requirePositive(Duration value) {
        Objects.requireNonNull(value, "interval");
        if (value.isNegative() || value.isZero()) throw new IllegalArgumentException("interval must be positive");
        return value;
    }
}
