package com.iksanov.checkpoint.node.snapshot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.common.exception.PersistenceException;
import com.iksanov.checkpoint.common.exception.RollbackException;
import com.iksanov.checkpoint.common.util.IdGenerator;
import com.iksanov.checkpoint.node.event.CheckpointEventNotifier;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import com.iksanov.checkpoint.node.scheduling.ScheduledTask;
import com.iksanov.checkpoint.node.scheduling.TaskScheduler;
import com.iksanov.checkpoint.node.storage.DurableStateStore;
import com.iksanov.checkpoint.node.storage.JsonSlot;
import com.iksanov.checkpoint.node.storage.StateDocument;
import com.iksanov.checkpoint.node.storage.StorageMedium;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded history of state snapshots with restore and a deadline-armed auto-rollback.
 *
 * <p>Design:
 * <ul>
 *   <li>Snapshots are kept oldest first; once the list grows past {@code maxSnapshots} the
 *       oldest entries are evicted. There is no pinning for snapshots.</li>
 *   <li>Every mutation builds a candidate list, persists it, and only then publishes it, so a
 *       failed write leaves the in-memory list untouched.</li>
 *   <li>Rollback writes the snapshot's state through {@link DurableStateStore} and raises
 *       {@code stateReplaced}; the snapshot itself stays in the list.</li>
 *   <li>One lock guards the list, rollbacks and watchdog transitions, so a disarm racing a
 *       firing deadline resolves to a single outcome.</li>
 * </ul>
 */
public class SnapshotManager implements AutoCloseable {

    public static final String SNAPSHOTS_KEY = "checkpoint_snapshots";
    public static final String AUTO_SNAPSHOT_PREFIX = "Auto-snapshot before: ";

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);
    private static final TypeReference<List<Snapshot>> SNAPSHOT_LIST = new TypeReference<>() {};
    private final DurableStateStore stateStore;
    private final JsonSlot<List<Snapshot>> slot;
    private final CheckpointEventNotifier notifier;
    private final CheckpointMetrics metrics;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final int maxSnapshots;
    private final Duration autoRollbackDeadline;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<AutoRollbackHandle> armed = ConcurrentHashMap.newKeySet();
    private volatile List<Snapshot> snapshots;
    private volatile boolean closed;

    public SnapshotManager(int maxSnapshots,
                           Duration autoRollbackDeadline,
                           DurableStateStore stateStore,
                           StorageMedium medium,
                           JsonCodec codec,
                           CheckpointEventNotifier notifier,
                           CheckpointMetrics metrics,
                           TaskScheduler scheduler,
                           Clock clock) {
        if (maxSnapshots < 1) throw new IllegalArgumentException("maxSnapshots must be >= 1");
        Objects.requireNonNull(autoRollbackDeadline, "autoRollbackDeadline");
        if (autoRollbackDeadline.isNegative() || autoRollbackDeadline.isZero()) {
            throw new IllegalArgumentException("autoRollbackDeadline must be positive");
        }
        this.maxSnapshots = maxSnapshots;
        this.autoRollbackDeadline = autoRollbackDeadline;
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore cannot be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.slot = JsonSlot.of(medium, SNAPSHOTS_KEY, codec, SNAPSHOT_LIST, metrics);
        this.snapshots = loadSnapshots();
        metrics.updateSnapshotCount(snapshots.size());
        log.info("SnapshotManager initialized: {} snapshot(s) loaded, maxSnapshots={}, autoRollbackDeadline={}ms",
                snapshots.size(), maxSnapshots, autoRollbackDeadline.toMillis());
    }

    private List<Snapshot> loadSnapshots() {
        List<Snapshot> loaded = new ArrayList<>(slot.read().orElse(List.of()));
        loaded.removeIf(Objects::isNull);
        if (loaded.size() > maxSnapshots) {
            int excess = loaded.size() - maxSnapshots;
            log.warn("Persisted snapshot list holds {} entries, trimming {} oldest to maxSnapshots={}", loaded.size(), excess, maxSnapshots);
            loaded = new ArrayList<>(loaded.subList(excess, loaded.size()));
        }
        return List.copyOf(loaded);
    }

    /**
     * Captures the current state under {@code description}.
     *
     * @return the new snapshot id, or empty when there is no current state to capture
     * @throws PersistenceException if the updated list could not be persisted; nothing changes
     */
    public Optional<String> createSnapshot(String description) {
        Objects.requireNonNull(description, "description");
        lock.lock();
        try {
            ensureOpen();
            Optional<StateDocument> current = stateStore.load();
            if (current.isEmpty()) {
                log.debug("No current state, skipping snapshot '{}'", description);
                return Optional.empty();
            }

            long now = clock.millis();
            Snapshot snapshot = new Snapshot(newSnapshotId(now), now, description, current.get());

            List<Snapshot> candidate = new ArrayList<>(snapshots.size() + 1);
            candidate.addAll(snapshots);
            candidate.add(snapshot);
            List<Snapshot> evicted = new ArrayList<>();
            while (candidate.size() > maxSnapshots) {
                evicted.add(candidate.remove(0));
            }

            try {
                slot.write(candidate);
            } catch (PersistenceException e) {
                log.error("Failed to persist snapshot '{}', discarding it: {}", description, e.getMessage());
                throw e;
            }
            snapshots = List.copyOf(candidate);

            metrics.recordSnapshotCreated();
            metrics.updateSnapshotCount(snapshots.size());
            log.info("Snapshot {} created: '{}'", snapshot.id(), description);
            notifier.snapshotCreated(snapshot.id());

            for (Snapshot old : evicted) {
                metrics.recordSnapshotEvicted();
                log.debug("Snapshot {} evicted ('{}')", old.id(), old.description());
                notifier.snapshotEvicted(old.id());
            }
            return Optional.of(snapshot.id());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the current state with the snapshot's state. The snapshot is kept and may be
     * restored again.
     *
     * @throws RollbackException {@code NOT_FOUND} for an unknown id, {@code WRITE_FAILED} if the
     *                           state could not be written; the current state is unchanged
     * @throws IllegalStateException if the manager is closed
     */
    public void rollback(String snapshotId) {
        Objects.requireNonNull(snapshotId, "snapshotId");
        lock.lock();
        try {
            ensureOpen();
            Snapshot snapshot = find(snapshotId).orElse(null);
            if (snapshot == null) {
                metrics.recordRollbackFailed();
                log.warn("Rollback failed: snapshot {} not found", snapshotId);
                throw RollbackException.notFound(snapshotId);
            }

            // listeners run before the store accepts another write
            try {
                stateStore.saveThen(snapshot.state(), () -> {
                    metrics.recordRollbackApplied();
                    log.info("System rolled back to {}: '{}'", snapshotId, snapshot.description());
                    notifier.stateReplaced(snapshot.state());
                });
            } catch (PersistenceException e) {
                metrics.recordRollbackFailed();
                log.error("Rollback to {} failed to apply snapshot state: {}", snapshotId, e.getMessage(), e);
                throw RollbackException.writeFailed(snapshotId, e);
            }
        } finally {
            lock.unlock();
        }
    }

    public List<SnapshotInfo> listSnapshots() {
        List<Snapshot> current = snapshots;
        List<SnapshotInfo> result = new ArrayList<>(current.size());
        for (Snapshot snapshot : current) {
            result.add(snapshot.info());
        }
        return result;
    }

    public Optional<SnapshotInfo> getSnapshot(String snapshotId) {
        return find(snapshotId).map(Snapshot::info);
    }

    /**
     * @return {@code true} if a snapshot was removed
     * @throws PersistenceException if the updated list could not be persisted; nothing changes
     */
    public boolean deleteSnapshot(String snapshotId) {
        Objects.requireNonNull(snapshotId, "snapshotId");
        lock.lock();
        try {
            ensureOpen();
            List<Snapshot> candidate = new ArrayList<>(snapshots);
            if (!candidate.removeIf(s -> s.id().equals(snapshotId))) return false;

            slot.write(candidate);
            snapshots = List.copyOf(candidate);
            metrics.updateSnapshotCount(snapshots.size());
            log.info("Snapshot {} deleted", snapshotId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return snapshots.size();
    }

    /**
     * Snapshots the current state and arms a deadline. Unless the returned handle is disarmed in
     * time, the snapshot is restored automatically when the deadline expires.
     * <p>
     * When there is no current state nothing is armed and an inactive handle is returned.
     */
    public AutoRollbackHandle prepareAutoRollback(String operation) {
        Objects.requireNonNull(operation, "operation");
        lock.lock();
        try {
            Optional<String> snapshotId = createSnapshot(AUTO_SNAPSHOT_PREFIX + operation);
            if (snapshotId.isEmpty()) {
                log.debug("Nothing to checkpoint before '{}', auto-rollback not armed", operation);
                return AutoRollbackHandle.inactive(operation);
            }

            AutoRollbackHandle handle = new AutoRollbackHandle(snapshotId.get(), operation, this);
            handle.attach(scheduler.schedule(() -> fire(handle), autoRollbackDeadline));
            armed.add(handle);
            log.info("Auto-rollback armed for '{}' (snapshot={}, deadline={}ms)", operation, snapshotId.get(), autoRollbackDeadline.toMillis());
            return handle;
        } finally {
            lock.unlock();
        }
    }

    void disarm(AutoRollbackHandle handle) {
        lock.lock();
        try {
            if (!handle.transition(AutoRollbackHandle.State.ARMED, AutoRollbackHandle.State.DISARMED)) {
                log.trace("Disarm ignored for {}", handle);
                return;
            }
            ScheduledTask task = handle.task();
            if (task != null) task.cancel();
            armed.remove(handle);
            metrics.recordWatchdogDisarmed();
            log.info("Auto-rollback disarmed for '{}'", handle.operation());
        } finally {
            lock.unlock();
        }
    }

    private void fire(AutoRollbackHandle handle) {
        lock.lock();
        try {
            if (!handle.transition(AutoRollbackHandle.State.ARMED, AutoRollbackHandle.State.FIRED)) {
                log.trace("Deadline for {} superseded, not rolling back", handle);
                return;
            }
            armed.remove(handle);
            metrics.recordWatchdogFired();
            String snapshotId = handle.snapshotId().orElseThrow();
            log.warn("Operation '{}' was not confirmed within {}ms, rolling back to {}",
                    handle.operation(), autoRollbackDeadline.toMillis(), snapshotId);
            try {
                rollback(snapshotId);
            } catch (RollbackException e) {
                log.error("Auto-rollback for '{}' failed ({}): {}", handle.operation(), e.reason(), e.getMessage(), e);
            }
        } finally {
            lock.unlock();
        }
    }

    public int armedCount() {
        return armed.size();
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            for (AutoRollbackHandle handle : List.copyOf(armed)) {
                disarm(handle);
            }
            closed = true;
            log.info("SnapshotManager closed");
        } finally {
            lock.unlock();
        }
    }

    private Optional<Snapshot> find(String snapshotId) {
        for (Snapshot snapshot : snapshots) {
            if (snapshot.id().equals(snapshotId)) return Optional.of(snapshot);
        }
        return Optional.empty();
    }

    private String newSnapshotId(long now) {
        String id = IdGenerator.snapshotId(now);
        while (find(id).isPresent()) {
            id = IdGenerator.snapshotId(now);
        }
        return id;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("SnapshotManager is closed");
    }
}
