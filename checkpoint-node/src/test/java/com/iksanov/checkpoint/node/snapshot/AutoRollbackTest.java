package com.iksanov.checkpoint.node.snapshot;

import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.node.event.CheckpointEventNotifier;
import com.iksanov.checkpoint.node.event.CheckpointListener;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import com.iksanov.checkpoint.node.scheduling.ExecutorTaskScheduler;
import com.iksanov.checkpoint.node.storage.DurableStateStore;
import com.iksanov.checkpoint.node.storage.InMemoryStorageMedium;
import com.iksanov.checkpoint.node.storage.StateDocument;
import com.iksanov.checkpoint.node.testutil.ManualTaskScheduler;
import com.iksanov.checkpoint.node.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Watchdog behaviour of {@link SnapshotManager#prepareAutoRollback(String)}.
 * <p>
 * Covers:
 *  - Deadline expiry restores the pre-operation state
 *  - Disarm before the deadline keeps the post-operation state
 *  - Disarm idempotence and disarm after firing
 *  - No-op handle when there is nothing to checkpoint
 *  - Disarm racing the deadline from another thread
 */
class AutoRollbackTest {

    private static final Duration DEADLINE = Duration.ofMillis(100);

    private InMemoryStorageMedium medium;
    private CheckpointMetrics metrics;
    private CheckpointEventNotifier notifier;
    private DurableStateStore stateStore;
    private ManualTaskScheduler scheduler;
    private SnapshotManager manager;

    private final StateDocument preOperation = StateDocument.empty().with("step", "before");
    private final StateDocument postOperation = StateDocument.empty().with("step", "after");

    @BeforeEach
    void setUp() {
        medium = new InMemoryStorageMedium();
        metrics = new CheckpointMetrics();
        notifier = new CheckpointEventNotifier();
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        scheduler = new ManualTaskScheduler(clock);
        stateStore = new DurableStateStore(medium, JsonCodec.defaultCodec(), metrics).open();
        manager = new SnapshotManager(10, DEADLINE, stateStore, medium, JsonCodec.defaultCodec(),
                notifier, metrics, scheduler, clock);
    }

    @AfterEach
    void tearDown() {
        manager.close();
        scheduler.close();
    }

    @Test
    @DisplayName("Unconfirmed operation is rolled back when the deadline expires")
    void shouldRollBackAfterDeadline() {
        stateStore.save(preOperation);
        AutoRollbackHandle handle = manager.prepareAutoRollback("risky-op");
        stateStore.save(postOperation);

        scheduler.advance(Duration.ofMillis(150));

        assertEquals(preOperation, stateStore.load().orElseThrow());
        assertEquals(AutoRollbackHandle.State.FIRED, handle.state());
        assertEquals(1.0, metrics.watchdogFired());
        assertEquals(0, manager.armedCount());
    }

    @Test
    @DisplayName("Disarming before the deadline keeps the post-operation state")
    void disarmShouldPreventRollback() {
        stateStore.save(preOperation);
        AutoRollbackHandle handle = manager.prepareAutoRollback("risky-op");
        stateStore.save(postOperation);

        scheduler.advance(Duration.ofMillis(50));
        handle.disarm();
        scheduler.advance(Duration.ofMillis(100));

        assertEquals(postOperation, stateStore.load().orElseThrow());
        assertEquals(AutoRollbackHandle.State.DISARMED, handle.state());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    @DisplayName("The pre-operation snapshot is described after the operation")
    void shouldDescribeAutoSnapshot() {
        stateStore.save(preOperation);
        AutoRollbackHandle handle = manager.prepareAutoRollback("risky-op");

        SnapshotInfo info = manager.getSnapshot(handle.snapshotId().orElseThrow()).orElseThrow();
        assertEquals("Auto-snapshot before: risky-op", info.description());
        assertTrue(handle.isArmed());
        assertEquals("risky-op", handle.operation());
    }

    @Test
    @DisplayName("disarm() is idempotent")
    void disarmShouldBeIdempotent() {
        stateStore.save(preOperation);
        AutoRollbackHandle handle = manager.prepareAutoRollback("op");

        handle.disarm();
        handle.disarm();

        assertEquals(AutoRollbackHandle.State.DISARMED, handle.state());
        assertEquals(0, manager.armedCount());
    }

    @Test
    @DisplayName("disarm() after the deadline fired changes nothing")
    void disarmAfterFireShouldBeNoOp() {
        stateStore.save(preOperation);
        AutoRollbackHandle handle = manager.prepareAutoRollback("op");
        stateStore.save(postOperation);
        scheduler.advance(DEADLINE);

        handle.disarm();

        assertEquals(AutoRollbackHandle.State.FIRED, handle.state());
        assertEquals(preOperation, stateStore.load().orElseThrow());
    }

    @Test
    @DisplayName("Without a current state nothing is armed")
    void shouldReturnInactiveHandleWithoutState() {
        AutoRollbackHandle handle = manager.prepareAutoRollback("op");

        assertEquals(AutoRollbackHandle.State.INACTIVE, handle.state());
        assertTrue(handle.snapshotId().isEmpty());
        assertEquals(0, scheduler.pendingCount());
        assertDoesNotThrow(handle::disarm);
        assertTrue(manager.listSnapshots().isEmpty());
    }

    @Test
    @DisplayName("Firing the watchdog raises stateReplaced with the restored state")
    void firingShouldNotifyStateReplaced() {
        CheckpointListener listener = mock(CheckpointListener.class);
        notifier.register(listener);
        stateStore.save(preOperation);
        manager.prepareAutoRollback("op");

        scheduler.advance(DEADLINE);

        verify(listener).onStateReplaced(preOperation);
    }

    @Test
    @DisplayName("A watchdog whose snapshot was deleted fires without throwing")
    void firingForDeletedSnapshotShouldNotThrow() {
        stateStore.save(preOperation);
        AutoRollbackHandle handle = manager.prepareAutoRollback("op");
        manager.deleteSnapshot(handle.snapshotId().orElseThrow());
        stateStore.save(postOperation);

        assertDoesNotThrow(() -> scheduler.advance(DEADLINE));

        assertEquals(AutoRollbackHandle.State.FIRED, handle.state());
        assertEquals(postOperation, stateStore.load().orElseThrow());
        assertEquals(1.0, metrics.rollbacksFailed());
    }

    @Test
    @DisplayName("close() disarms every pending watchdog")
    void closeShouldDisarmAll() {
        stateStore.save(preOperation);
        AutoRollbackHandle first = manager.prepareAutoRollback("one");
        AutoRollbackHandle second = manager.prepareAutoRollback("two");

        manager.close();
        scheduler.advance(Duration.ofSeconds(1));

        assertEquals(AutoRollbackHandle.State.DISARMED, first.state());
        assertEquals(AutoRollbackHandle.State.DISARMED, second.state());
        assertEquals(preOperation, stateStore.load().orElseThrow());
    }

    @Test
    @DisplayName("A disarm racing the deadline ends in exactly one outcome")
    void disarmRacingDeadlineShouldResolveOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 50; i++) {
                stateStore.save(preOperation);
                AutoRollbackHandle handle = manager.prepareAutoRollback("op-" + i);
                stateStore.save(postOperation);
                double appliedBefore = metrics.rollbacksApplied();
                double firedBefore = metrics.watchdogFired();
                double disarmedBefore = metrics.watchdogDisarmed();

                CountDownLatch go = new CountDownLatch(1);
                Future<?> deadline = pool.submit(() -> {
                    go.await();
                    scheduler.advance(DEADLINE);
                    return null;
                });
                Future<?> confirm = pool.submit(() -> {
                    go.await();
                    handle.disarm();
                    return null;
                });
                go.countDown();
                deadline.get(5, TimeUnit.SECONDS);
                confirm.get(5, TimeUnit.SECONDS);

                double applied = metrics.rollbacksApplied() - appliedBefore;
                double fired = metrics.watchdogFired() - firedBefore;
                double disarmed = metrics.watchdogDisarmed() - disarmedBefore;
                if (handle.state() == AutoRollbackHandle.State.FIRED) {
                    assertEquals(1.0, applied);
                    assertEquals(1.0, fired);
                    assertEquals(0.0, disarmed);
                    assertEquals(preOperation, stateStore.load().orElseThrow());
                } else {
                    assertEquals(AutoRollbackHandle.State.DISARMED, handle.state());
                    assertEquals(0.0, applied);
                    assertEquals(0.0, fired);
                    assertEquals(1.0, disarmed);
                    assertEquals(postOperation, stateStore.load().orElseThrow());
                }
                assertEquals(0, manager.armedCount());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(50.0, metrics.watchdogFired() + metrics.watchdogDisarmed());
    }

    @Test
    @DisplayName("Deadline fires on a real scheduler thread")
    void shouldFireOnRealScheduler() throws InterruptedException {
        try (ExecutorTaskScheduler real = new ExecutorTaskScheduler("watchdog-test")) {
            CountDownLatch restored = new CountDownLatch(1);
            notifier.register(new CheckpointListener() {
                @Override
                public void onStateReplaced(StateDocument newState) {
                    restored.countDown();
                }
            });
            SnapshotManager live = new SnapshotManager(10, DEADLINE, stateStore, medium, JsonCodec.defaultCodec(),
                    notifier, metrics, real, Clock.systemUTC());
            stateStore.save(preOperation);
            AutoRollbackHandle handle = live.prepareAutoRollback("risky-op");
            stateStore.save(postOperation);

            assertTrue(restored.await(2, TimeUnit.SECONDS));
            assertEquals(AutoRollbackHandle.State.FIRED, handle.state());
            assertEquals(preOperation, stateStore.load().orElseThrow());
            live.close();
        }
    }
}
