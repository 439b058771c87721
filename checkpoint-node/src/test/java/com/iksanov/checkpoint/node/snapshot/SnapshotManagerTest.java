package com.iksanov.checkpoint.node.snapshot;

import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.common.exception.PersistenceException;
import com.iksanov.checkpoint.common.exception.RollbackException;
import com.iksanov.checkpoint.node.event.CheckpointEventNotifier;
import com.iksanov.checkpoint.node.event.CheckpointListener;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import com.iksanov.checkpoint.node.storage.DurableStateStore;
import com.iksanov.checkpoint.node.storage.InMemoryStorageMedium;
import com.iksanov.checkpoint.node.storage.StateDocument;
import com.iksanov.checkpoint.node.storage.StateSettings;
import com.iksanov.checkpoint.node.storage.StorageMedium;
import com.iksanov.checkpoint.node.testutil.ManualTaskScheduler;
import com.iksanov.checkpoint.node.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link SnapshotManager}: retention, restore and failure atomicity.
 */
@DisplayName("SnapshotManager - bounded snapshot history")
@ExtendWith(MockitoExtension.class)
class SnapshotManagerTest {

    @Mock
    private CheckpointListener listener;

    private StorageMedium medium;
    private CheckpointMetrics metrics;
    private CheckpointEventNotifier notifier;
    private DurableStateStore stateStore;
    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private SnapshotManager manager;

    @BeforeEach
    void setUp() {
        medium = new InMemoryStorageMedium();
        metrics = new CheckpointMetrics();
        notifier = new CheckpointEventNotifier();
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        scheduler = new ManualTaskScheduler(clock);
        stateStore = new DurableStateStore(medium, JsonCodec.defaultCodec(), metrics).open();
        manager = newManager(3);
    }

    @AfterEach
    void tearDown() {
        manager.close();
        scheduler.close();
    }

    private SnapshotManager newManager(int maxSnapshots) {
        return new SnapshotManager(maxSnapshots, Duration.ofMinutes(5), stateStore, medium,
                JsonCodec.defaultCodec(), notifier, metrics, scheduler, clock);
    }

    private static StateDocument state(int version) {
        return StateDocument.builder()
                .settings(StateSettings.defaults())
                .memory(Map.of("version", version))
                .context(List.of("line-" + version))
                .build();
    }

    private List<String> descriptions() {
        return manager.listSnapshots().stream().map(SnapshotInfo::description).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Oldest snapshot is evicted once the limit is exceeded")
    void shouldEvictOldestBeyondLimit() {
        stateStore.save(state(1));
        for (String d : List.of("a", "b", "c", "d")) {
            clock.advanceMillis(10);
            assertThat(manager.createSnapshot(d)).isPresent();
        }

        assertThat(descriptions()).containsExactly("b", "c", "d");
        assertThat(manager.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("The list never exceeds maxSnapshots and stays in creation order")
    void shouldKeepBoundAndOrder() {
        stateStore.save(state(1));
        for (int i = 0; i < 10; i++) {
            clock.advanceMillis(1);
            manager.createSnapshot("s" + i);
            assertThat(manager.size()).isLessThanOrEqualTo(3);
        }

        List<SnapshotInfo> list = manager.listSnapshots();
        assertThat(descriptions()).containsExactly("s7", "s8", "s9");
        assertThat(list.get(0).timestamp()).isLessThan(list.get(2).timestamp());
    }

    @Test
    @DisplayName("createSnapshot() without a current state returns empty and changes nothing")
    void shouldSkipWhenNoState() {
        assertThat(manager.createSnapshot("nothing")).isEmpty();
        assertThat(manager.listSnapshots()).isEmpty();
        assertThat(medium.get(SnapshotManager.SNAPSHOTS_KEY)).isEmpty();
    }

    @Test
    @DisplayName("Rollback restores a deep-equal copy of the snapshotted state")
    void rollbackShouldRestoreSnapshottedState() {
        StateDocument before = state(1);
        stateStore.save(before);
        String id = manager.createSnapshot("before change").orElseThrow();

        stateStore.save(state(2));
        manager.rollback(id);

        assertThat(stateStore.load()).contains(before);
        assertThat(manager.getSnapshot(id)).isPresent();
        assertThat(metrics.rollbacksApplied()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Rolling back twice to the same snapshot yields the same state")
    void rollbackShouldBeIdempotent() {
        stateStore.save(state(1));
        String id = manager.createSnapshot("v1").orElseThrow();
        stateStore.save(state(2));

        manager.rollback(id);
        StateDocument afterFirst = stateStore.load().orElseThrow();
        manager.rollback(id);

        assertThat(stateStore.load()).contains(afterFirst);
    }

    @Test
    @DisplayName("Unknown snapshot id raises NOT_FOUND and leaves state untouched")
    void rollbackToUnknownIdShouldFail() {
        stateStore.save(state(1));

        assertThatThrownBy(() -> manager.rollback("snap-missing"))
                .isInstanceOf(RollbackException.class)
                .satisfies(e -> {
                    RollbackException re = (RollbackException) e;
                    assertThat(re.reason()).isEqualTo(RollbackException.Reason.NOT_FOUND);
                    assertThat(re.snapshotId()).isEqualTo("snap-missing");
                });
        assertThat(stateStore.load()).contains(state(1));
        assertThat(metrics.rollbacksFailed()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A rollback whose write fails raises WRITE_FAILED and keeps the current state")
    void rollbackWriteFailureShouldKeepState() {
        StorageMedium spyMedium = spy(new InMemoryStorageMedium());
        DurableStateStore store = new DurableStateStore(spyMedium, JsonCodec.defaultCodec(), metrics).open();
        SnapshotManager local = new SnapshotManager(3, Duration.ofMinutes(5), store, spyMedium,
                JsonCodec.defaultCodec(), notifier, metrics, scheduler, clock);
        store.save(state(1));
        String id = local.createSnapshot("v1").orElseThrow();
        store.save(state(2));
        notifier.register(listener);

        doThrow(PersistenceException.quotaExceeded("full"))
                .when(spyMedium).set(eq(DurableStateStore.STATE_KEY), anyString());

        assertThatThrownBy(() -> local.rollback(id))
                .isInstanceOf(RollbackException.class)
                .matches(e -> ((RollbackException) e).reason() == RollbackException.Reason.WRITE_FAILED)
                .hasCauseInstanceOf(PersistenceException.class);
        assertThat(store.load()).contains(state(2));
        verify(listener, never()).onStateReplaced(any());
        local.close();
    }

    @Test
    @DisplayName("A failed snapshot write leaves the list unchanged")
    void failedCreateShouldNotChangeList() {
        StorageMedium spyMedium = spy(new InMemoryStorageMedium());
        DurableStateStore store = new DurableStateStore(spyMedium, JsonCodec.defaultCodec(), metrics).open();
        SnapshotManager local = new SnapshotManager(3, Duration.ofMinutes(5), store, spyMedium,
                JsonCodec.defaultCodec(), notifier, metrics, scheduler, clock);
        store.save(state(1));
        local.createSnapshot("kept");

        doThrow(PersistenceException.quotaExceeded("full"))
                .when(spyMedium).set(eq(SnapshotManager.SNAPSHOTS_KEY), anyString());

        assertThatThrownBy(() -> local.createSnapshot("lost")).isInstanceOf(PersistenceException.class);
        assertThat(local.listSnapshots()).extracting(SnapshotInfo::description).containsExactly("kept");
        local.close();
    }

    @Test
    @DisplayName("Snapshots survive a restart and an oversized list is trimmed from the head")
    void shouldReloadAndTrimPersistedList() {
        stateStore.save(state(1));
        SnapshotManager wide = newManager(5);
        for (String d : List.of("a", "b", "c", "d", "e")) {
            clock.advanceMillis(1);
            wide.createSnapshot(d);
        }
        wide.close();

        SnapshotManager narrow = newManager(2);
        assertThat(narrow.listSnapshots()).extracting(SnapshotInfo::description).containsExactly("d", "e");
        narrow.close();
    }

    @Test
    @DisplayName("A corrupt persisted list starts empty")
    void corruptListShouldStartEmpty() {
        medium.set(SnapshotManager.SNAPSHOTS_KEY, "[{\"id\":");
        assertThat(newManager(3).listSnapshots()).isEmpty();
    }

    @Test
    @DisplayName("Created then evicted notifications are raised in that order")
    void shouldNotifyCreatedThenEvicted() {
        notifier.register(listener);
        stateStore.save(state(1));
        String first = manager.createSnapshot("a").orElseThrow();
        manager.createSnapshot("b");
        manager.createSnapshot("c");
        String fourth = manager.createSnapshot("d").orElseThrow();

        InOrder order = inOrder(listener);
        order.verify(listener).onSnapshotCreated(fourth);
        order.verify(listener).onSnapshotEvicted(first);
        verify(listener, times(4)).onSnapshotCreated(anyString());
    }

    @Test
    @DisplayName("deleteSnapshot() removes only the given id")
    void deleteShouldRemoveSnapshot() {
        stateStore.save(state(1));
        String a = manager.createSnapshot("a").orElseThrow();
        manager.createSnapshot("b");

        assertThat(manager.deleteSnapshot(a)).isTrue();
        assertThat(manager.deleteSnapshot(a)).isFalse();
        assertThat(descriptions()).containsExactly("b");
        assertThatThrownBy(() -> manager.rollback(a)).isInstanceOf(RollbackException.class);
    }

    @Test
    @DisplayName("Snapshot ids are unique and carry the creation time")
    void snapshotIdsShouldBeUnique() {
        stateStore.save(state(1));
        String a = manager.createSnapshot("a").orElseThrow();
        String b = manager.createSnapshot("b").orElseThrow();

        assertThat(a).isNotEqualTo(b).startsWith("snap-");
        assertThat(manager.getSnapshot(a).orElseThrow().timestamp()).isEqualTo(clock.millis());
    }

    @Test
    @DisplayName("The stored snapshot is isolated from later state changes")
    void snapshotShouldBeIsolatedFromLaterChanges() {
        stateStore.save(state(1));
        String id = manager.createSnapshot("v1").orElseThrow();
        stateStore.save(state(1).with("memory", Map.of("version", 99)));

        manager.rollback(id);
        assertThat(stateStore.load().orElseThrow().get("memory").orElseThrow().get("version").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Mutating calls after close() are rejected")
    void closedManagerShouldRejectMutations() {
        stateStore.save(state(1));
        String id = manager.createSnapshot("v1").orElseThrow();
        stateStore.save(state(2));
        manager.close();

        assertThatThrownBy(() -> manager.createSnapshot("late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> manager.rollback(id)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> manager.deleteSnapshot(id)).isInstanceOf(IllegalStateException.class);
        assertThat(stateStore.load()).contains(state(2));
        assertThat(manager.listSnapshots()).extracting(SnapshotInfo::id).containsExactly(id);
        assertThat(metrics.rollbacksApplied()).isZero();
    }

    @Test
    @DisplayName("A snapshot list that cannot be read fails construction and stays on the medium")
    void unreadableListShouldFailConstruction() {
        StorageMedium spyMedium = spy(new InMemoryStorageMedium());
        DurableStateStore store = new DurableStateStore(spyMedium, JsonCodec.defaultCodec(), metrics).open();
        SnapshotManager first = new SnapshotManager(3, Duration.ofMinutes(5), store, spyMedium,
                JsonCodec.defaultCodec(), notifier, metrics, scheduler, clock);
        store.save(state(1));
        first.createSnapshot("a");
        first.createSnapshot("b");
        first.close();

        doThrow(PersistenceException.unavailable("disk offline", null)).doCallRealMethod()
                .when(spyMedium).get(SnapshotManager.SNAPSHOTS_KEY);

        assertThatThrownBy(() -> new SnapshotManager(3, Duration.ofMinutes(5), store, spyMedium,
                JsonCodec.defaultCodec(), notifier, metrics, scheduler, clock))
                .isInstanceOf(PersistenceException.class)
                .matches(e -> ((PersistenceException) e).reason() == PersistenceException.Reason.MEDIUM_UNAVAILABLE);

        SnapshotManager reopened = new SnapshotManager(3, Duration.ofMinutes(5), store, spyMedium,
                JsonCodec.defaultCodec(), notifier, metrics, scheduler, clock);
        assertThat(reopened.listSnapshots()).extracting(SnapshotInfo::description).containsExactly("a", "b");
        reopened.close();
    }

    @Test
    @DisplayName("Concurrent rollbacks are serialized and the last one applied wins")
    void concurrentRollbacksShouldBeSerialized() throws Exception {
        stateStore.save(state(1));
        String first = manager.createSnapshot("v1").orElseThrow();
        stateStore.save(state(2));
        String second = manager.createSnapshot("v2").orElseThrow();
        stateStore.save(state(3));

        List<StateDocument> replaced = new CopyOnWriteArrayList<>();
        notifier.register(new CheckpointListener() {
            @Override
            public void onStateReplaced(StateDocument newState) {
                replaced.add(newState);
            }
        });

        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> a = pool.submit(() -> {
                go.await();
                manager.rollback(first);
                return null;
            });
            Future<?> b = pool.submit(() -> {
                go.await();
                manager.rollback(second);
                return null;
            });
            go.countDown();
            a.get(5, TimeUnit.SECONDS);
            b.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(metrics.rollbacksApplied()).isEqualTo(2.0);
        assertThat(metrics.rollbacksFailed()).isZero();
        assertThat(replaced).hasSize(2).containsExactlyInAnyOrder(state(1), state(2));
        assertThat(stateStore.load()).contains(replaced.get(1));
        assertThat(manager.size()).isEqualTo(2);
    }
}
