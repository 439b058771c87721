package com.iksanov.checkpoint.node.app;

import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.node.config.CheckpointConfig;
import com.iksanov.checkpoint.node.document.DocumentStore;
import com.iksanov.checkpoint.node.event.CheckpointEventNotifier;
import com.iksanov.checkpoint.node.event.CheckpointListener;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import com.iksanov.checkpoint.node.save.AutoSaver;
import com.iksanov.checkpoint.node.scheduling.ExecutorTaskScheduler;
import com.iksanov.checkpoint.node.scheduling.TaskScheduler;
import com.iksanov.checkpoint.node.snapshot.SnapshotManager;
import com.iksanov.checkpoint.node.storage.DurableStateStore;
import com.iksanov.checkpoint.node.storage.FileStorageMedium;
import com.iksanov.checkpoint.node.storage.StateDocument;
import com.iksanov.checkpoint.node.storage.StorageMedium;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main application class for the checkpoint node.
 * Wires storage, stores, snapshots and auto-save, and exposes them to an embedding host.
 */
public class CheckpointNodeApplication {

    private static final Logger log = LoggerFactory.getLogger(CheckpointNodeApplication.class);
    private final CheckpointConfig config;
    private final Clock clock;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicReference<StateDocument> liveState = new AtomicReference<>();
    private StorageMedium medium;
    private CheckpointMetrics metrics;
    private CheckpointEventNotifier notifier;
    private TaskScheduler scheduler;
    private DurableStateStore stateStore;
    private DocumentStore documentStore;
    private SnapshotManager snapshotManager;
    private AutoSaver autoSaver;
    private Thread shutdownHook;
    private volatile boolean running;

    public CheckpointNodeApplication(CheckpointConfig config) {
        this(config, null, Clock.systemDefaultZone());
    }

    /**
     * @param medium storage to use instead of a {@link FileStorageMedium} under the configured directory
     */
    public CheckpointNodeApplication(CheckpointConfig config, StorageMedium medium, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.medium = medium;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public static void main(String[] args) {
        CheckpointConfig config = CheckpointConfig.fromEnv();

        log.info("========================================");
        log.info("Starting checkpoint node");
        log.info("Storage: {}, quota: {} bytes", config.storageDirectory().toAbsolutePath(), config.storageQuotaBytes());
        log.info("========================================");

        CheckpointNodeApplication app = new CheckpointNodeApplication(config);
        app.start();
        app.awaitShutdown();
    }

    public synchronized void start() {
        if (running) return;
        try {
            metrics = new CheckpointMetrics();
            notifier = new CheckpointEventNotifier();
            JsonCodec codec = JsonCodec.defaultCodec();
            log.info("[OK] Metrics initialized");

            if (medium == null) medium = new FileStorageMedium(config.storageDirectory(), config.storageQuotaBytes());
            log.info("[OK] Storage medium ready ({})", medium.getClass().getSimpleName());

            stateStore = new DurableStateStore(medium, codec, metrics).open();
            liveState.set(stateStore.load().orElse(null));
            log.info("[OK] State store opened (state present={})", liveState.get() != null);

            documentStore = new DocumentStore(config.maxDocuments(), medium, codec, notifier, metrics, clock).open();
            log.info("[OK] Document store opened ({} documents)", documentStore.size());

            scheduler = new ExecutorTaskScheduler("checkpoint-scheduler");
            snapshotManager = new SnapshotManager(config.maxSnapshots(), config.autoRollbackDeadline(),
                    stateStore, medium, codec, notifier, metrics, scheduler, clock);
            log.info("[OK] Snapshot manager ready ({} snapshots)", snapshotManager.size());

            notifier.register(new CheckpointListener() {
                @Override
                public void onStateReplaced(StateDocument newState) {
                    liveState.set(newState);
                    log.info("Live state replaced by rollback");
                }
            });

            autoSaver = new AutoSaver(stateStore, liveState::get, scheduler, config.autoSaveInterval(), clock, metrics);
            autoSaver.start();

            shutdownHook = new Thread(this::shutdown, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            running = true;

            log.info("========================================");
            log.info("[SUCCESS] Checkpoint node ready!");
            log.info("  {}", config);
            log.info("========================================");
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            shutdown();
            throw e;
        }
    }

    /**
     * Replaces the live state that the auto-saver persists. Does not write by itself.
     */
    public void updateState(StateDocument state) {
        liveState.set(Objects.requireNonNull(state, "state"));
    }

    public Optional<StateDocument> liveState() {
        return Optional.ofNullable(liveState.get());
    }

    public void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public synchronized void shutdown() {
        if (shutdownLatch.getCount() == 0) return;
        log.info("========================================");
        log.info("Shutting down checkpoint node...");
        log.info("========================================");

        try {
            if (autoSaver != null) {
                autoSaver.stop();
                if (liveState.get() != null) autoSaver.saveNow(false);
            }
            if (snapshotManager != null) snapshotManager.close();
            if (scheduler != null) scheduler.close();
            if (documentStore != null) documentStore.close();
            if (stateStore != null) stateStore.close();
            if (medium != null) medium.close();
            log.info("[OK] Checkpoint node stopped");
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        } finally {
            running = false;
            removeShutdownHook();
            shutdownLatch.countDown();
        }
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) return;
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }

    public boolean isRunning() {
        return running;
    }

    public CheckpointConfig getConfig() {
        return config;
    }

    public CheckpointMetrics getMetrics() {
        return metrics;
    }

    public CheckpointEventNotifier getNotifier() {
        return notifier;
    }

    public DurableStateStore getStateStore() {
        return stateStore;
    }

    public DocumentStore getDocumentStore() {
        return documentStore;
    }

    public SnapshotManager getSnapshotManager() {
        return snapshotManager;
    }

    public AutoSaver getAutoSaver() {
        return autoSaver;
    }
}
