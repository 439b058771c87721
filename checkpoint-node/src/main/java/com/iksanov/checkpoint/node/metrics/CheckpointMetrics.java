package com.iksanov.checkpoint.node.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for snapshots, rollbacks and persistence using Micrometer.
 * Exposes statistics in the Prometheus text format.
 */
public class CheckpointMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter snapshotsCreated;
    private final Counter snapshotsEvicted;
    private final Counter rollbacksApplied;
    private final Counter rollbacksFailed;
    private final Counter watchdogFired;
    private final Counter watchdogDisarmed;
    private final Counter documentsPruned;
    private final Counter quotaExceeded;
    private final Counter persistenceFailures;
    private final Timer writeLatency;
    private final AtomicLong snapshotCount = new AtomicLong(0);
    private final AtomicLong documentCount = new AtomicLong(0);

    public CheckpointMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.snapshotsCreated = Counter.builder("checkpoint.snapshots.taken")
                .description("Number of snapshots created")
                .register(registry);

        this.snapshotsEvicted = Counter.builder("checkpoint.snapshots.evicted")
                .description("Number of snapshots evicted by the retention limit")
                .register(registry);

        this.rollbacksApplied = Counter.builder("checkpoint.rollbacks.applied")
                .description("Number of rollbacks that replaced the current state")
                .register(registry);

        this.rollbacksFailed = Counter.builder("checkpoint.rollbacks.failed")
                .description("Number of rollbacks that left the current state unchanged")
                .register(registry);

        this.watchdogFired = Counter.builder("checkpoint.watchdog.fired")
                .description("Number of auto-rollback deadlines that expired")
                .register(registry);

        this.watchdogDisarmed = Counter.builder("checkpoint.watchdog.disarmed")
                .description("Number of auto-rollback deadlines disarmed in time")
                .register(registry);

        this.documentsPruned = Counter.builder("checkpoint.documents.pruned")
                .description("Number of documents removed by eviction")
                .register(registry);

        this.quotaExceeded = Counter.builder("checkpoint.persistence.quota.exceeded")
                .description("Number of writes rejected because the storage quota was exhausted")
                .register(registry);

        this.persistenceFailures = Counter.builder("checkpoint.persistence.failures")
                .description("Number of writes that failed for any reason")
                .register(registry);

        this.writeLatency = Timer.builder("checkpoint.persistence.write.duration")
                .description("Storage medium write duration")
                .publishPercentileHistogram()
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50),
                    Duration.ofMillis(100)
                )
                .register(registry);

        Gauge.builder("checkpoint.snapshots.retained", snapshotCount, AtomicLong::get)
                .description("Current number of retained snapshots")
                .register(registry);

        Gauge.builder("checkpoint.documents.stored", documentCount, AtomicLong::get)
                .description("Current number of stored documents")
                .register(registry);
    }

    public void recordSnapshotCreated() {
        snapshotsCreated.increment();
    }

    public void recordSnapshotEvicted() {
        snapshotsEvicted.increment();
    }

    public void recordRollbackApplied() {
        rollbacksApplied.increment();
    }

    public void recordRollbackFailed() {
        rollbacksFailed.increment();
    }

    public void recordWatchdogFired() {
        watchdogFired.increment();
    }

    public void recordWatchdogDisarmed() {
        watchdogDisarmed.increment();
    }

    public void recordDocumentsPruned(int count) {
        documentsPruned.increment(count);
    }

    public void recordQuotaExceeded() {
        quotaExceeded.increment();
    }

    public void recordPersistenceFailure() {
        persistenceFailures.increment();
    }

    public void updateSnapshotCount(int count) {
        snapshotCount.set(count);
    }

    public void updateDocumentCount(int count) {
        documentCount.set(count);
    }

    public Timer.Sample startWriteTimer() {
        return Timer.start(registry);
    }

    public void stopWriteTimer(Timer.Sample sample) {
        sample.stop(writeLatency);
    }

    public double snapshotsCreated() {
        return snapshotsCreated.count();
    }

    public double rollbacksApplied() {
        return rollbacksApplied.count();
    }

    public double rollbacksFailed() {
        return rollbacksFailed.count();
    }

    public double watchdogFired() {
        return watchdogFired.count();
    }

    public double watchdogDisarmed() {
        return watchdogDisarmed.count();
    }

    public double documentsPruned() {
        return documentsPruned.count();
    }

    public double quotaExceeded() {
        return quotaExceeded.count();
    }

    public double persistenceFailures() {
        return persistenceFailures.count();
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
