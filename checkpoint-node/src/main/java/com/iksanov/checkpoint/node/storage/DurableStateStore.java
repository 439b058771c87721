package com.iksanov.checkpoint.node.storage;

import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.common.exception.PersistenceException;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single source of truth for the current {@link StateDocument}.
 * <p>
 * {@link #save} replaces the stored document as a whole; the medium guarantees that a
 * subsequent {@link #load} sees either the old or the new document. Writers are serialized.
 * Quota exhaustion is reported through {@link PersistenceException#isQuotaExceeded()} and is
 * never retried here.
 */
public class DurableStateStore implements AutoCloseable {

    public static final String STATE_KEY = "checkpoint_system_state";

    private static final Logger log = LoggerFactory.getLogger(DurableStateStore.class);
    private final JsonSlot<StateDocument> slot;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile boolean open;

    public DurableStateStore(StorageMedium medium, JsonCodec codec, CheckpointMetrics metrics) {
        this.slot = JsonSlot.of(medium, STATE_KEY, codec, StateDocument.class, metrics);
    }

    public DurableStateStore open() {
        open = true;
        log.info("DurableStateStore opened (key={})", STATE_KEY);
        return this;
    }

    public void save(StateDocument document) {
        saveThen(document, () -> {});
    }

    /**
     * Writes {@code document} and runs {@code afterWrite} before any other write can start.
     * {@code afterWrite} is skipped if the write fails.
     */
    public void saveThen(StateDocument document, Runnable afterWrite) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(afterWrite, "afterWrite");
        ensureOpen();
        writeLock.lock();
        try {
            slot.write(document);
            log.debug("Saved state document {}", document);
            afterWrite.run();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Reads the document to write from {@code source} while holding the write lock, so no
     * {@link #saveThen} can interleave between the read and the write.
     *
     * @return the document written, or empty if {@code source} supplied nothing
     */
    public Optional<StateDocument> saveFrom(Supplier<StateDocument> source) {
        Objects.requireNonNull(source, "source");
        ensureOpen();
        writeLock.lock();
        try {
            StateDocument document = source.get();
            if (document == null) return Optional.empty();
            slot.write(document);
            log.debug("Saved state document {}", document);
            return Optional.of(document);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return the last successfully saved document, or empty if none was saved or it is malformed
     * @throws PersistenceException if the medium could not be read
     */
    public Optional<StateDocument> load() {
        ensureOpen();
        return slot.read();
    }

    public void clear() {
        ensureOpen();
        writeLock.lock();
        try {
            slot.clear();
            log.info("State document cleared");
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) return;
        open = false;
        log.info("DurableStateStore closed");
    }

    private void ensureOpen() {
        if (!open) throw PersistenceException.unavailable("DurableStateStore is not open", null);
    }
}
