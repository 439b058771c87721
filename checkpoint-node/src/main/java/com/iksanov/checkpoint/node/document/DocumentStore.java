package com.iksanov.checkpoint.node.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.iksanov.checkpoint.common.codec.JsonCodec;
import com.iksanov.checkpoint.common.exception.DocumentNotFoundException;
import com.iksanov.checkpoint.common.exception.PersistenceException;
import com.iksanov.checkpoint.common.util.IdGenerator;
import com.iksanov.checkpoint.node.event.CheckpointEventNotifier;
import com.iksanov.checkpoint.node.metrics.CheckpointMetrics;
import com.iksanov.checkpoint.node.storage.JsonSlot;
import com.iksanov.checkpoint.node.storage.StorageMedium;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Keyed collection of documents with a soft upper bound and oldest-first pruning.
 *
 * <p>Design:
 * <ul>
 *   <li>Each mutation works on a copy of the collection, persists it as a whole and publishes
 *       the copy only after the write succeeded.</li>
 *   <li>Pruning runs when the count exceeds {@code maxDocuments} or the medium reports
 *       {@code QUOTA_EXCEEDED}. It removes the least recently updated documents until at most
 *       {@code maxDocuments / 2} remain, never touching pinned documents. Evicting the current
 *       document clears the current pointer.</li>
 *   <li>After a quota failure the write is retried exactly once; a second failure is surfaced
 *       and the published collection stays as it was.</li>
 * </ul>
 */
public class DocumentStore implements AutoCloseable {

    public static final String DOCUMENTS_KEY = "checkpoint_documents";
    static final String DEFAULT_TITLE_PREFIX = "Document ";
    private static final int TITLE_MAX_LENGTH = 30;

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);
    private static final Comparator<Document> LEAST_RECENTLY_UPDATED =
            Comparator.comparingLong(Document::updatedAt).thenComparingLong(Document::sequence);
    private static final Comparator<Document> LISTING_ORDER =
            Comparator.comparing((Document d) -> !d.pinned())
                    .thenComparing(Comparator.comparingLong(Document::updatedAt).reversed())
                    .thenComparingLong(Document::sequence);

    private final JsonSlot<DocumentCollection> slot;
    private final CheckpointEventNotifier notifier;
    private final CheckpointMetrics metrics;
    private final Clock clock;
    private final int maxDocuments;
    private final DocumentTextExporter exporter;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Working committed = new Working(new LinkedHashMap<>(), null, 0);
    private volatile boolean open;

    public DocumentStore(int maxDocuments,
                         StorageMedium medium,
                         JsonCodec codec,
                         CheckpointEventNotifier notifier,
                         CheckpointMetrics metrics,
                         Clock clock) {
        if (maxDocuments < 2) throw new IllegalArgumentException("maxDocuments must be >= 2");
        this.maxDocuments = maxDocuments;
        this.slot = JsonSlot.of(medium, DOCUMENTS_KEY, codec, DocumentCollection.class, metrics);
        this.notifier = Objects.requireNonNull(notifier, "notifier cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.exporter = new DocumentTextExporter(clock.getZone());
    }

    /**
     * Loads the persisted collection. A malformed collection starts the store empty.
     *
     * @throws PersistenceException if the medium could not be read; the store stays closed
     */
    public DocumentStore open() {
        lock.lock();
        try {
            DocumentCollection stored = slot.read().orElse(null);
            if (stored == null) {
                committed = new Working(new LinkedHashMap<>(), null, 0);
            } else {
                Map<String, Document> docs = new LinkedHashMap<>();
                long maxSequence = -1;
                for (Document d : stored.documents()) {
                    if (d == null) continue;
                    docs.put(d.id(), d);
                    maxSequence = Math.max(maxSequence, d.sequence());
                }
                String current = stored.currentId() != null && docs.containsKey(stored.currentId()) ? stored.currentId() : null;
                committed = new Working(docs, current, Math.max(stored.nextSequence(), maxSequence + 1));
            }
            open = true;
            metrics.updateDocumentCount(committed.documents.size());
            log.info("DocumentStore opened: {} document(s) loaded, maxDocuments={}", committed.documents.size(), maxDocuments);
            return this;
        } finally {
            lock.unlock();
        }
    }

    public String create(JsonNode payload) {
        return create(null, payload);
    }

    /**
     * Inserts a new document and makes it current.
     *
     * @param title {@code null} for a default title
     */
    public String create(String title, JsonNode payload) {
        return mutate(w -> {
            String id = IdGenerator.documentId();
            long now = clock.millis();
            String effectiveTitle = title != null ? title : DEFAULT_TITLE_PREFIX + (w.documents.size() + 1);
            w.documents.put(id, new Document(id, effectiveTitle, payload, List.of(), List.of(), now, now, false, w.nextSequence++));
            w.currentId = id;
            log.debug("Document {} created", id);
            return id;
        });
    }

    public void update(String id, JsonNode payload) {
        mutate(w -> {
            Document doc = w.require(id);
            w.documents.put(id, doc.withPayload(payload, clock.millis()));
            return null;
        });
    }

    /**
     * Appends an entry. A document still carrying its default title is renamed after its first
     * non-empty user entry.
     */
    public void appendEntry(String id, EntryRole role, String content) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        mutate(w -> {
            Document doc = w.require(id);
            DocumentEntry entry = new DocumentEntry(role, content, clock.millis());
            w.documents.put(id, doc.withEntry(entry, titleAfter(doc, entry)));
            return null;
        });
    }

    public void rename(String id, String title) {
        Objects.requireNonNull(title, "title");
        mutate(w -> {
            Document doc = w.require(id);
            w.documents.put(id, doc.withTitle(title, clock.millis()));
            return null;
        });
    }

    public void delete(String id) {
        mutate(w -> {
            w.require(id);
            w.documents.remove(id);
            if (id.equals(w.currentId)) w.currentId = null;
            log.debug("Document {} deleted", id);
            return null;
        });
    }

    public void setPinned(String id, boolean pinned) {
        mutate(w -> {
            Document doc = w.require(id);
            w.documents.put(id, doc.withPinned(pinned));
            return null;
        });
    }

    public boolean togglePinned(String id) {
        return mutate(w -> {
            Document doc = w.require(id);
            w.documents.put(id, doc.withPinned(!doc.pinned()));
            return !doc.pinned();
        });
    }

    public void setTags(String id, List<String> tags) {
        Objects.requireNonNull(tags, "tags");
        mutate(w -> {
            Document doc = w.require(id);
            w.documents.put(id, doc.withTags(tags));
            return null;
        });
    }

    /**
     * @param id {@code null} clears the current pointer
     */
    public void setCurrent(String id) {
        mutate(w -> {
            if (id != null) w.require(id);
            w.currentId = id;
            return null;
        });
    }

    public void clearAll() {
        mutate(w -> {
            w.documents.clear();
            w.currentId = null;
            log.info("All documents cleared");
            return null;
        });
    }

    public Optional<Document> get(String id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(committed.documents.get(id));
    }

    public Optional<Document> getCurrent() {
        Working snapshot = committed;
        return snapshot.currentId == null ? Optional.empty() : Optional.ofNullable(snapshot.documents.get(snapshot.currentId));
    }

    public Optional<String> currentId() {
        return Optional.ofNullable(committed.currentId);
    }

    /**
     * Pinned documents first, then most recently updated; ties keep insertion order.
     */
    public List<Document> list() {
        List<Document> all = new ArrayList<>(committed.documents.values());
        all.sort(LISTING_ORDER);
        return all;
    }

    public int size() {
        return committed.documents.size();
    }

    public DocumentStats stats() {
        List<Document> all = new ArrayList<>(committed.documents.values());
        if (all.isEmpty()) return DocumentStats.empty();

        int totalEntries = 0;
        long oldest = Long.MAX_VALUE;
        long newest = Long.MIN_VALUE;
        for (Document d : all) {
            totalEntries += d.entries().size();
            oldest = Math.min(oldest, d.createdAt());
            newest = Math.max(newest, d.createdAt());
        }
        return new DocumentStats(all.size(), totalEntries, Instant.ofEpochMilli(oldest), Instant.ofEpochMilli(newest));
    }

    public String exportAsText(String id) {
        Document doc = get(id).orElseThrow(() -> new DocumentNotFoundException(id));
        return exporter.export(doc);
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) return;
        open = false;
        log.info("DocumentStore closed");
    }

    private <R> R mutate(Function<Working, R> change) {
        lock.lock();
        try {
            if (!open) throw PersistenceException.unavailable("DocumentStore is not open", null);
            Working working = committed.copy();
            R result = change.apply(working);
            List<String> pruned = persist(working);
            committed = working;
            metrics.updateDocumentCount(working.documents.size());
            if (!pruned.isEmpty()) {
                metrics.recordDocumentsPruned(pruned.size());
                notifier.documentsPruned(pruned);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private List<String> persist(Working working) {
        List<String> pruned = new ArrayList<>();
        if (working.documents.size() > maxDocuments) {
            pruned.addAll(prune(working));
            log.info("Document count exceeded {}, pruned {} document(s)", maxDocuments, pruned.size());
        }

        try {
            slot.write(working.toCollection());
            return pruned;
        } catch (PersistenceException e) {
            if (!e.isQuotaExceeded()) throw e;
            log.warn("Storage quota exceeded saving {} document(s), pruning and retrying once", working.documents.size());
        }

        pruned.addAll(prune(working));
        log.info("Pruned {} document(s) to free up space", pruned.size());
        try {
            slot.write(working.toCollection());
        } catch (PersistenceException retryError) {
            log.error("Failed to save documents even after pruning: {}", retryError.getMessage());
            throw retryError;
        }
        return pruned;
    }

    private List<String> prune(Working working) {
        int target = maxDocuments / 2;
        List<Document> oldestFirst = new ArrayList<>(working.documents.values());
        oldestFirst.sort(LEAST_RECENTLY_UPDATED);

        List<String> removed = new ArrayList<>();
        for (Document d : oldestFirst) {
            if (working.documents.size() <= target) break;
            if (d.pinned()) continue;
            working.documents.remove(d.id());
            removed.add(d.id());
            if (d.id().equals(working.currentId)) working.currentId = null;
        }
        if (working.documents.size() > target) {
            log.warn("Pruning stopped at {} document(s), above target {}: remaining documents are pinned",
                    working.documents.size(), target);
        }
        return removed;
    }

    private static String titleAfter(Document doc, DocumentEntry entry) {
        if (!doc.title().startsWith(DEFAULT_TITLE_PREFIX) || entry.role() != EntryRole.USER) return doc.title();
        String content = entry.content();
        String head = content.substring(0, Math.min(TITLE_MAX_LENGTH, content.length())).trim();
        if (head.isEmpty()) return doc.title();
        return content.length() > TITLE_MAX_LENGTH ? head + "..." : head;
    }

    private static final class Working {
        final Map<String, Document> documents;
        String currentId;
        long nextSequence;

        Working(Map<String, Document> documents, String currentId, long nextSequence) {
            this.documents = documents;
            this.currentId = currentId;
            this.nextSequence = nextSequence;
        }

        Working copy() {
            return new Working(new LinkedHashMap<>(documents), currentId, nextSequence);
        }

        Document require(String id) {
            Objects.requireNonNull(id, "id");
            Document doc = documents.get(id);
            if (doc == null) throw new DocumentNotFoundException(id);
            return doc;
        }

        DocumentCollection toCollection() {
            return new DocumentCollection(new ArrayList<>(documents.values()), currentId, nextSequence);
        }
    }
}
