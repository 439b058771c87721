package com.iksanov.checkpoint.node.document;

import java.util.List;

/**
 * Persisted form of the document store: documents in insertion order plus the current pointer.
 */
public record DocumentCollection(List<Document> documents, String currentId, long nextSequence) {
    public DocumentCollection {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
