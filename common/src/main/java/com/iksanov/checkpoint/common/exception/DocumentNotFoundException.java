package com.iksanov.checkpoint.common.exception;

public class DocumentNotFoundException extends CheckpointException {
    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document with ID " + documentId + " not found");
        this.documentId = documentId;
    }

    public String documentId() {
        return documentId;
    }
}
