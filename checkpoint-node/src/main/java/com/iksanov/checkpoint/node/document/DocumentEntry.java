package com.iksanov.checkpoint.node.document;

public record DocumentEntry(EntryRole role, String content, long timestamp) {
    public DocumentEntry {
        if (role == null) throw new IllegalArgumentException("role cannot be null");
        if (content == null) throw new IllegalArgumentException("content cannot be null");
    }
}
