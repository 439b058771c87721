package com.iksanov.checkpoint.node.document;

public enum EntryRole {
    SYSTEM("System"),
    USER("User"),
    ASSISTANT("Assistant");

    private final String label;

    EntryRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
