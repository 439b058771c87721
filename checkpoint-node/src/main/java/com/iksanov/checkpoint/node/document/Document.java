package com.iksanov.checkpoint.node.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A stored document. Immutable; every change produces a new instance.
 *
 * @param sequence insertion order, used to break {@code updatedAt} ties
 */
public record Document(
        String id,
        String title,
        JsonNode payload,
        List<DocumentEntry> entries,
        List<String> tags,
        long createdAt,
        long updatedAt,
        boolean pinned,
        long sequence
) {
    public Document {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id cannot be null or blank");
        if (title == null) throw new IllegalArgumentException("title cannot be null");
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        entries = entries == null ? List.of() : List.copyOf(entries);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    Document withPayload(JsonNode newPayload, long now) {
        return new Document(id, title, newPayload, entries, tags, createdAt, now, pinned, sequence);
    }

    Document withEntry(DocumentEntry entry, String newTitle) {
        List<DocumentEntry> appended = new ArrayList<>(entries.size() + 1);
        appended.addAll(entries);
        appended.add(entry);
        return new Document(id, newTitle, payload, appended, tags, createdAt, entry.timestamp(), pinned, sequence);
    }

    Document withTitle(String newTitle, long now) {
        return new Document(id, newTitle, payload, entries, tags, createdAt, now, pinned, sequence);
    }

    Document withTags(List<String> newTags) {
        return new Document(id, title, payload, entries, newTags, createdAt, updatedAt, pinned, sequence);
    }

    Document withPinned(boolean newPinned) {
        return new Document(id, title, payload, entries, tags, createdAt, updatedAt, newPinned, sequence);
    }
}
