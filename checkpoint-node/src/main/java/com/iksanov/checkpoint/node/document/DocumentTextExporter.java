package com.iksanov.checkpoint.node.document;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders a document and its entries as plain text.
 */
public final class DocumentTextExporter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private final ZoneId zone;

    public DocumentTextExporter(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public String export(Document document) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(document.title()).append('\n');
        out.append("Date: ").append(DATE.format(Instant.ofEpochMilli(document.createdAt()).atZone(zone))).append('\n');
        if (!document.tags().isEmpty()) {
            out.append("Tags: ").append(String.join(", ", document.tags())).append('\n');
        }
        out.append('\n');

        for (DocumentEntry entry : document.entries()) {
            String time = TIME.format(Instant.ofEpochMilli(entry.timestamp()).atZone(zone));
            out.append('[').append(time).append("] ").append(entry.role().label()).append(":\n");
            out.append(entry.content()).append("\n\n");
        }
        return out.toString();
    }
}
