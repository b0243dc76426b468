package dev.pekelund.receiptlens.analytics.export;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import java.util.Locale;

public enum ExportFormat {

    JSON("application/json"),
    CSV("text/csv");

    private final String contentType;

    ExportFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    public static ExportFormat fromId(String id) {
        if (id != null) {
            String normalised = id.trim().toUpperCase(Locale.ROOT);
            for (ExportFormat format : values()) {
                if (format.name().equals(normalised)) {
                    return format;
                }
            }
        }
        throw new InvalidQueryException("format", id, "Unknown export format '" + id + "', expected json or csv");
    }
}
