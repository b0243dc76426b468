package dev.pekelund.receiptlens.records;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of spending categories a receipt record can belong to. Declaration order doubles as the
 * tie-break priority used by keyword classification.
 */
public enum ReceiptCategory {

    GROCERIES("groceries"),
    RESTAURANT("restaurant"),
    TRANSPORT("transport"),
    ENTERTAINMENT("entertainment"),
    SHOPPING("shopping"),
    UTILITIES("utilities"),
    HEALTHCARE("healthcare"),
    OTHER("other");

    private final String id;

    ReceiptCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ReceiptCategory> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalised = id.trim().toLowerCase(Locale.ROOT);
        for (ReceiptCategory category : values()) {
            if (category.id.equals(normalised)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
