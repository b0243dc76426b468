package dev.pekelund.receiptlens.records;

/**
 * Origin of a record's category.
 */
public enum RecordSource {

    AUTO_DETECTED("auto-detected"),
    MANUALLY_LABELED("manually-labeled");

    private final String id;

    RecordSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
