package dev.pekelund.receiptlens.records;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * Record attributes that can be searched, sorted, or grouped on.
 */
public enum RecordField {

    VENDOR("vendor", Kind.TEXT),
    TRANSACTION_DATE("transaction_date", Kind.DATE),
    AMOUNT("amount", Kind.NUMBER),
    CATEGORY("category", Kind.TEXT),
    RAW_TEXT("raw_text", Kind.TEXT),
    CREATED_AT("created_at", Kind.TIMESTAMP);

    public enum Kind {
        TEXT,
        NUMBER,
        DATE,
        TIMESTAMP
    }

    private final String id;
    private final Kind kind;

    RecordField(String id, Kind kind) {
        this.id = id;
        this.kind = kind;
    }

    public String id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    /**
     * Returns the raw field value: {@link String} for text fields (the category identifier for
     * {@link #CATEGORY}), {@link BigDecimal}, {@link LocalDate} or {@link Instant}; {@code null} when absent.
     */
    public Object valueOf(ReceiptRecord record) {
        return switch (this) {
            case VENDOR -> record.vendor();
            case TRANSACTION_DATE -> record.transactionDate();
            case AMOUNT -> record.amount();
            case CATEGORY -> record.category().id();
            case RAW_TEXT -> record.rawText();
            case CREATED_AT -> record.createdAt();
        };
    }

    public String textValueOf(ReceiptRecord record) {
        Object value = valueOf(record);
        return value == null ? null : value.toString();
    }

    public static Optional<RecordField> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalised = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalised.equals("date") || normalised.equals("transactiondate")) {
            return Optional.of(TRANSACTION_DATE);
        }
        if (normalised.equals("rawtext")) {
            return Optional.of(RAW_TEXT);
        }
        if (normalised.equals("createdat")) {
            return Optional.of(CREATED_AT);
        }
        for (RecordField field : values()) {
            if (field.id.equals(normalised)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
