package dev.pekelund.receiptlens.records;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.util.StringUtils;

/**
 * One structured receipt entry produced by field extraction.
 *
 * <p>Instances are immutable; corrections produce a new instance through {@link ReceiptRecordEditor}.
 * The compact constructor enforces the record invariants so an invalid record can never be built.
 */
public record ReceiptRecord(
    String id,
    String rawText,
    String vendor,
    LocalDate transactionDate,
    BigDecimal amount,
    ReceiptCategory category,
    FieldConfidence confidence,
    RecordSource source,
    Instant createdAt,
    Instant updatedAt
) {

    public ReceiptRecord {
        if (!StringUtils.hasText(id)) {
            throw new InvalidRecordException("Record id must not be blank");
        }
        rawText = rawText == null ? "" : rawText;
        vendor = StringUtils.hasText(vendor) ? vendor.trim() : null;
        if (amount != null && amount.signum() < 0) {
            throw new InvalidRecordException("Amount must not be negative but was " + amount.toPlainString());
        }
        if (category == null) {
            throw new InvalidRecordException("Category must be one of the fixed categories");
        }
        if (confidence == null) {
            throw new InvalidRecordException("Confidence must be present");
        }
        if (source == null) {
            throw new InvalidRecordException("Source must be present");
        }
        if (source == RecordSource.MANUALLY_LABELED && confidence.category() != 1.0) {
            throw new InvalidRecordException("Manually labeled records must carry category confidence 1.0");
        }
        if (createdAt == null) {
            throw new InvalidRecordException("Creation timestamp must be present");
        }
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public boolean hasAmount() {
        return amount != null;
    }

    public boolean hasTransactionDate() {
        return transactionDate != null;
    }

    public boolean isManuallyLabeled() {
        return source == RecordSource.MANUALLY_LABELED;
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .rawText(rawText)
            .vendor(vendor)
            .transactionDate(transactionDate)
            .amount(amount)
            .category(category)
            .confidence(confidence)
            .source(source)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String rawText;
        private String vendor;
        private LocalDate transactionDate;
        private BigDecimal amount;
        private ReceiptCategory category = ReceiptCategory.OTHER;
        private FieldConfidence confidence = FieldConfidence.none();
        private RecordSource source = RecordSource.AUTO_DETECTED;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder transactionDate(LocalDate transactionDate) {
            this.transactionDate = transactionDate;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder category(ReceiptCategory category) {
            this.category = category;
            return this;
        }

        public Builder confidence(FieldConfidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder source(RecordSource source) {
            this.source = source;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ReceiptRecord build() {
            return new ReceiptRecord(id, rawText, vendor, transactionDate, amount, category, confidence, source,
                createdAt, updatedAt);
        }
    }
}
