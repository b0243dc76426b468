package dev.pekelund.receiptlens.records;

import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies manual corrections to records. Every patch is validated against the record invariants before a
 * new record is produced; a rejected patch leaves the original untouched.
 *
 * <p>Corrected fields are treated as user-verified and receive confidence 1.0. A corrected category
 * turns the record into a manually labeled one.
 */
public class ReceiptRecordEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptRecordEditor.class);

    private final Clock clock;

    public ReceiptRecordEditor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ReceiptRecord apply(ReceiptRecord record, RecordPatch patch) {
        Objects.requireNonNull(record, "record");
        if (patch == null || patch.isEmpty()) {
            return record;
        }

        for (RecordField field : patch.clearedFields()) {
            if (!RecordPatch.isClearable(field)) {
                throw new InvalidRecordException("Field '" + field.id() + "' cannot be cleared");
            }
        }

        ReceiptRecord.Builder builder = record.toBuilder();
        FieldConfidence confidence = record.confidence();

        if (patch.clearedFields().contains(RecordField.VENDOR)) {
            builder.vendor(null);
            confidence = confidence.withVendor(0.0);
        } else if (patch.vendor() != null) {
            builder.vendor(patch.vendor());
            confidence = confidence.withVendor(1.0);
        }

        if (patch.clearedFields().contains(RecordField.TRANSACTION_DATE)) {
            builder.transactionDate(null);
            confidence = confidence.withDate(0.0);
        } else if (patch.transactionDate() != null) {
            builder.transactionDate(patch.transactionDate());
            confidence = confidence.withDate(1.0);
        }

        if (patch.clearedFields().contains(RecordField.AMOUNT)) {
            builder.amount(null);
            confidence = confidence.withAmount(0.0);
        } else if (patch.amount() != null) {
            if (patch.amount().signum() < 0) {
                throw new InvalidRecordException(
                    "Amount must not be negative but was " + patch.amount().toPlainString());
            }
            builder.amount(patch.amount());
            confidence = confidence.withAmount(1.0);
        }

        if (patch.category() != null) {
            ReceiptCategory category = ReceiptCategory.find(patch.category())
                .orElseThrow(() -> new InvalidRecordException(
                    "Unknown category '" + patch.category() + "'"));
            builder.category(category).source(RecordSource.MANUALLY_LABELED);
            confidence = confidence.withCategory(1.0);
        }

        ReceiptRecord corrected = builder
            .confidence(confidence)
            .updatedAt(clock.instant())
            .build();
        LOGGER.info("Applied correction to record {} (fields: vendor={}, date={}, amount={}, category={}, cleared={})",
            record.id(), patch.vendor() != null, patch.transactionDate() != null, patch.amount() != null,
            patch.category() != null, patch.clearedFields());
        return corrected;
    }
}
