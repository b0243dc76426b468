package dev.pekelund.receiptlens.records;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Field-level correction for a stored record. {@code null} values leave the field untouched; fields
 * listed in {@link #clearedFields()} are reset to absent.
 *
 * <p>The category travels as its identifier so that out-of-range values reach the validation in
 * {@link ReceiptRecordEditor} instead of being lost in a lookup.
 */
public record RecordPatch(
    String vendor,
    LocalDate transactionDate,
    BigDecimal amount,
    String category,
    Set<RecordField> clearedFields
) {

    private static final Set<RecordField> CLEARABLE = EnumSet.of(
        RecordField.VENDOR, RecordField.TRANSACTION_DATE, RecordField.AMOUNT);

    public RecordPatch {
        clearedFields = clearedFields == null || clearedFields.isEmpty()
            ? Set.of()
            : Set.copyOf(clearedFields);
    }

    public boolean isEmpty() {
        return vendor == null && transactionDate == null && amount == null && category == null
            && clearedFields.isEmpty();
    }

    static boolean isClearable(RecordField field) {
        return CLEARABLE.contains(field);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String vendor;
        private LocalDate transactionDate;
        private BigDecimal amount;
        private String category;
        private final Set<RecordField> clearedFields = EnumSet.noneOf(RecordField.class);

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

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder category(ReceiptCategory category) {
            this.category = category == null ? null : category.id();
            return this;
        }

        public Builder clear(RecordField field) {
            this.clearedFields.add(field);
            return this;
        }

        public RecordPatch build() {
            return new RecordPatch(vendor, transactionDate, amount, category, clearedFields);
        }
    }
}
