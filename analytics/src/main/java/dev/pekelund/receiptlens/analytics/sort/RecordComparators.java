package dev.pekelund.receiptlens.analytics.sort;

import dev.pekelund.receiptlens.analytics.UnsupportedFieldException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Ascending comparators for the sortable record fields. Absent values compare after every present value.
 */
public final class RecordComparators {

    private static final Comparator<String> VENDOR_ORDER =
        String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private RecordComparators() {
    }

    public static Comparator<ReceiptRecord> ascending(RecordField field) {
        return switch (field) {
            case VENDOR -> Comparator.comparing(ReceiptRecord::vendor, Comparator.nullsLast(VENDOR_ORDER));
            case TRANSACTION_DATE -> Comparator.comparing(ReceiptRecord::transactionDate,
                Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));
            case AMOUNT -> Comparator.comparing(ReceiptRecord::amount,
                Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()));
            case CATEGORY -> Comparator.comparing((ReceiptRecord record) -> record.category().id());
            case CREATED_AT -> Comparator.comparing(ReceiptRecord::createdAt);
            case RAW_TEXT -> throw new UnsupportedFieldException(field, "sorting");
        };
    }

    public static boolean isSortable(RecordField field) {
        return field != RecordField.RAW_TEXT;
    }
}
