package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.analytics.UnsupportedFieldException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Exact-value index from one field to the records carrying that value. Text keys are case-insensitive,
 * amounts compare numerically (12.5 equals 12.50) and dates compare by calendar day. Records without a
 * value for the field are not indexed. Each bucket keeps the records in the order they were indexed.
 */
public final class RecordHashIndex {

    static final Set<RecordField> SUPPORTED_FIELDS =
        Set.of(RecordField.VENDOR, RecordField.CATEGORY, RecordField.AMOUNT, RecordField.TRANSACTION_DATE);

    private final RecordField field;
    private final Map<Object, List<ReceiptRecord>> buckets;

    private RecordHashIndex(RecordField field, Map<Object, List<ReceiptRecord>> buckets) {
        this.field = field;
        this.buckets = buckets;
    }

    public static RecordHashIndex build(List<ReceiptRecord> records, RecordField field) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(field, "field");
        if (!SUPPORTED_FIELDS.contains(field)) {
            throw new UnsupportedFieldException(field, "hash search");
        }
        Map<Object, List<ReceiptRecord>> buckets = new LinkedHashMap<>();
        for (ReceiptRecord record : records) {
            Object key = keyOf(field, field.valueOf(record));
            if (key != null) {
                buckets.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record);
            }
        }
        buckets.replaceAll((key, bucket) -> Collections.unmodifiableList(bucket));
        return new RecordHashIndex(field, buckets);
    }

    public RecordField field() {
        return field;
    }

    /**
     * Returns the records whose field equals the given textual value.
     *
     * @throws InvalidQueryException when the value cannot be read as the field's type
     */
    public List<ReceiptRecord> lookup(String value) {
        return buckets.getOrDefault(parseKey(field, value), List.of());
    }

    public int distinctValues() {
        return buckets.size();
    }

    static Object parseKey(RecordField field, String value) {
        if (value == null) {
            throw new InvalidQueryException("term", null, "Hash search needs a value");
        }
        String trimmed = value.trim();
        try {
            return switch (field) {
                case AMOUNT -> keyOf(field, new BigDecimal(trimmed.replace("$", "").replace(",", "")));
                case TRANSACTION_DATE -> keyOf(field, LocalDate.parse(trimmed));
                default -> keyOf(field, trimmed);
            };
        } catch (NumberFormatException ex) {
            throw new InvalidQueryException("term", value, "'" + value + "' is not a valid amount");
        } catch (DateTimeParseException ex) {
            throw new InvalidQueryException("term", value, "'" + value + "' is not an ISO date (yyyy-MM-dd)");
        }
    }

    private static Object keyOf(RecordField field, Object value) {
        if (value == null) {
            return null;
        }
        return switch (field) {
            case AMOUNT -> ((BigDecimal) value).stripTrailingZeros();
            case TRANSACTION_DATE -> value;
            default -> value.toString().toLowerCase(Locale.ROOT);
        };
    }
}
