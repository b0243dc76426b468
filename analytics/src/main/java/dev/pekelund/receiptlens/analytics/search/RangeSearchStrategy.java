package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Inclusive bounds on the amount or the transaction date. Either bound may be left open, not both.
 * Records without a value for the field never match.
 */
public class RangeSearchStrategy extends AbstractSearchStrategy {

    public RangeSearchStrategy() {
        super(EnumSet.of(RecordField.AMOUNT, RecordField.TRANSACTION_DATE), false);
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.RANGE;
    }

    @Override
    protected void validateOperands(SearchQuery query) {
        if (query.fields().get(0) == RecordField.AMOUNT) {
            requireBounds(query.minAmount(), query.maxAmount(), "minAmount", "maxAmount");
        } else {
            requireBounds(query.startDate(), query.endDate(), "startDate", "endDate");
        }
    }

    @Override
    protected List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query) {
        boolean amountRange = query.fields().get(0) == RecordField.AMOUNT;
        List<ReceiptRecord> matches = new ArrayList<>();
        for (ReceiptRecord record : snapshot) {
            boolean inRange = amountRange
                ? within(record.amount(), query.minAmount(), query.maxAmount())
                : within(record.transactionDate(), query.startDate(), query.endDate());
            if (inRange) {
                matches.add(record);
            }
        }
        return matches;
    }

    private static <T extends Comparable<? super T>> void requireBounds(T min, T max, String minName,
        String maxName) {
        if (min == null && max == null) {
            throw new InvalidQueryException(minName, null,
                "Range search needs at least one of " + minName + " and " + maxName);
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new InvalidQueryException(minName, min, minName + " " + min + " is after " + maxName + " " + max);
        }
    }

    private static <T extends Comparable<? super T>> boolean within(T value, T min, T max) {
        if (value == null) {
            return false;
        }
        return (min == null || value.compareTo(min) >= 0) && (max == null || value.compareTo(max) <= 0);
    }
}
