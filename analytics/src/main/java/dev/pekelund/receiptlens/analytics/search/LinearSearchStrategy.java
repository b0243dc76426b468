package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Case-insensitive substring scan over one or more text fields; a record matches when any field does.
 */
public class LinearSearchStrategy extends AbstractSearchStrategy {

    public LinearSearchStrategy() {
        super(EnumSet.of(RecordField.VENDOR, RecordField.CATEGORY, RecordField.RAW_TEXT), true);
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.LINEAR;
    }

    @Override
    protected void validateOperands(SearchQuery query) {
        requireTerm(query, "term");
    }

    @Override
    protected List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query) {
        String needle = lower(query.term());
        List<ReceiptRecord> matches = new ArrayList<>();
        for (ReceiptRecord record : snapshot) {
            for (RecordField field : query.fields()) {
                String value = lower(field.textValueOf(record));
                if (value != null && value.contains(needle)) {
                    matches.add(record);
                    break;
                }
            }
        }
        return matches;
    }
}
