package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.records.ReceiptRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Exact-value lookup through a {@link RecordHashIndex} built once per call.
 */
public class HashSearchStrategy extends AbstractSearchStrategy {

    public HashSearchStrategy() {
        super(RecordHashIndex.SUPPORTED_FIELDS, false);
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.HASH;
    }

    @Override
    protected void validateOperands(SearchQuery query) {
        requireTerm(query, "term");
        RecordHashIndex.parseKey(query.fields().get(0), query.term());
    }

    @Override
    protected List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query) {
        RecordHashIndex index = RecordHashIndex.build(snapshot, query.fields().get(0));
        return new ArrayList<>(index.lookup(query.term()));
    }
}
