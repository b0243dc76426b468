package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.List;
import java.util.Set;

/**
 * One search algorithm behind a uniform contract. Results are a subsequence of the input in input order;
 * the input list is never modified.
 */
public interface SearchStrategy {

    SearchStrategyType type();

    Set<RecordField> supportedFields();

    /**
     * Checks fields and operands without touching any records.
     *
     * @throws dev.pekelund.receiptlens.analytics.AnalyticsQueryException when the query cannot run
     */
    void validate(SearchQuery query);

    List<ReceiptRecord> search(List<ReceiptRecord> records, SearchQuery query);
}
