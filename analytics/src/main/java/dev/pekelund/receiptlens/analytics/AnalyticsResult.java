package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.analytics.aggregation.AggregationReport;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import java.util.List;
import java.util.Optional;

/**
 * @param records     filtered and ordered records
 * @param inputSize   number of records the query ran against
 * @param aggregation summary of {@code records}, {@code null} when aggregation was not requested
 */
public record AnalyticsResult(List<ReceiptRecord> records, int inputSize, AggregationReport aggregation) {

    public AnalyticsResult {
        records = List.copyOf(records);
    }

    public Optional<AggregationReport> aggregationReport() {
        return Optional.ofNullable(aggregation);
    }
}
