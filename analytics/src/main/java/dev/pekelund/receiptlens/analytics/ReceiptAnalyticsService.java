package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.analytics.aggregation.AggregationReport;
import dev.pekelund.receiptlens.analytics.export.ExportFormat;
import dev.pekelund.receiptlens.analytics.export.ReceiptRecordExporter;
import dev.pekelund.receiptlens.analytics.search.SearchQuery;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.storage.ReceiptRecordStore;
import java.util.List;
import java.util.Objects;

/**
 * Runs analytics against a snapshot of the record store.
 */
public class ReceiptAnalyticsService {

    private final AnalyticsFacade facade;
    private final ReceiptRecordStore store;
    private final ReceiptRecordExporter exporter;

    public ReceiptAnalyticsService(AnalyticsFacade facade, ReceiptRecordStore store, ReceiptRecordExporter exporter) {
        this.facade = Objects.requireNonNull(facade, "facade");
        this.store = Objects.requireNonNull(store, "store");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    public AnalyticsResult query(AnalyticsQuery query) {
        return facade.query(store.list(), query);
    }

    public List<ReceiptRecord> search(SearchQuery query) {
        return facade.search(store.list(), query);
    }

    public AggregationReport aggregate() {
        return facade.aggregate(store.list());
    }

    /**
     * Exports the records a query selects; a query without searches or sort exports the whole store newest
     * first.
     */
    public String export(AnalyticsQuery query, ExportFormat format) {
        return exporter.export(facade.query(store.list(), query).records(), format);
    }
}
