package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.analytics.aggregation.AggregationEngine;
import dev.pekelund.receiptlens.analytics.aggregation.AggregationReport;
import dev.pekelund.receiptlens.analytics.aggregation.TimeInterval;
import dev.pekelund.receiptlens.analytics.aggregation.TimeSeries;
import dev.pekelund.receiptlens.analytics.search.SearchQuery;
import dev.pekelund.receiptlens.analytics.search.SearchStrategy;
import dev.pekelund.receiptlens.analytics.search.SearchStrategyRegistry;
import dev.pekelund.receiptlens.analytics.sort.RecordComparators;
import dev.pekelund.receiptlens.analytics.sort.SortAlgorithm;
import dev.pekelund.receiptlens.analytics.sort.SortDirection;
import dev.pekelund.receiptlens.analytics.sort.SortStrategyRegistry;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for searching, sorting and aggregating receipt records.
 *
 * <p>{@link #query(List, AnalyticsQuery)} runs filter, then order, then summarise. The whole query is
 * validated before any stage runs, so an invalid query never produces a partial result. Every operation
 * works on a snapshot of the input list and never modifies it.</p>
 */
public class AnalyticsFacade {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsFacade.class);

    private final SearchStrategyRegistry searchStrategies;
    private final SortStrategyRegistry sortStrategies;
    private final AggregationEngine aggregationEngine;
    private final SortAlgorithm defaultSortAlgorithm;
    private final int defaultWindowSize;

    public AnalyticsFacade(SearchStrategyRegistry searchStrategies, SortStrategyRegistry sortStrategies,
        AggregationEngine aggregationEngine, SortAlgorithm defaultSortAlgorithm, int defaultWindowSize) {
        this.searchStrategies = Objects.requireNonNull(searchStrategies, "searchStrategies");
        this.sortStrategies = Objects.requireNonNull(sortStrategies, "sortStrategies");
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine, "aggregationEngine");
        this.defaultSortAlgorithm = Objects.requireNonNull(defaultSortAlgorithm, "defaultSortAlgorithm");
        if (defaultWindowSize < 1) {
            throw new IllegalArgumentException("defaultWindowSize must be at least 1");
        }
        this.defaultWindowSize = defaultWindowSize;
    }

    public List<ReceiptRecord> search(List<ReceiptRecord> records, SearchQuery query) {
        Objects.requireNonNull(query, "query");
        return searchStrategies.get(query.strategy()).search(snapshot(records), query);
    }

    /**
     * Runs each query against the same snapshot and keeps the records every query matched, in input order.
     */
    public List<ReceiptRecord> search(List<ReceiptRecord> records, List<SearchQuery> queries) {
        queries.forEach(this::validateSearch);
        return filter(snapshot(records), queries);
    }

    public List<ReceiptRecord> sort(List<ReceiptRecord> records, RecordField field, SortAlgorithm algorithm,
        SortDirection direction) {
        SortRequest request = new SortRequest(field, algorithm, direction);
        validateSort(request);
        return order(snapshot(records), request);
    }

    public AggregationReport aggregate(List<ReceiptRecord> records) {
        return aggregate(records, defaultWindowSize);
    }

    public AggregationReport aggregate(List<ReceiptRecord> records, int windowSize) {
        return aggregationEngine.aggregate(snapshot(records), windowSize);
    }

    public TimeSeries timeSeries(List<ReceiptRecord> records, TimeInterval interval) {
        return aggregationEngine.timeSeries(snapshot(records), interval);
    }

    public AnalyticsResult query(List<ReceiptRecord> records, AnalyticsQuery query) {
        Objects.requireNonNull(query, "query");
        query.searches().forEach(this::validateSearch);
        if (query.sort() != null) {
            validateSort(query.sort());
        }
        int windowSize = query.windowSize() != null ? query.windowSize() : defaultWindowSize;
        if (query.aggregate() && windowSize < 1) {
            throw new InvalidQueryException("windowSize", windowSize, "Window size must be at least 1");
        }

        List<ReceiptRecord> snapshot = snapshot(records);
        List<ReceiptRecord> filtered = query.searches().isEmpty() ? snapshot : filter(snapshot, query.searches());
        List<ReceiptRecord> ordered = query.sort() != null ? order(filtered, query.sort()) : filtered;
        AggregationReport report = query.aggregate() ? aggregationEngine.aggregate(ordered, windowSize) : null;

        LOGGER.debug("Analytics query over {} records: {} searches, sort {}, aggregate {} -> {} records",
            snapshot.size(), query.searches().size(), query.sort(), query.aggregate(), ordered.size());
        return new AnalyticsResult(ordered, snapshot.size(), report);
    }

    private void validateSearch(SearchQuery query) {
        Objects.requireNonNull(query, "query");
        searchStrategies.get(query.strategy()).validate(query);
    }

    private void validateSort(SortRequest request) {
        if (!RecordComparators.isSortable(request.field())) {
            throw new UnsupportedFieldException(request.field(), "sorting");
        }
    }

    private List<ReceiptRecord> filter(List<ReceiptRecord> snapshot, List<SearchQuery> queries) {
        List<ReceiptRecord> remaining = snapshot;
        for (SearchQuery query : queries) {
            SearchStrategy strategy = searchStrategies.get(query.strategy());
            Set<ReceiptRecord> matched = Collections.newSetFromMap(new IdentityHashMap<>());
            matched.addAll(strategy.search(snapshot, query));
            List<ReceiptRecord> next = new ArrayList<>();
            for (ReceiptRecord record : remaining) {
                if (matched.contains(record)) {
                    next.add(record);
                }
            }
            remaining = next;
        }
        return remaining;
    }

    private List<ReceiptRecord> order(List<ReceiptRecord> records, SortRequest request) {
        SortAlgorithm algorithm = request.algorithm() != null ? request.algorithm() : defaultSortAlgorithm;
        return sortStrategies.get(algorithm).sort(records, request.field(), request.direction());
    }

    private static List<ReceiptRecord> snapshot(List<ReceiptRecord> records) {
        return new ArrayList<>(Objects.requireNonNull(records, "records"));
    }
}
