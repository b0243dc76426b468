package dev.pekelund.receiptlens.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import dev.pekelund.receiptlens.analytics.aggregation.AggregationEngine;
import dev.pekelund.receiptlens.analytics.aggregation.AggregationReport;
import dev.pekelund.receiptlens.analytics.aggregation.TimeInterval;
import dev.pekelund.receiptlens.analytics.search.FuzzySearchStrategy;
import dev.pekelund.receiptlens.analytics.search.MatchMode;
import dev.pekelund.receiptlens.analytics.search.SearchQuery;
import dev.pekelund.receiptlens.analytics.search.SearchStrategyRegistry;
import dev.pekelund.receiptlens.analytics.sort.MergeSortStrategy;
import dev.pekelund.receiptlens.analytics.sort.SortAlgorithm;
import dev.pekelund.receiptlens.analytics.sort.SortDirection;
import dev.pekelund.receiptlens.analytics.sort.SortStrategyRegistry;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalyticsFacadeTest {

    private AggregationEngine aggregationEngine;
    private AnalyticsFacade facade;

    @BeforeEach
    void setUp() {
        aggregationEngine = spy(new AggregationEngine(new MergeSortStrategy()));
        facade = new AnalyticsFacade(
            SearchStrategyRegistry.withDefaults(new MergeSortStrategy(), FuzzySearchStrategy.DEFAULT_DISTANCE_DIVISOR),
            SortStrategyRegistry.withDefaults(), aggregationEngine, SortAlgorithm.MERGESORT, 3);
    }

    @Test
    void queryFiltersThenSortsThenAggregates() {
        AnalyticsQuery query = AnalyticsQuery.builder()
            .search(SearchQuery.linear("walmart", RecordField.VENDOR))
            .sort(SortRequest.of("amount", "quicksort", "asc"))
            .aggregate()
            .build();

        AnalyticsResult result = facade.query(SampleRecords.mixed(), query);

        assertThat(result.records()).extracting(ReceiptRecord::id).containsExactly("r6", "r3", "r1");
        assertThat(result.inputSize()).isEqualTo(6);
        AggregationReport report = result.aggregationReport().orElseThrow();
        assertThat(report.statistics().count()).isEqualTo(3);
        assertThat(report.statistics().sum()).isEqualByComparingTo("75.66");
        assertThat(report.windowSize()).isEqualTo(3);
    }

    @Test
    void searchesAreCombinedWithLogicalAnd() {
        List<SearchQuery> searches = List.of(
            SearchQuery.binary(RecordField.CATEGORY, "shopping", MatchMode.EXACT),
            SearchQuery.amountRange(new BigDecimal("10"), null));

        assertThat(facade.search(SampleRecords.mixed(), searches))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r3");
    }

    @Test
    void queryWithoutStagesReturnsInputUnchanged() {
        AnalyticsResult result = facade.query(SampleRecords.mixed(), AnalyticsQuery.builder().build());

        assertThat(result.records()).containsExactlyElementsOf(SampleRecords.mixed());
        assertThat(result.aggregationReport()).isEmpty();
    }

    @Test
    void invalidQueryFailsBeforeAnyStageRuns() {
        AnalyticsQuery query = AnalyticsQuery.builder()
            .search(SearchQuery.linear("walmart", RecordField.VENDOR))
            .search(SearchQuery.pattern(RecordField.VENDOR, "(broken"))
            .aggregate()
            .build();

        assertThatThrownBy(() -> facade.query(SampleRecords.mixed(), query))
            .isInstanceOf(InvalidSearchPatternException.class);
        verify(aggregationEngine, never()).aggregate(any(), anyInt());
    }

    @Test
    void rejectsUnsortableFieldAndBadWindowSize() {
        AnalyticsQuery rawTextSort = AnalyticsQuery.builder()
            .sort(SortRequest.by(RecordField.RAW_TEXT, SortDirection.ASC))
            .build();
        AnalyticsQuery zeroWindow = AnalyticsQuery.builder().windowSize(0).build();

        assertThatThrownBy(() -> facade.query(SampleRecords.mixed(), rawTextSort))
            .isInstanceOf(UnsupportedFieldException.class);
        assertThatThrownBy(() -> facade.query(SampleRecords.mixed(), zeroWindow))
            .isInstanceOf(InvalidQueryException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("windowSize");
    }

    @Test
    void unknownSelectorsAreReportedWithTheirParameter() {
        assertThatThrownBy(() -> SortRequest.of("colour", null, null))
            .isInstanceOf(InvalidQueryException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("field");
        assertThatThrownBy(() -> SortRequest.of("vendor", "bubblesort", null))
            .isInstanceOf(InvalidQueryException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("algorithm");
    }

    @Test
    void operationsNeverModifyTheirInput() {
        List<ReceiptRecord> input = new ArrayList<>(SampleRecords.mixed());

        facade.sort(input, RecordField.VENDOR, SortAlgorithm.HEAPSORT, SortDirection.DESC);
        facade.search(input, SearchQuery.fuzzy(RecordField.VENDOR, "shel"));
        facade.aggregate(input);
        facade.timeSeries(input, TimeInterval.WEEK);

        assertThat(input).containsExactlyElementsOf(SampleRecords.mixed());
    }

    @Test
    void sortUsesRequestedAlgorithmAndDirection() {
        List<ReceiptRecord> sorted = facade.sort(SampleRecords.mixed(), RecordField.TRANSACTION_DATE,
            SortAlgorithm.ADAPTIVE, SortDirection.ASC);

        assertThat(sorted).extracting(ReceiptRecord::id).containsExactly("r1", "r2", "r3", "r4", "r6", "r5");
    }

    @Test
    void aggregateUsesConfiguredWindowSize() {
        AggregationReport report = facade.aggregate(SampleRecords.mixed());

        assertThat(report.windowSize()).isEqualTo(3);
        assertThat(report.slidingWindow()).hasSize(3);
        assertThat(facade.aggregate(SampleRecords.mixed(), 1).windowSize()).isEqualTo(1);
    }

    @Test
    void facadeRequiresPositiveDefaultWindow() {
        SortStrategyRegistry sorts = SortStrategyRegistry.withDefaults();
        SearchStrategyRegistry searches = SearchStrategyRegistry.withDefaults(new MergeSortStrategy(), 3);
        AggregationEngine engine = mock(AggregationEngine.class);

        assertThatThrownBy(() -> new AnalyticsFacade(searches, sorts, engine, SortAlgorithm.MERGESORT, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
