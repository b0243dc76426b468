package dev.pekelund.receiptlens.analytics.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.receiptlens.analytics.AnalyticsQueryException;
import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.analytics.InvalidSearchPatternException;
import dev.pekelund.receiptlens.analytics.SampleRecords;
import dev.pekelund.receiptlens.analytics.UnsupportedFieldException;
import dev.pekelund.receiptlens.analytics.sort.MergeSortStrategy;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchStrategyTest {

    private final SearchStrategyRegistry registry = SearchStrategyRegistry.withDefaults(new MergeSortStrategy(),
        FuzzySearchStrategy.DEFAULT_DISTANCE_DIVISOR);
    private final List<ReceiptRecord> records = SampleRecords.mixed();

    @Test
    void linearSearchMatchesSubstringsAcrossFields() {
        assertThat(search(SearchQuery.linear("walmart", RecordField.VENDOR)))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r3", "r6");
        assertThat(search(SearchQuery.linear("88.10", RecordField.VENDOR, RecordField.RAW_TEXT)))
            .extracting(ReceiptRecord::id).containsExactly("r5");
    }

    @Test
    void hashSearchAgreesWithLinearSearchOnExactValues() {
        List<ReceiptRecord> linear = search(SearchQuery.linear("walmart", RecordField.VENDOR)).stream()
            .filter(record -> record.vendor().equalsIgnoreCase("walmart"))
            .toList();

        assertThat(search(SearchQuery.hash(RecordField.VENDOR, "Walmart"))).containsExactlyElementsOf(linear);
    }

    @Test
    void hashAndLinearSearchFindSameRecordsForWholeValueKeyword() {
        List<ReceiptRecord> linear = search(SearchQuery.linear("shopping", RecordField.CATEGORY));
        List<ReceiptRecord> hash = search(SearchQuery.hash(RecordField.CATEGORY, "shopping"));

        assertThat(hash).hasSameSizeAs(linear).containsExactlyElementsOf(linear);
    }

    @Test
    void hashSearchComparesAmountsNumericallyAndDatesByDay() {
        assertThat(search(SearchQuery.hash(RecordField.AMOUNT, "20")))
            .extracting(ReceiptRecord::id).containsExactly("r3");
        assertThat(search(SearchQuery.hash(RecordField.TRANSACTION_DATE, "2024-02-10")))
            .extracting(ReceiptRecord::id).containsExactly("r4");
        assertThat(search(SearchQuery.hash(RecordField.CATEGORY, "SHOPPING")))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r3", "r6");
    }

    @Test
    void hashSearchRejectsUnreadableValues() {
        assertThatThrownBy(() -> search(SearchQuery.hash(RecordField.AMOUNT, "twenty")))
            .isInstanceOf(InvalidQueryException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("term");
        assertThatThrownBy(() -> search(SearchQuery.hash(RecordField.TRANSACTION_DATE, "15/01/2024")))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> search(SearchQuery.hash(RecordField.RAW_TEXT, "walmart")))
            .isInstanceOf(UnsupportedFieldException.class);
    }

    @Test
    void binarySearchFindsExactAndPrefixMatchesInInputOrder() {
        assertThat(search(SearchQuery.binary(RecordField.VENDOR, "WALMART", MatchMode.EXACT)))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r6");
        assertThat(search(SearchQuery.binary(RecordField.VENDOR, "walm", MatchMode.PREFIX)))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r3", "r6");
        assertThat(search(SearchQuery.binary(RecordField.VENDOR, "zzz", MatchMode.PREFIX))).isEmpty();
    }

    @Test
    void binarySearchRunsOnASingleField() {
        SearchQuery query = SearchQuery.builder(SearchStrategyType.BINARY)
            .fields(RecordField.VENDOR, RecordField.CATEGORY)
            .term("walmart")
            .build();

        assertThatThrownBy(() -> search(query))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("single field");
    }

    @Test
    void fuzzySearchToleratesTypos() {
        assertThat(search(SearchQuery.fuzzy(RecordField.VENDOR, "WALMRT")))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r3", "r6");
        assertThat(search(SearchQuery.fuzzy(RecordField.VENDOR, "WALMRT", 0))).isEmpty();
    }

    @Test
    void fuzzySearchRejectsNegativeDistance() {
        assertThatThrownBy(() -> search(SearchQuery.fuzzy(RecordField.VENDOR, "shell", -1)))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("negative");
    }

    @Test
    void patternSearchIsCaseInsensitive() {
        assertThat(search(SearchQuery.pattern(RecordField.VENDOR, "^wal")))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r3", "r6");
        assertThat(search(SearchQuery.pattern(RecordField.RAW_TEXT, "TOTAL\\s+\\d{2}\\.\\d{2}$")))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r2", "r3", "r5");
    }

    @Test
    void invalidPatternIsReportedAsError() {
        assertThatThrownBy(() -> search(SearchQuery.pattern(RecordField.VENDOR, "[unclosed")))
            .isInstanceOf(InvalidSearchPatternException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("pattern");
    }

    @Test
    void amountRangeIsInclusive() {
        assertThat(search(SearchQuery.amountRange(new BigDecimal("15"), new BigDecimal("25"))))
            .extracting(ReceiptRecord::id).containsExactly("r3");
        assertThat(search(SearchQuery.amountRange(new BigDecimal("12.50"), new BigDecimal("20.00"))))
            .extracting(ReceiptRecord::id).containsExactly("r2", "r3");
        assertThat(search(SearchQuery.amountRange(new BigDecimal("50"), null)))
            .extracting(ReceiptRecord::id).containsExactly("r5");
    }

    @Test
    void dateRangeLeavesOutUndatedRecords() {
        assertThat(search(SearchQuery.dateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31))))
            .extracting(ReceiptRecord::id).containsExactly("r1", "r2");
        assertThat(search(SearchQuery.dateRange(null, LocalDate.of(2024, 12, 31))))
            .extracting(ReceiptRecord::id).doesNotContain("r5").hasSize(5);
    }

    @Test
    void rangeSearchRejectsInvertedOrMissingBounds() {
        assertThatThrownBy(() -> search(SearchQuery.amountRange(new BigDecimal("30"), new BigDecimal("10"))))
            .isInstanceOf(InvalidQueryException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("minAmount");
        assertThatThrownBy(() -> search(SearchQuery.dateRange(null, null)))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("startDate");
    }

    @Test
    void blankTermIsRejectedEvenForEmptyInput() {
        SearchQuery query = SearchQuery.linear("  ", RecordField.VENDOR);

        assertThatThrownBy(() -> registry.get(SearchStrategyType.LINEAR).search(List.of(), query))
            .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void emptyInputGivesEmptyResult() {
        for (SearchStrategyType type : SearchStrategyType.values()) {
            SearchQuery query = switch (type) {
                case RANGE -> SearchQuery.amountRange(BigDecimal.ONE, BigDecimal.TEN);
                case BINARY -> SearchQuery.binary(RecordField.VENDOR, "a", MatchMode.PREFIX);
                default -> SearchQuery.builder(type).fields(RecordField.VENDOR).term("walmart").build();
            };
            assertThat(registry.get(type).search(List.of(), query)).as(type.id()).isEmpty();
        }
    }

    @Test
    void searchNeverReordersOrModifiesInput() {
        List<ReceiptRecord> input = new ArrayList<>(records);

        registry.get(SearchStrategyType.BINARY).search(input, SearchQuery.binary(RecordField.VENDOR, "shell",
            MatchMode.EXACT));

        assertThat(input).containsExactlyElementsOf(records);
    }

    @Test
    void strategyRejectsQueryMeantForAnotherStrategy() {
        SearchStrategy linear = registry.get(SearchStrategyType.LINEAR);

        assertThatThrownBy(() -> linear.search(records, SearchQuery.hash(RecordField.VENDOR, "shell")))
            .isInstanceOf(InvalidQueryException.class)
            .extracting(ex -> ((AnalyticsQueryException) ex).getParameter())
            .isEqualTo("strategy");
    }

    @Test
    void hashIndexGroupsRecordsByValue() {
        RecordHashIndex index = RecordHashIndex.build(records, RecordField.CATEGORY);

        assertThat(index.field()).isEqualTo(RecordField.CATEGORY);
        assertThat(index.distinctValues()).isEqualTo(4);
        assertThat(index.lookup("Shopping")).extracting(ReceiptRecord::id).containsExactly("r1", "r3", "r6");
        assertThat(index.lookup("utilities")).isEmpty();
    }

    @Test
    void levenshteinDistanceCountsEdits() {
        assertThat(LevenshteinDistance.between("kitten", "sitting")).isEqualTo(3);
        assertThat(LevenshteinDistance.between("", "abc")).isEqualTo(3);
        assertThat(LevenshteinDistance.isWithin("walmart", "walmrt", 1)).isTrue();
        assertThat(LevenshteinDistance.isWithin("walmart", "target", 2)).isFalse();
    }

    @Test
    void resolvesStrategyIdentifiers() {
        assertThat(SearchStrategyType.fromId(" Fuzzy ")).isEqualTo(SearchStrategyType.FUZZY);
        assertThatThrownBy(() -> SearchStrategyType.fromId("bogus"))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("bogus");
    }

    private List<ReceiptRecord> search(SearchQuery query) {
        return registry.get(query.strategy()).search(records, query);
    }
}
