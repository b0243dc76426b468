package dev.pekelund.receiptlens.analytics.sort;

import static dev.pekelund.receiptlens.analytics.SampleRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.receiptlens.analytics.SampleRecords;
import dev.pekelund.receiptlens.analytics.UnsupportedFieldException;
import dev.pekelund.receiptlens.records.ReceiptCategory;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SortStrategyTest {

    private final SortStrategyRegistry registry = SortStrategyRegistry.withDefaults();

    @ParameterizedTest
    @EnumSource(SortAlgorithm.class)
    void sortsAmountsAscendingWithAbsentValuesLast(SortAlgorithm algorithm) {
        List<ReceiptRecord> sorted = registry.get(algorithm)
            .sort(SampleRecords.mixed(), RecordField.AMOUNT, SortDirection.ASC);

        assertThat(sorted).extracting(ReceiptRecord::id).containsExactly("r6", "r2", "r3", "r1", "r5", "r4");
    }

    @ParameterizedTest
    @EnumSource(SortAlgorithm.class)
    void sortsVendorsCaseInsensitively(SortAlgorithm algorithm) {
        List<ReceiptRecord> sorted = registry.get(algorithm)
            .sort(SampleRecords.mixed(), RecordField.VENDOR, SortDirection.ASC);

        assertThat(sorted).extracting(ReceiptRecord::vendor).containsExactly(
            "Corner Cafe", "Shell", "WALMART", "WALMART", "Walmart Supercenter", "Whole Foods Market");
        assertThat(sorted).extracting(ReceiptRecord::id).containsSubsequence("r1", "r6");
    }

    @ParameterizedTest
    @EnumSource(SortAlgorithm.class)
    void descendingIsReverseOfAscending(SortAlgorithm algorithm) {
        SortStrategy strategy = registry.get(algorithm);
        List<ReceiptRecord> ascending = strategy.sort(SampleRecords.mixed(), RecordField.TRANSACTION_DATE,
            SortDirection.ASC);
        List<ReceiptRecord> descending = strategy.sort(SampleRecords.mixed(), RecordField.TRANSACTION_DATE,
            SortDirection.DESC);

        List<ReceiptRecord> reversed = new ArrayList<>(ascending);
        Collections.reverse(reversed);
        assertThat(descending).containsExactlyElementsOf(reversed);
        assertThat(descending.get(0).id()).isEqualTo("r5");
    }

    @Test
    void allAlgorithmsAgreeOnLargeInputWithDuplicates() {
        Random random = new Random(42);
        List<Integer> values = IntStream.range(0, 500)
            .mapToObj(ignored -> random.nextInt(40))
            .collect(Collectors.toList());
        List<Integer> expected = new ArrayList<>(values);
        expected.sort(Comparator.naturalOrder());

        for (SortAlgorithm algorithm : SortAlgorithm.values()) {
            assertThat(registry.get(algorithm).sort(values, Comparator.<Integer>naturalOrder()))
                .as(algorithm.id())
                .containsExactlyElementsOf(expected);
        }
    }

    @Test
    void equalKeysKeepInputOrderForEveryAlgorithm() {
        List<ReceiptRecord> records = IntStream.range(1, 40)
            .mapToObj(i -> record("r" + i, "Vendor " + (i % 3), "2024-01-01", "10.00", ReceiptCategory.OTHER))
            .toList();

        List<String> expected = null;
        for (SortAlgorithm algorithm : SortAlgorithm.values()) {
            List<String> ids = registry.get(algorithm).sort(records, RecordField.CATEGORY, SortDirection.ASC)
                .stream().map(ReceiptRecord::id).toList();
            assertThat(ids).as(algorithm.id()).isEqualTo(records.stream().map(ReceiptRecord::id).toList());
            if (expected != null) {
                assertThat(ids).isEqualTo(expected);
            }
            expected = ids;
        }
    }

    @Test
    void adaptiveSortHandlesPresortedAndReversedRuns() {
        List<Integer> values = new ArrayList<>(IntStream.rangeClosed(1, 50).boxed().toList());
        values.addAll(IntStream.iterate(100, i -> i > 50, i -> i - 1).boxed().toList());

        List<Integer> sorted = new AdaptiveSortStrategy().sort(values, Comparator.<Integer>naturalOrder());

        assertThat(sorted).isSorted().hasSize(100).startsWith(1, 2, 3).endsWith(99, 100);
    }

    @Test
    void leavesInputUntouched() {
        List<Integer> values = new ArrayList<>(List.of(5, 3, 9, 1));

        for (SortAlgorithm algorithm : SortAlgorithm.values()) {
            assertThat(registry.get(algorithm).sort(values, Comparator.<Integer>naturalOrder()))
                .containsExactly(1, 3, 5, 9);
        }
        assertThat(values).containsExactly(5, 3, 9, 1);
    }

    @Test
    void handlesEmptyAndSingletonInput() {
        for (SortAlgorithm algorithm : SortAlgorithm.values()) {
            SortStrategy strategy = registry.get(algorithm);
            assertThat(strategy.sort(List.<Integer>of(), Comparator.<Integer>naturalOrder())).isEmpty();
            assertThat(strategy.sort(List.of(7), Comparator.<Integer>naturalOrder())).containsExactly(7);
        }
    }

    @Test
    void rejectsRawTextAsSortKey() {
        SortStrategy strategy = registry.get(SortAlgorithm.QUICKSORT);

        assertThatThrownBy(() -> strategy.sort(SampleRecords.mixed(), RecordField.RAW_TEXT, SortDirection.ASC))
            .isInstanceOf(UnsupportedFieldException.class)
            .hasMessageContaining("raw_text");
    }

    @Test
    void resolvesAlgorithmAndDirectionIdentifiers() {
        assertThat(SortAlgorithm.fromId("HeapSort")).isEqualTo(SortAlgorithm.HEAPSORT);
        assertThat(SortDirection.fromId("descending")).isEqualTo(SortDirection.DESC);
    }
}
