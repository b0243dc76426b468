package dev.pekelund.receiptlens.analytics.sort;

import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One sorting algorithm behind a uniform contract. Every implementation returns a new list and leaves the
 * input untouched; elements that compare equal keep their input order, so all algorithms agree
 * element for element.
 */
public interface SortStrategy {

    SortAlgorithm algorithm();

    <T> List<T> sort(List<T> items, Comparator<? super T> comparator);

    /**
     * Sorts records on a field. Descending output is the exact reverse of ascending output.
     */
    default List<ReceiptRecord> sort(List<ReceiptRecord> records, RecordField field, SortDirection direction) {
        List<ReceiptRecord> sorted = sort(records, RecordComparators.ascending(field));
        if (direction == SortDirection.DESC) {
            Collections.reverse(sorted);
        }
        return sorted;
    }
}
