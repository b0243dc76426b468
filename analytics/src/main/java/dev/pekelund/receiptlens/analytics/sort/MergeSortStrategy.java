package dev.pekelund.receiptlens.analytics.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Top-down divide-and-merge sort using one auxiliary buffer. O(n log n) in every case.
 */
public class MergeSortStrategy extends AbstractSortStrategy {

    @Override
    public SortAlgorithm algorithm() {
        return SortAlgorithm.MERGESORT;
    }

    @Override
    protected <E> void sortInPlace(List<E> items, Comparator<? super E> comparator) {
        List<E> buffer = new ArrayList<>(items);
        mergeSort(items, buffer, 0, items.size(), comparator);
    }

    private static <E> void mergeSort(List<E> items, List<E> buffer, int from, int to,
        Comparator<? super E> comparator) {
        if (to - from < 2) {
            return;
        }
        int middle = (from + to) >>> 1;
        mergeSort(items, buffer, from, middle, comparator);
        mergeSort(items, buffer, middle, to, comparator);
        if (comparator.compare(items.get(middle - 1), items.get(middle)) <= 0) {
            return;
        }
        merge(items, buffer, from, middle, to, comparator);
    }

    static <E> void merge(List<E> items, List<E> buffer, int from, int middle, int to,
        Comparator<? super E> comparator) {
        for (int k = from; k < to; k++) {
            buffer.set(k, items.get(k));
        }
        int left = from;
        int right = middle;
        for (int k = from; k < to; k++) {
            if (left >= middle) {
                items.set(k, buffer.get(right++));
            } else if (right >= to) {
                items.set(k, buffer.get(left++));
            } else if (comparator.compare(buffer.get(right), buffer.get(left)) < 0) {
                items.set(k, buffer.get(right++));
            } else {
                items.set(k, buffer.get(left++));
            }
        }
    }
}
