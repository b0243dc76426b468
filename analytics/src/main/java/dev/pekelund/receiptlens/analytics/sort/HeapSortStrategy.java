package dev.pekelund.receiptlens.analytics.sort;

import java.util.Comparator;
import java.util.List;

/**
 * In-place heap sort over a max-heap. O(n log n) in every case.
 */
public class HeapSortStrategy extends AbstractSortStrategy {

    @Override
    public SortAlgorithm algorithm() {
        return SortAlgorithm.HEAPSORT;
    }

    @Override
    protected <E> void sortInPlace(List<E> items, Comparator<? super E> comparator) {
        int size = items.size();
        for (int parent = size / 2 - 1; parent >= 0; parent--) {
            siftDown(items, parent, size, comparator);
        }
        for (int end = size - 1; end > 0; end--) {
            swap(items, 0, end);
            siftDown(items, 0, end, comparator);
        }
    }

    private static <E> void siftDown(List<E> items, int parent, int size, Comparator<? super E> comparator) {
        int current = parent;
        while (true) {
            int largest = current;
            int left = 2 * current + 1;
            int right = left + 1;
            if (left < size && comparator.compare(items.get(left), items.get(largest)) > 0) {
                largest = left;
            }
            if (right < size && comparator.compare(items.get(right), items.get(largest)) > 0) {
                largest = right;
            }
            if (largest == current) {
                return;
            }
            swap(items, current, largest);
            current = largest;
        }
    }
}
