package dev.pekelund.receiptlens.analytics.sort;

import java.util.Comparator;
import java.util.List;

/**
 * Partition-exchange sort with a median-of-three pivot and insertion sort for short ranges.
 *
 * <p>Median-of-three keeps already sorted and reverse-sorted input at O(n log n); crafted adversarial
 * input can still drive it to O(n^2). Recursion always descends into the smaller partition, bounding the
 * stack depth at O(log n).</p>
 */
public class QuickSortStrategy extends AbstractSortStrategy {

    private static final int INSERTION_THRESHOLD = 10;

    @Override
    public SortAlgorithm algorithm() {
        return SortAlgorithm.QUICKSORT;
    }

    @Override
    protected <E> void sortInPlace(List<E> items, Comparator<? super E> comparator) {
        quickSort(items, 0, items.size() - 1, comparator);
    }

    private static <E> void quickSort(List<E> items, int low, int high, Comparator<? super E> comparator) {
        while (high - low >= INSERTION_THRESHOLD) {
            int pivotIndex = partition(items, low, high, comparator);
            if (pivotIndex - low < high - pivotIndex) {
                quickSort(items, low, pivotIndex - 1, comparator);
                low = pivotIndex + 1;
            } else {
                quickSort(items, pivotIndex + 1, high, comparator);
                high = pivotIndex - 1;
            }
        }
        insertionSort(items, low, high, comparator);
    }

    private static <E> int partition(List<E> items, int low, int high, Comparator<? super E> comparator) {
        int middle = low + (high - low) / 2;
        if (comparator.compare(items.get(middle), items.get(low)) < 0) {
            swap(items, middle, low);
        }
        if (comparator.compare(items.get(high), items.get(low)) < 0) {
            swap(items, high, low);
        }
        if (comparator.compare(items.get(high), items.get(middle)) < 0) {
            swap(items, high, middle);
        }
        // median now sits at middle; park it just before the end
        swap(items, middle, high - 1);
        E pivot = items.get(high - 1);

        int i = low;
        int j = high - 1;
        while (true) {
            do {
                i++;
            } while (comparator.compare(items.get(i), pivot) < 0);
            do {
                j--;
            } while (comparator.compare(items.get(j), pivot) > 0);
            if (i >= j) {
                break;
            }
            swap(items, i, j);
        }
        swap(items, i, high - 1);
        return i;
    }

    private static <E> void insertionSort(List<E> items, int low, int high, Comparator<? super E> comparator) {
        for (int i = low + 1; i <= high; i++) {
            E current = items.get(i);
            int j = i - 1;
            while (j >= low && comparator.compare(items.get(j), current) > 0) {
                items.set(j + 1, items.get(j));
                j--;
            }
            items.set(j + 1, current);
        }
    }
}
