package dev.pekelund.receiptlens.analytics.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decorates each element with its input position before delegating to the algorithm, which turns any
 * comparator into a total order. Unstable algorithms therefore produce the same output as stable ones.
 */
abstract class AbstractSortStrategy implements SortStrategy {

    @Override
    public final <T> List<T> sort(List<T> items, Comparator<? super T> comparator) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(comparator, "comparator");
        if (items.size() < 2) {
            return new ArrayList<>(items);
        }

        List<Positioned<T>> working = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            working.add(new Positioned<>(items.get(i), i));
        }
        Comparator<Positioned<T>> total = Comparator.<Positioned<T>, T>comparing(Positioned::value, comparator)
            .thenComparingInt(Positioned::position);
        sortInPlace(working, total);

        List<T> sorted = new ArrayList<>(working.size());
        for (Positioned<T> positioned : working) {
            sorted.add(positioned.value());
        }
        return sorted;
    }

    /**
     * Sorts a random-access list in place. The comparator never reports two distinct elements as equal.
     */
    protected abstract <E> void sortInPlace(List<E> items, Comparator<? super E> comparator);

    static <E> void swap(List<E> items, int i, int j) {
        E tmp = items.get(i);
        items.set(i, items.get(j));
        items.set(j, tmp);
    }

    private record Positioned<T>(T value, int position) {
    }
}
