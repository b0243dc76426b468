package dev.pekelund.receiptlens.analytics.sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Natural-runs merge sort. Existing ascending runs are kept, strictly descending runs are reversed in
 * place, and adjacent runs are merged pairwise until one remains. Already ordered input costs a single
 * O(n) pass.
 */
public class AdaptiveSortStrategy extends AbstractSortStrategy {

    @Override
    public SortAlgorithm algorithm() {
        return SortAlgorithm.ADAPTIVE;
    }

    @Override
    protected <E> void sortInPlace(List<E> items, Comparator<? super E> comparator) {
        List<Integer> runStarts = findRuns(items, comparator);
        if (runStarts.size() == 1) {
            return;
        }
        List<E> buffer = new ArrayList<>(items);
        int size = items.size();
        while (runStarts.size() > 1) {
            List<Integer> merged = new ArrayList<>();
            for (int i = 0; i < runStarts.size(); i += 2) {
                int from = runStarts.get(i);
                merged.add(from);
                if (i + 1 < runStarts.size()) {
                    int middle = runStarts.get(i + 1);
                    int to = i + 2 < runStarts.size() ? runStarts.get(i + 2) : size;
                    MergeSortStrategy.merge(items, buffer, from, middle, to, comparator);
                }
            }
            runStarts = merged;
        }
    }

    private static <E> List<Integer> findRuns(List<E> items, Comparator<? super E> comparator) {
        List<Integer> runStarts = new ArrayList<>();
        int size = items.size();
        int start = 0;
        while (start < size) {
            runStarts.add(start);
            int end = start + 1;
            if (end < size && comparator.compare(items.get(end), items.get(start)) < 0) {
                while (end < size && comparator.compare(items.get(end), items.get(end - 1)) < 0) {
                    end++;
                }
                Collections.reverse(items.subList(start, end));
            } else {
                while (end < size && comparator.compare(items.get(end), items.get(end - 1)) >= 0) {
                    end++;
                }
            }
            start = end;
        }
        return runStarts;
    }
}
