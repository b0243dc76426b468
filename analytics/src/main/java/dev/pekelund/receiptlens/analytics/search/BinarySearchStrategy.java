package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.sort.SortStrategy;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Exact or prefix lookup on a sorted key. The records are sorted on the lowercased field value with the
 * configured {@link SortStrategy}, the lower bound of the term is located by bisection and the contiguous
 * run of matching keys is collected. Matches are returned in input order.
 */
public class BinarySearchStrategy extends AbstractSearchStrategy {

    private final SortStrategy sortStrategy;

    public BinarySearchStrategy(SortStrategy sortStrategy) {
        super(EnumSet.of(RecordField.VENDOR, RecordField.CATEGORY), false);
        this.sortStrategy = Objects.requireNonNull(sortStrategy, "sortStrategy");
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.BINARY;
    }

    @Override
    protected void validateOperands(SearchQuery query) {
        requireTerm(query, "term");
    }

    @Override
    protected List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query) {
        RecordField field = query.fields().get(0);
        String needle = lower(query.term());

        List<Entry> entries = new ArrayList<>(snapshot.size());
        for (int i = 0; i < snapshot.size(); i++) {
            String key = lower(field.textValueOf(snapshot.get(i)));
            if (key != null) {
                entries.add(new Entry(key, i));
            }
        }
        List<Entry> sorted = sortStrategy.sort(entries, Comparator.comparing(Entry::key));

        boolean[] hit = new boolean[snapshot.size()];
        for (int i = lowerBound(sorted, needle); i < sorted.size(); i++) {
            Entry entry = sorted.get(i);
            boolean matches = query.matchMode() == MatchMode.PREFIX
                ? entry.key().startsWith(needle)
                : entry.key().equals(needle);
            if (!matches) {
                break;
            }
            hit[entry.position()] = true;
        }

        List<ReceiptRecord> matches = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            if (hit[i]) {
                matches.add(snapshot.get(i));
            }
        }
        return matches;
    }

    /**
     * First index whose key is not less than the needle.
     */
    private static int lowerBound(List<Entry> sorted, String needle) {
        int low = 0;
        int high = sorted.size();
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (sorted.get(middle).key().compareTo(needle) < 0) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return low;
    }

    private record Entry(String key, int position) {
    }
}
