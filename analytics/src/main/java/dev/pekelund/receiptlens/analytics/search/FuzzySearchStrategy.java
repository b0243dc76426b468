package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Approximate text match by Levenshtein distance, case-insensitive. A field matches when its whole value
 * or any of its whitespace-separated tokens is within the threshold of the term. Without an explicit
 * threshold the limit is {@code max(1, termLength / divisor)}.
 */
public class FuzzySearchStrategy extends AbstractSearchStrategy {

    public static final int DEFAULT_DISTANCE_DIVISOR = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int distanceDivisor;

    public FuzzySearchStrategy() {
        this(DEFAULT_DISTANCE_DIVISOR);
    }

    public FuzzySearchStrategy(int distanceDivisor) {
        super(EnumSet.of(RecordField.VENDOR, RecordField.CATEGORY, RecordField.RAW_TEXT), true);
        if (distanceDivisor < 1) {
            throw new IllegalArgumentException("distanceDivisor must be at least 1");
        }
        this.distanceDivisor = distanceDivisor;
    }

    @Override
    public SearchStrategyType type() {
        return SearchStrategyType.FUZZY;
    }

    @Override
    protected void validateOperands(SearchQuery query) {
        requireTerm(query, "term");
        if (query.maxDistance() != null && query.maxDistance() < 0) {
            throw new InvalidQueryException("maxDistance", query.maxDistance(), "Fuzzy distance must not be negative");
        }
    }

    @Override
    protected List<ReceiptRecord> doSearch(List<ReceiptRecord> snapshot, SearchQuery query) {
        String needle = lower(query.term().trim());
        int threshold = threshold(query, needle);
        List<ReceiptRecord> matches = new ArrayList<>();
        for (ReceiptRecord record : snapshot) {
            for (RecordField field : query.fields()) {
                if (matches(lower(field.textValueOf(record)), needle, threshold)) {
                    matches.add(record);
                    break;
                }
            }
        }
        return matches;
    }

    int threshold(SearchQuery query, String needle) {
        if (query.maxDistance() != null) {
            return query.maxDistance();
        }
        return Math.max(1, needle.length() / distanceDivisor);
    }

    private static boolean matches(String value, String needle, int threshold) {
        if (value == null || value.isBlank()) {
            return false;
        }
        if (LevenshteinDistance.isWithin(needle, value.trim(), threshold)) {
            return true;
        }
        for (String token : WHITESPACE.split(value.trim())) {
            if (LevenshteinDistance.isWithin(needle, token, threshold)) {
                return true;
            }
        }
        return false;
    }
}
