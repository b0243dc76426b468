package dev.pekelund.receiptlens.analytics.sort;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import java.util.Arrays;
import java.util.Locale;

public enum SortAlgorithm {

    QUICKSORT("quicksort"),
    MERGESORT("mergesort"),
    HEAPSORT("heapsort"),
    ADAPTIVE("adaptive");

    private final String id;

    SortAlgorithm(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static SortAlgorithm fromId(String id) {
        if (id != null) {
            String normalised = id.trim().toLowerCase(Locale.ROOT);
            for (SortAlgorithm algorithm : values()) {
                if (algorithm.id.equals(normalised)) {
                    return algorithm;
                }
            }
        }
        throw new InvalidQueryException("algorithm", id, "Unknown sort algorithm '" + id + "', expected one of "
            + Arrays.stream(values()).map(SortAlgorithm::id).toList());
    }

    @Override
    public String toString() {
        return id;
    }
}
