package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.analytics.sort.SortAlgorithm;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /**
     * Sort algorithm used when a query does not name one.
     */
    private SortAlgorithm defaultSortAlgorithm = SortAlgorithm.MERGESORT;

    /**
     * Sort algorithm binary search uses to order its snapshot.
     */
    private SortAlgorithm binarySearchSortAlgorithm = SortAlgorithm.MERGESORT;

    /**
     * Default sliding window size, in monthly buckets.
     */
    private int windowSize = 3;

    /**
     * Fuzzy search allows {@code max(1, termLength / divisor)} edits unless a query sets its own limit.
     */
    private int fuzzyDistanceDivisor = 3;

    public SortAlgorithm getDefaultSortAlgorithm() {
        return defaultSortAlgorithm;
    }

    public void setDefaultSortAlgorithm(SortAlgorithm defaultSortAlgorithm) {
        this.defaultSortAlgorithm = defaultSortAlgorithm;
    }

    public SortAlgorithm getBinarySearchSortAlgorithm() {
        return binarySearchSortAlgorithm;
    }

    public void setBinarySearchSortAlgorithm(SortAlgorithm binarySearchSortAlgorithm) {
        this.binarySearchSortAlgorithm = binarySearchSortAlgorithm;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getFuzzyDistanceDivisor() {
        return fuzzyDistanceDivisor;
    }

    public void setFuzzyDistanceDivisor(int fuzzyDistanceDivisor) {
        this.fuzzyDistanceDivisor = fuzzyDistanceDivisor;
    }
}
