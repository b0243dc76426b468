package dev.pekelund.receiptlens.analytics.sort;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed dispatch table from {@link SortAlgorithm} to its strategy. Built once and never changed.
 */
public class SortStrategyRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SortStrategyRegistry.class);

    private final Map<SortAlgorithm, SortStrategy> strategies;

    public SortStrategyRegistry(Collection<? extends SortStrategy> strategies) {
        Map<SortAlgorithm, SortStrategy> mutable = new EnumMap<>(SortAlgorithm.class);
        for (SortStrategy strategy : strategies) {
            SortStrategy previous = mutable.put(strategy.algorithm(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate sort strategy registered for " + strategy.algorithm());
            }
        }
        for (SortAlgorithm algorithm : SortAlgorithm.values()) {
            if (!mutable.containsKey(algorithm)) {
                throw new IllegalStateException("No sort strategy registered for " + algorithm);
            }
        }
        this.strategies = Collections.unmodifiableMap(mutable);
        LOGGER.info("Initialised sort strategy registry with algorithms: {}", this.strategies.keySet());
    }

    public static SortStrategyRegistry withDefaults() {
        return new SortStrategyRegistry(List.of(new QuickSortStrategy(), new MergeSortStrategy(),
            new HeapSortStrategy(), new AdaptiveSortStrategy()));
    }

    public SortStrategy get(SortAlgorithm algorithm) {
        SortStrategy strategy = strategies.get(algorithm);
        if (strategy == null) {
            throw new IllegalArgumentException("No sort strategy for " + algorithm);
        }
        return strategy;
    }
}
