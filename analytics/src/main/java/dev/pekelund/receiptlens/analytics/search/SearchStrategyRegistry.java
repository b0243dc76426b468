package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.sort.SortStrategy;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed dispatch table from {@link SearchStrategyType} to its strategy. Built once and never changed.
 */
public class SearchStrategyRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchStrategyRegistry.class);

    private final Map<SearchStrategyType, SearchStrategy> strategies;

    public SearchStrategyRegistry(Collection<? extends SearchStrategy> strategies) {
        Map<SearchStrategyType, SearchStrategy> mutable = new EnumMap<>(SearchStrategyType.class);
        for (SearchStrategy strategy : strategies) {
            SearchStrategy previous = mutable.put(strategy.type(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate search strategy registered for " + strategy.type());
            }
        }
        for (SearchStrategyType type : SearchStrategyType.values()) {
            if (!mutable.containsKey(type)) {
                throw new IllegalStateException("No search strategy registered for " + type);
            }
        }
        this.strategies = Collections.unmodifiableMap(mutable);
        LOGGER.info("Initialised search strategy registry with strategies: {}", this.strategies.keySet());
    }

    public static SearchStrategyRegistry withDefaults(SortStrategy binarySearchSort, int fuzzyDistanceDivisor) {
        return new SearchStrategyRegistry(List.of(
            new LinearSearchStrategy(),
            new BinarySearchStrategy(binarySearchSort),
            new HashSearchStrategy(),
            new FuzzySearchStrategy(fuzzyDistanceDivisor),
            new PatternSearchStrategy(),
            new RangeSearchStrategy()));
    }

    public SearchStrategy get(SearchStrategyType type) {
        SearchStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No search strategy for " + type);
        }
        return strategy;
    }
}
