package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.analytics.search.SearchQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Filter, order and summarise request. Every stage is optional: no searches keeps all records, no sort
 * keeps input order and aggregation only runs when requested.
 *
 * @param searches   combined with logical AND
 * @param windowSize sliding window size, {@code null} for the configured default
 */
public record AnalyticsQuery(List<SearchQuery> searches, SortRequest sort, boolean aggregate, Integer windowSize) {

    public AnalyticsQuery {
        searches = searches == null ? List.of() : List.copyOf(searches);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private final List<SearchQuery> searches = new ArrayList<>();
        private SortRequest sort;
        private boolean aggregate;
        private Integer windowSize;

        private Builder() {
        }

        public Builder search(SearchQuery query) {
            searches.add(Objects.requireNonNull(query, "query"));
            return this;
        }

        public Builder sort(SortRequest sort) {
            this.sort = sort;
            return this;
        }

        public Builder aggregate() {
            this.aggregate = true;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.aggregate = true;
            this.windowSize = windowSize;
            return this;
        }

        public AnalyticsQuery build() {
            return new AnalyticsQuery(searches, sort, aggregate, windowSize);
        }
    }
}
