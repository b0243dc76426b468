package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.records.RecordField;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One search request: the strategy, the field(s) it runs against and its operands. Which operands are
 * required depends on the strategy; each {@link SearchStrategy} validates its own.
 *
 * @param term         keyword, exact value, fuzzy target or regular expression
 * @param matchMode    exact or prefix comparison for binary search, {@link MatchMode#EXACT} when omitted
 * @param maxDistance  fuzzy threshold override; derived from the term length when {@code null}
 */
public record SearchQuery(
    SearchStrategyType strategy,
    List<RecordField> fields,
    String term,
    MatchMode matchMode,
    Integer maxDistance,
    BigDecimal minAmount,
    BigDecimal maxAmount,
    LocalDate startDate,
    LocalDate endDate
) {

    public SearchQuery {
        if (strategy == null) {
            throw new InvalidQueryException("strategy", null, "Search strategy is required");
        }
        if (fields == null) {
            fields = List.of();
        }
        if (fields.stream().anyMatch(Objects::isNull)) {
            throw new InvalidQueryException("field", null, "Search fields must not contain null");
        }
        fields = List.copyOf(fields);
        matchMode = matchMode == null ? MatchMode.EXACT : matchMode;
    }

    public static SearchQuery linear(String term, RecordField... fields) {
        return builder(SearchStrategyType.LINEAR).fields(fields).term(term).build();
    }

    public static SearchQuery binary(RecordField field, String term, MatchMode matchMode) {
        return builder(SearchStrategyType.BINARY).fields(field).term(term).matchMode(matchMode).build();
    }

    public static SearchQuery hash(RecordField field, String value) {
        return builder(SearchStrategyType.HASH).fields(field).term(value).build();
    }

    public static SearchQuery fuzzy(RecordField field, String term) {
        return builder(SearchStrategyType.FUZZY).fields(field).term(term).build();
    }

    public static SearchQuery fuzzy(RecordField field, String term, int maxDistance) {
        return builder(SearchStrategyType.FUZZY).fields(field).term(term).maxDistance(maxDistance).build();
    }

    public static SearchQuery pattern(RecordField field, String regex) {
        return builder(SearchStrategyType.PATTERN).fields(field).term(regex).build();
    }

    public static SearchQuery amountRange(BigDecimal min, BigDecimal max) {
        return builder(SearchStrategyType.RANGE).fields(RecordField.AMOUNT).minAmount(min).maxAmount(max).build();
    }

    public static SearchQuery dateRange(LocalDate start, LocalDate end) {
        return builder(SearchStrategyType.RANGE).fields(RecordField.TRANSACTION_DATE).startDate(start).endDate(end)
            .build();
    }

    public static Builder builder(SearchStrategyType strategy) {
        return new Builder(strategy);
    }

    public static class Builder {

        private final SearchStrategyType strategy;
        private final List<RecordField> fields = new ArrayList<>();
        private String term;
        private MatchMode matchMode;
        private Integer maxDistance;
        private BigDecimal minAmount;
        private BigDecimal maxAmount;
        private LocalDate startDate;
        private LocalDate endDate;

        private Builder(SearchStrategyType strategy) {
            this.strategy = strategy;
        }

        public Builder fields(RecordField... fields) {
            this.fields.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder term(String term) {
            this.term = term;
            return this;
        }

        public Builder matchMode(MatchMode matchMode) {
            this.matchMode = matchMode;
            return this;
        }

        public Builder maxDistance(Integer maxDistance) {
            this.maxDistance = maxDistance;
            return this;
        }

        public Builder minAmount(BigDecimal minAmount) {
            this.minAmount = minAmount;
            return this;
        }

        public Builder maxAmount(BigDecimal maxAmount) {
            this.maxAmount = maxAmount;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public SearchQuery build() {
            return new SearchQuery(strategy, fields, term, matchMode, maxDistance, minAmount, maxAmount, startDate,
                endDate);
        }
    }
}
