package dev.pekelund.receiptlens.analytics.aggregation;

import java.math.BigDecimal;

/**
 * Summary of the amounts of the records that carry one. Monetary values are rounded to cents, the
 * variance to four decimals. With no amounts every value except {@code count} and {@code sum} is
 * {@code null}; spread needs at least two amounts and {@code mode} needs a repeated amount.
 *
 * @param recordsWithoutAmount records left out because their amount is absent
 */
public record DescriptiveStatistics(
    int count,
    BigDecimal sum,
    BigDecimal mean,
    BigDecimal median,
    BigDecimal mode,
    BigDecimal standardDeviation,
    BigDecimal variance,
    BigDecimal min,
    BigDecimal max,
    int recordsWithoutAmount
) {

    static DescriptiveStatistics empty(int recordsWithoutAmount) {
        return new DescriptiveStatistics(0, AggregationEngine.money(BigDecimal.ZERO), null, null, null, null, null,
            null, null, recordsWithoutAmount);
    }
}
