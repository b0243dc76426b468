package dev.pekelund.receiptlens.analytics.aggregation;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Moving average centred on one monthly bucket.
 *
 * @param bucketsAveraged buckets that fell inside the window; fewer than the window size at the edges
 */
public record SlidingWindowPoint(String label, LocalDate start, BigDecimal bucketTotal, BigDecimal movingAverage,
                                 int bucketsAveraged) {
}
