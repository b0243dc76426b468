package dev.pekelund.receiptlens.analytics.aggregation;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * @param totalAmount sum of the amounts in the bucket; records without an amount only add to the count
 */
public record TimeBucket(String label, LocalDate start, int count, BigDecimal totalAmount) {
}
