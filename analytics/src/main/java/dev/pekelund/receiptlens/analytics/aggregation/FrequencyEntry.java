package dev.pekelund.receiptlens.analytics.aggregation;

import java.math.BigDecimal;

public record FrequencyEntry(String key, int count, BigDecimal totalAmount) {
}
