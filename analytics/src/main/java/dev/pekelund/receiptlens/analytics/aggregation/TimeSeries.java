package dev.pekelund.receiptlens.analytics.aggregation;

import java.util.List;

/**
 * Chronologically ordered buckets. Only buckets holding at least one record are present.
 *
 * @param undated records left out because their transaction date is absent
 */
public record TimeSeries(TimeInterval interval, List<TimeBucket> buckets, int undated) {

    public TimeSeries {
        buckets = List.copyOf(buckets);
    }
}
