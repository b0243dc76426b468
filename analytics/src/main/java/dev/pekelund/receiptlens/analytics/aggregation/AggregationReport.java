package dev.pekelund.receiptlens.analytics.aggregation;

import java.util.List;

public record AggregationReport(
    DescriptiveStatistics statistics,
    FrequencyTable vendors,
    FrequencyTable categories,
    TimeSeries monthly,
    TimeSeries yearly,
    int windowSize,
    List<SlidingWindowPoint> slidingWindow
) {

    public AggregationReport {
        slidingWindow = List.copyOf(slidingWindow);
    }
}
