package dev.pekelund.receiptlens.analytics.aggregation;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import dev.pekelund.receiptlens.analytics.UnsupportedFieldException;
import dev.pekelund.receiptlens.analytics.sort.SortStrategy;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarises record collections: amount statistics, frequency tables, calendar time series and a
 * centred moving average over the monthly series. Pure computation; inputs are never modified.
 */
public class AggregationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationEngine.class);

    private static final int MONEY_SCALE = 2;
    private static final int VARIANCE_SCALE = 4;
    private static final MathContext PRECISION = MathContext.DECIMAL128;

    private static final Comparator<FrequencyEntry> FREQUENCY_ORDER = Comparator
        .comparingInt(FrequencyEntry::count).reversed()
        .thenComparing(FrequencyEntry::key);

    private final SortStrategy sortStrategy;

    public AggregationEngine(SortStrategy sortStrategy) {
        this.sortStrategy = Objects.requireNonNull(sortStrategy, "sortStrategy");
    }

    public AggregationReport aggregate(List<ReceiptRecord> records, int windowSize) {
        requireWindowSize(windowSize);
        List<ReceiptRecord> snapshot = List.copyOf(records);
        TimeSeries monthly = timeSeries(snapshot, TimeInterval.MONTH);
        AggregationReport report = new AggregationReport(
            statistics(snapshot),
            frequency(snapshot, RecordField.VENDOR),
            frequency(snapshot, RecordField.CATEGORY),
            monthly,
            timeSeries(snapshot, TimeInterval.YEAR),
            windowSize,
            slidingWindow(monthly, windowSize));
        LOGGER.debug("Aggregated {} records into {} monthly buckets ({} undated)", snapshot.size(),
            monthly.buckets().size(), monthly.undated());
        return report;
    }

    public DescriptiveStatistics statistics(List<ReceiptRecord> records) {
        List<BigDecimal> amounts = new ArrayList<>();
        for (ReceiptRecord record : records) {
            if (record.hasAmount()) {
                amounts.add(record.amount());
            }
        }
        int withoutAmount = records.size() - amounts.size();
        if (amounts.isEmpty()) {
            return DescriptiveStatistics.empty(withoutAmount);
        }

        int count = amounts.size();
        List<BigDecimal> sorted = sortStrategy.sort(amounts, Comparator.naturalOrder());
        BigDecimal sum = sorted.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal mean = sum.divide(BigDecimal.valueOf(count), PRECISION);

        BigDecimal median;
        if (count % 2 == 1) {
            median = sorted.get(count / 2);
        } else {
            median = sorted.get(count / 2 - 1).add(sorted.get(count / 2)).divide(BigDecimal.valueOf(2), PRECISION);
        }

        BigDecimal variance = null;
        BigDecimal standardDeviation = null;
        if (count > 1) {
            BigDecimal squaredDeviations = BigDecimal.ZERO;
            for (BigDecimal amount : sorted) {
                BigDecimal deviation = amount.subtract(mean, PRECISION);
                squaredDeviations = squaredDeviations.add(deviation.multiply(deviation, PRECISION), PRECISION);
            }
            BigDecimal exactVariance = squaredDeviations.divide(BigDecimal.valueOf(count - 1L), PRECISION);
            variance = exactVariance.setScale(VARIANCE_SCALE, RoundingMode.HALF_UP);
            standardDeviation = money(exactVariance.sqrt(PRECISION));
        }

        return new DescriptiveStatistics(count, money(sum), money(mean), money(median), mode(sorted),
            standardDeviation, variance, money(sorted.get(0)), money(sorted.get(count - 1)), withoutAmount);
    }

    /**
     * Groups by vendor or category. Records without a vendor are left out of the vendor table.
     */
    public FrequencyTable frequency(List<ReceiptRecord> records, RecordField field) {
        if (field != RecordField.VENDOR && field != RecordField.CATEGORY) {
            throw new UnsupportedFieldException(field, "frequency tables");
        }
        Map<String, Integer> counts = new HashMap<>();
        Map<String, BigDecimal> totals = new HashMap<>();
        for (ReceiptRecord record : records) {
            String key = field.textValueOf(record);
            if (key == null) {
                continue;
            }
            counts.merge(key, 1, Integer::sum);
            BigDecimal amount = record.hasAmount() ? record.amount() : BigDecimal.ZERO;
            totals.merge(key, amount, BigDecimal::add);
        }
        List<FrequencyEntry> entries = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> entries.add(new FrequencyEntry(key, count, money(totals.get(key)))));
        entries.sort(FREQUENCY_ORDER);
        return new FrequencyTable(field, entries);
    }

    public TimeSeries timeSeries(List<ReceiptRecord> records, TimeInterval interval) {
        Objects.requireNonNull(interval, "interval");
        TreeMap<LocalDate, int[]> counts = new TreeMap<>();
        Map<LocalDate, BigDecimal> totals = new HashMap<>();
        int undated = 0;
        for (ReceiptRecord record : records) {
            if (!record.hasTransactionDate()) {
                undated++;
                continue;
            }
            LocalDate start = interval.bucketStart(record.transactionDate());
            counts.computeIfAbsent(start, ignored -> new int[1])[0]++;
            BigDecimal amount = record.hasAmount() ? record.amount() : BigDecimal.ZERO;
            totals.merge(start, amount, BigDecimal::add);
        }
        List<TimeBucket> buckets = new ArrayList<>(counts.size());
        counts.forEach((start, count) -> buckets.add(
            new TimeBucket(interval.label(start), start, count[0], money(totals.get(start)))));
        return new TimeSeries(interval, buckets, undated);
    }

    /**
     * Centred moving average of the bucket totals. For bucket {@code i} the window spans
     * {@code i - w/2} to {@code i + (w - 1) - w/2}, clipped to the buckets that exist.
     */
    public List<SlidingWindowPoint> slidingWindow(TimeSeries series, int windowSize) {
        requireWindowSize(windowSize);
        List<TimeBucket> buckets = series.buckets();
        List<SlidingWindowPoint> points = new ArrayList<>(buckets.size());
        int before = windowSize / 2;
        int after = windowSize - 1 - before;
        for (int i = 0; i < buckets.size(); i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(buckets.size() - 1, i + after);
            BigDecimal windowTotal = BigDecimal.ZERO;
            for (int j = from; j <= to; j++) {
                windowTotal = windowTotal.add(buckets.get(j).totalAmount());
            }
            int averaged = to - from + 1;
            BigDecimal average = windowTotal.divide(BigDecimal.valueOf(averaged), MONEY_SCALE, RoundingMode.HALF_UP);
            TimeBucket bucket = buckets.get(i);
            points.add(new SlidingWindowPoint(bucket.label(), bucket.start(), bucket.totalAmount(), average, averaged));
        }
        return points;
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Most frequent amount in cents; the smallest wins a tie and nothing repeats means no mode.
     */
    private static BigDecimal mode(List<BigDecimal> sortedAmounts) {
        TreeMap<BigDecimal, Integer> frequencies = new TreeMap<>();
        for (BigDecimal amount : sortedAmounts) {
            frequencies.merge(money(amount), 1, Integer::sum);
        }
        BigDecimal mode = null;
        int best = 1;
        for (Map.Entry<BigDecimal, Integer> entry : frequencies.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mode = entry.getKey();
            }
        }
        return mode;
    }

    private static void requireWindowSize(int windowSize) {
        if (windowSize < 1) {
            throw new InvalidQueryException("windowSize", windowSize, "Window size must be at least 1");
        }
    }
}
