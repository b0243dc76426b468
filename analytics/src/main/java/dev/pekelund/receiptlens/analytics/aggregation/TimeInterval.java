package dev.pekelund.receiptlens.analytics.aggregation;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar bucket sizes for time series. Weeks follow ISO-8601 (Monday start, week-based year).
 */
public enum TimeInterval {

    DAY {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date;
        }

        @Override
        public String label(LocalDate bucketStart) {
            return bucketStart.toString();
        }
    },

    WEEK {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public String label(LocalDate bucketStart) {
            return String.format("%d-W%02d", bucketStart.get(IsoFields.WEEK_BASED_YEAR),
                bucketStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    },

    MONTH {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public String label(LocalDate bucketStart) {
            return String.format("%d-%02d", bucketStart.getYear(), bucketStart.getMonthValue());
        }
    },

    YEAR {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.withDayOfYear(1);
        }

        @Override
        public String label(LocalDate bucketStart) {
            return Integer.toString(bucketStart.getYear());
        }
    };

    public abstract LocalDate bucketStart(LocalDate date);

    public abstract String label(LocalDate bucketStart);
}
