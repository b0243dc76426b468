package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * How the named groups {@code year}, {@code month} and {@code day} of a {@link DatePattern} map to a
 * calendar date.
 */
public enum DateLayout {

    NUMERIC {
        @Override
        LocalDate resolve(Matcher matcher) {
            return LocalDate.of(parseYear(matcher.group("year")), Integer.parseInt(matcher.group("month")),
                Integer.parseInt(matcher.group("day")));
        }
    },

    MONTH_NAME {
        @Override
        LocalDate resolve(Matcher matcher) {
            return LocalDate.of(parseYear(matcher.group("year")), monthFromName(matcher.group("month")),
                Integer.parseInt(matcher.group("day")));
        }
    };

    static final int MIN_YEAR = 1970;
    static final int MAX_YEAR = 2100;

    /**
     * Builds the date for a match.
     *
     * @throws DateTimeException when the matched parts do not form a real date in the accepted year range
     */
    abstract LocalDate resolve(Matcher matcher);

    private static int parseYear(String text) {
        int year = Integer.parseInt(text);
        if (text.length() == 2) {
            year += 2000;
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new DateTimeException("Year " + year + " is outside the accepted range");
        }
        return year;
    }

    private static Month monthFromName(String text) {
        String prefix = text.toLowerCase(Locale.ROOT);
        if (prefix.length() > 3) {
            prefix = prefix.substring(0, 3);
        }
        for (Month month : Month.values()) {
            if (month.name().toLowerCase(Locale.ROOT).startsWith(prefix)) {
                return month;
            }
        }
        throw new DateTimeException("Unknown month name '" + text + "'");
    }
}
