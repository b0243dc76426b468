package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of the ordered date pattern list.
 */
public record DatePattern(String name, Pattern pattern, DateLayout layout, double confidence) {

    private static final String MONTH_NAMES = "jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
        + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?";

    public DatePattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(layout, "layout");
    }

    public static List<DatePattern> defaults() {
        return List.of(
            new DatePattern("iso", Pattern.compile(
                "(?<!\\d)(?<year>\\d{4})-(?<month>\\d{1,2})-(?<day>\\d{1,2})(?!\\d)"), DateLayout.NUMERIC, 0.95),
            new DatePattern("month-day-year", Pattern.compile(
                "\\b(?<month>" + MONTH_NAMES + ")\\.?\\s+(?<day>\\d{1,2})(?:st|nd|rd|th)?,?\\s+(?<year>\\d{4})(?!\\d)",
                Pattern.CASE_INSENSITIVE), DateLayout.MONTH_NAME, 0.9),
            new DatePattern("day-month-year", Pattern.compile(
                "(?<!\\d)(?<day>\\d{1,2})(?:st|nd|rd|th)?\\s+(?<month>" + MONTH_NAMES + ")\\.?,?\\s+(?<year>\\d{4})(?!\\d)",
                Pattern.CASE_INSENSITIVE), DateLayout.MONTH_NAME, 0.9),
            new DatePattern("us-slash", Pattern.compile(
                "(?<![\\d/])(?<month>\\d{1,2})/(?<day>\\d{1,2})/(?<year>\\d{4})(?!\\d)"), DateLayout.NUMERIC, 0.85),
            new DatePattern("us-dash-dot", Pattern.compile(
                "(?<![\\d.-])(?<month>\\d{1,2})([-.])(?<day>\\d{1,2})\\2(?<year>\\d{4})(?!\\d)"), DateLayout.NUMERIC, 0.8),
            new DatePattern("us-short-year", Pattern.compile(
                "(?<![\\d/.-])(?<month>\\d{1,2})([/.-])(?<day>\\d{1,2})\\2(?<year>\\d{2})(?![\\d/.-])"),
                DateLayout.NUMERIC, 0.6));
    }
}
