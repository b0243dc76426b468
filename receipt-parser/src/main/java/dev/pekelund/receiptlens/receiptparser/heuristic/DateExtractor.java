package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the transaction date by trying each {@link DatePattern} in order. Within a pattern every match
 * is tried from the top of the receipt; matches that do not form a real date are skipped.
 */
public class DateExtractor implements FieldExtractor<LocalDate> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DateExtractor.class);

    private final List<DatePattern> patterns;

    public DateExtractor(ExtractionRules rules) {
        this.patterns = rules.datePatterns();
    }

    @Override
    public String name() {
        return "date";
    }

    @Override
    public FieldExtraction<LocalDate> extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return FieldExtraction.absent();
        }
        for (DatePattern datePattern : patterns) {
            Matcher matcher = datePattern.pattern().matcher(normalizedText);
            while (matcher.find()) {
                try {
                    LocalDate date = datePattern.layout().resolve(matcher);
                    LOGGER.debug("Date {} matched pattern {}", date, datePattern.name());
                    return FieldExtraction.of(date, datePattern.confidence());
                } catch (DateTimeException | NumberFormatException ex) {
                    LOGGER.debug("Rejected '{}' for pattern {}: {}", matcher.group(), datePattern.name(), ex.getMessage());
                }
            }
        }
        return FieldExtraction.absent();
    }
}
