package dev.pekelund.receiptlens.receiptparser.heuristic;

import dev.pekelund.receiptlens.records.ReceiptCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyword-bag classifier. Each category scores the number of its distinct keywords present in the
 * text; the highest score wins and ties go to the category declared first in {@link ReceiptCategory}.
 */
public class CategoryExtractor implements FieldExtractor<ReceiptCategory> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CategoryExtractor.class);

    static final double BASE_CONFIDENCE = 0.5;
    static final double PER_EXTRA_MATCH = 0.15;
    static final double TIE_PENALTY = 0.2;

    private final Map<ReceiptCategory, List<KeywordMatcher>> keywords;

    public CategoryExtractor(ExtractionRules rules) {
        EnumMap<ReceiptCategory, List<KeywordMatcher>> matchers = new EnumMap<>(ReceiptCategory.class);
        rules.categoryKeywords().forEach((category, words) -> matchers.put(category, KeywordMatcher.ofAll(words)));
        this.keywords = matchers;
    }

    @Override
    public String name() {
        return "category";
    }

    @Override
    public FieldExtraction<ReceiptCategory> extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return FieldExtraction.of(ReceiptCategory.OTHER, 0.0);
        }
        String lower = normalizedText.toLowerCase(Locale.ROOT);

        ReceiptCategory best = ReceiptCategory.OTHER;
        int bestCount = 0;
        int runnerUpCount = 0;
        for (ReceiptCategory category : ReceiptCategory.values()) {
            int count = countMatches(keywords.getOrDefault(category, List.of()), lower);
            if (count > bestCount) {
                runnerUpCount = bestCount;
                bestCount = count;
                best = category;
            } else if (count > runnerUpCount) {
                runnerUpCount = count;
            }
        }

        if (bestCount == 0) {
            return FieldExtraction.of(ReceiptCategory.OTHER, 0.0);
        }
        double confidence = Math.min(1.0, BASE_CONFIDENCE + PER_EXTRA_MATCH * (bestCount - 1));
        if (runnerUpCount == bestCount) {
            confidence -= TIE_PENALTY;
        }
        LOGGER.debug("Category {} with {} keyword matches (runner-up {})", best, bestCount, runnerUpCount);
        return FieldExtraction.of(best, confidence);
    }

    private static int countMatches(List<KeywordMatcher> matchers, String lowercaseText) {
        int count = 0;
        for (KeywordMatcher matcher : matchers) {
            if (matcher.matches(lowercaseText)) {
                count++;
            }
        }
        return count;
    }
}
