package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the receipt total.
 *
 * <p>The last line carrying a total keyword and a number wins, using the right-most number on that line.
 * A keyword line without a number takes the number on the following line when that line has no keyword
 * of its own. Without any keyword line the largest currency-looking value of at least 1.00 is used with
 * low confidence.</p>
 */
public class AmountExtractor implements FieldExtractor<BigDecimal> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AmountExtractor.class);

    static final double FALLBACK_CONFIDENCE = 0.4;
    static final double NEXT_LINE_PENALTY = 0.1;
    private static final BigDecimal FALLBACK_MINIMUM = new BigDecimal("1.00");

    private static final Pattern SUBTOTAL = Pattern.compile("sub[\\s-]?total");
    private static final Pattern NUMBER = Pattern.compile(
        "(?<![\\w.,/-])(?<!\\d:)(?<currency>\\$)?(?<value>\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)(?![\\d/:%]|[.,]\\d)");

    private final List<KeywordMatcher> keywords;
    private final List<Double> keywordConfidences;

    public AmountExtractor(ExtractionRules rules) {
        this.keywords = rules.amountKeywords().stream().map(keyword -> KeywordMatcher.of(keyword.phrase())).toList();
        this.keywordConfidences = rules.amountKeywords().stream().map(AmountKeyword::confidence).toList();
    }

    @Override
    public String name() {
        return "amount";
    }

    @Override
    public FieldExtraction<BigDecimal> extract(String normalizedText) {
        List<String> lines = TextNormalizer.lines(normalizedText);

        FieldExtraction<BigDecimal> keywordTotal = FieldExtraction.absent();
        for (int index = 0; index < lines.size(); index++) {
            double keywordConfidence = keywordConfidence(lines.get(index));
            if (keywordConfidence < 0) {
                continue;
            }
            List<Token> tokens = tokens(lines.get(index));
            if (!tokens.isEmpty()) {
                keywordTotal = FieldExtraction.of(tokens.get(tokens.size() - 1).value(), keywordConfidence);
            } else if (index + 1 < lines.size() && keywordConfidence(lines.get(index + 1)) < 0) {
                List<Token> next = tokens(lines.get(index + 1));
                if (!next.isEmpty()) {
                    keywordTotal = FieldExtraction.of(next.get(next.size() - 1).value(),
                        keywordConfidence - NEXT_LINE_PENALTY);
                }
            }
        }
        if (keywordTotal.isPresent()) {
            LOGGER.debug("Amount {} taken from a total line", keywordTotal.value());
            return keywordTotal;
        }

        BigDecimal largest = null;
        for (String line : lines) {
            for (Token token : tokens(line)) {
                if (token.looksMonetary() && token.value().compareTo(FALLBACK_MINIMUM) >= 0
                    && (largest == null || token.value().compareTo(largest) > 0)) {
                    largest = token.value();
                }
            }
        }
        if (largest == null) {
            return FieldExtraction.absent();
        }
        LOGGER.debug("No total line; falling back to the largest value {}", largest);
        return FieldExtraction.of(largest, FALLBACK_CONFIDENCE);
    }

    /**
     * Highest confidence among the keywords present on the line, or -1 when the line has none.
     */
    private double keywordConfidence(String line) {
        String lower = SUBTOTAL.matcher(line.toLowerCase(Locale.ROOT)).replaceAll(" ");
        double confidence = -1;
        for (int i = 0; i < keywords.size(); i++) {
            if (keywords.get(i).matches(lower)) {
                confidence = Math.max(confidence, keywordConfidences.get(i));
            }
        }
        return confidence;
    }

    private static List<Token> tokens(String line) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(line);
        while (matcher.find()) {
            String value = matcher.group("value");
            BigDecimal amount = new BigDecimal(value.replace(",", "")).setScale(2, RoundingMode.HALF_UP);
            tokens.add(new Token(amount, matcher.group("currency") != null || value.contains(".")));
        }
        return tokens;
    }

    private record Token(BigDecimal value, boolean looksMonetary) {
    }
}
