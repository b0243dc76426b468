package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the merchant name from the header lines of a receipt.
 *
 * <p>Only the first few lines are considered. Lines mentioning receipt boilerplate, lines dominated by
 * digits or symbols and lines that do not start with a letter are skipped. Among the remaining
 * candidates the strongest header shape wins, then the longest line, then the earliest one.</p>
 */
public class VendorExtractor implements FieldExtractor<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(VendorExtractor.class);

    static final double ALL_CAPS_SCORE = 0.9;
    static final double STORE_SUFFIX_SCORE = 0.8;
    static final double LEADING_CAPITAL_SCORE = 0.6;
    static final double GENERIC_SCORE = 0.3;
    static final double LINE_PENALTY = 0.1;

    private static final Pattern STORE_NUMBER = Pattern.compile("\\s*(?:#|\\bno\\.?\\s*|\\bstore\\s+#?)\\d+\\s*$",
        Pattern.CASE_INSENSITIVE);
    private static final int MIN_LETTERS = 3;

    private final int scanLines;
    private final double maxSymbolRatio;
    private final List<KeywordMatcher> skipWords;
    private final List<KeywordMatcher> storeSuffixes;

    public VendorExtractor(ExtractionRules rules) {
        this.scanLines = rules.vendorScanLines();
        this.maxSymbolRatio = rules.vendorMaxSymbolRatio();
        this.skipWords = KeywordMatcher.ofAll(rules.vendorSkipWords());
        this.storeSuffixes = KeywordMatcher.ofAll(rules.vendorStoreSuffixes());
    }

    @Override
    public String name() {
        return "vendor";
    }

    @Override
    public FieldExtraction<String> extract(String normalizedText) {
        List<String> lines = TextNormalizer.lines(normalizedText);
        Candidate best = null;
        for (int index = 0; index < Math.min(scanLines, lines.size()); index++) {
            Candidate candidate = evaluate(lines.get(index), index);
            if (candidate != null && (best == null || candidate.beats(best))) {
                best = candidate;
            }
        }
        if (best == null) {
            LOGGER.debug("No vendor candidate in the first {} lines", scanLines);
            return FieldExtraction.absent();
        }
        LOGGER.debug("Vendor candidate '{}' from line {} scored {}", best.text(), best.lineIndex(), best.confidence());
        return FieldExtraction.of(best.text(), best.confidence());
    }

    private Candidate evaluate(String line, int index) {
        String text = STORE_NUMBER.matcher(line).replaceAll("").trim();
        if (text.isEmpty() || !Character.isLetter(text.codePointAt(0))) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (KeywordMatcher.anyMatches(skipWords, lower)) {
            return null;
        }

        int letters = 0;
        int uppercase = 0;
        int symbols = 0;
        int visible = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                continue;
            }
            visible++;
            if (Character.isLetter(ch)) {
                letters++;
                if (Character.isUpperCase(ch)) {
                    uppercase++;
                }
            } else {
                symbols++;
            }
        }
        if (letters < MIN_LETTERS || (double) symbols / visible > maxSymbolRatio) {
            return null;
        }

        double shapeScore;
        if (uppercase == letters) {
            shapeScore = ALL_CAPS_SCORE;
        } else if (Character.isUpperCase(text.charAt(0)) && KeywordMatcher.anyMatches(storeSuffixes, lower)) {
            shapeScore = STORE_SUFFIX_SCORE;
        } else if (Character.isUpperCase(text.charAt(0))) {
            shapeScore = LEADING_CAPITAL_SCORE;
        } else {
            shapeScore = GENERIC_SCORE;
        }
        double floor = Math.min(shapeScore, GENERIC_SCORE);
        double confidence = Math.max(floor, shapeScore - LINE_PENALTY * index);
        return new Candidate(text, index, shapeScore, confidence);
    }

    private record Candidate(String text, int lineIndex, double shapeScore, double confidence) {

        boolean beats(Candidate other) {
            if (shapeScore != other.shapeScore) {
                return shapeScore > other.shapeScore;
            }
            return text.length() > other.text.length();
        }
    }
}
