package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans raw OCR or plain-text receipt content before field extraction.
 */
public class TextNormalizer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?|[\\u000B\\u000C\\u0085\\u2028\\u2029]");
    private static final Pattern INVISIBLE = Pattern.compile("[\\u200B-\\u200D\\u2060\\uFEFF\\u00AD]");
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[\\t\\p{Zs}]+");
    private static final Pattern CURRENCY_PREFIX = Pattern.compile("(?i)\\bUS\\s?\\$|\\uFF04");
    private static final Pattern DOLLAR_GAP = Pattern.compile("\\$\\s+(?=\\d)");

    public String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }
        String text = LINE_BREAKS.matcher(rawText).replaceAll("\n");
        text = INVISIBLE.matcher(text).replaceAll("");
        text = CONTROL.matcher(text).replaceAll("");

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            String cleaned = HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim();
            if (cleaned.isEmpty()) {
                continue;
            }
            cleaned = CURRENCY_PREFIX.matcher(cleaned).replaceAll("\\$");
            cleaned = DOLLAR_GAP.matcher(cleaned).replaceAll("\\$");
            lines.add(cleaned);
        }
        return String.join("\n", lines);
    }

    /**
     * Splits normalized text into its lines; empty text has no lines.
     */
    public static List<String> lines(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return List.of();
        }
        return List.of(normalizedText.split("\n"));
    }
}
