package dev.pekelund.receiptlens.receiptparser.heuristic;

import java.util.Locale;
import java.util.Objects;

/**
 * A phrase that marks a line as carrying the receipt total, and the confidence a match earns.
 */
public record AmountKeyword(String phrase, double confidence) {

    public AmountKeyword {
        Objects.requireNonNull(phrase, "phrase");
        phrase = phrase.trim().toLowerCase(Locale.ROOT);
        if (phrase.isEmpty()) {
            throw new IllegalArgumentException("Amount keyword must not be blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Amount keyword confidence must be within [0, 1] for '" + phrase + "'");
        }
    }
}
