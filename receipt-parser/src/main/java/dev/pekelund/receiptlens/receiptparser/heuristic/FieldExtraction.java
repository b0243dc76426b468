package dev.pekelund.receiptlens.receiptparser.heuristic;

/**
 * Candidate value for one record field together with the extractor's confidence in it. An absent value
 * always carries confidence 0.0.
 */
public record FieldExtraction<T>(T value, double confidence) {

    public FieldExtraction {
        if (value == null || Double.isNaN(confidence)) {
            confidence = 0.0;
        } else {
            confidence = Math.min(1.0, Math.max(0.0, confidence));
        }
    }

    public static <T> FieldExtraction<T> of(T value, double confidence) {
        return new FieldExtraction<>(value, confidence);
    }

    public static <T> FieldExtraction<T> absent() {
        return new FieldExtraction<>(null, 0.0);
    }

    public boolean isPresent() {
        return value != null;
    }
}
