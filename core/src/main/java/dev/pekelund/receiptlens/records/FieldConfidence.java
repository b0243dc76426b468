package dev.pekelund.receiptlens.records;

/**
 * Per-field extraction confidence. Every score lies in {@code [0.0, 1.0]}.
 */
public record FieldConfidence(
    double vendor,
    double date,
    double amount,
    double category
) {

    private static final double VENDOR_WEIGHT = 0.3;
    private static final double DATE_WEIGHT = 0.3;
    private static final double AMOUNT_WEIGHT = 0.3;
    private static final double CATEGORY_WEIGHT = 0.1;

    public FieldConfidence {
        requireScore("vendor", vendor);
        requireScore("date", date);
        requireScore("amount", amount);
        requireScore("category", category);
    }

    public static FieldConfidence none() {
        return new FieldConfidence(0.0, 0.0, 0.0, 0.0);
    }

    /**
     * Weighted overall score; the weights sum to one so the result stays within the score range.
     */
    public double overall() {
        double overall = vendor * VENDOR_WEIGHT
            + date * DATE_WEIGHT
            + amount * AMOUNT_WEIGHT
            + category * CATEGORY_WEIGHT;
        return Math.min(1.0, Math.max(0.0, overall));
    }

    public FieldConfidence withVendor(double score) {
        return new FieldConfidence(score, date, amount, category);
    }

    public FieldConfidence withDate(double score) {
        return new FieldConfidence(vendor, score, amount, category);
    }

    public FieldConfidence withAmount(double score) {
        return new FieldConfidence(vendor, date, score, category);
    }

    public FieldConfidence withCategory(double score) {
        return new FieldConfidence(vendor, date, amount, score);
    }

    private static void requireScore(String field, double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new InvalidRecordException(
                String.format("Confidence for %s must be within [0.0, 1.0] but was %s", field, score));
        }
    }
}
