package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.analytics.sort.SortAlgorithm;
import dev.pekelund.receiptlens.analytics.sort.SortDirection;
import dev.pekelund.receiptlens.records.RecordField;

/**
 * Ordering stage of an {@link AnalyticsQuery}.
 *
 * @param algorithm sort algorithm, or {@code null} for the configured default
 */
public record SortRequest(RecordField field, SortAlgorithm algorithm, SortDirection direction) {

    public SortRequest {
        if (field == null) {
            throw new InvalidQueryException("field", null, "Sort field is required");
        }
        direction = direction == null ? SortDirection.ASC : direction;
    }

    public static SortRequest by(RecordField field, SortDirection direction) {
        return new SortRequest(field, null, direction);
    }

    /**
     * Resolves textual selectors such as {@code ("vendor", "quicksort", "desc")}. A {@code null} algorithm
     * or direction falls back to the default.
     */
    public static SortRequest of(String field, String algorithm, String direction) {
        RecordField resolvedField = RecordField.find(field)
            .orElseThrow(() -> new InvalidQueryException("field", field, "Unknown record field '" + field + "'"));
        return new SortRequest(resolvedField,
            algorithm == null ? null : SortAlgorithm.fromId(algorithm),
            direction == null ? null : SortDirection.fromId(direction));
    }
}
