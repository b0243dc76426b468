package dev.pekelund.receiptlens.analytics;

import dev.pekelund.receiptlens.records.RecordField;

/**
 * The requested field has no comparator for the chosen search or sort operation.
 */
public class UnsupportedFieldException extends AnalyticsQueryException {

    public UnsupportedFieldException(RecordField field, String operation) {
        super("field", field.id(), "Field '" + field.id() + "' is not supported by " + operation);
    }
}
