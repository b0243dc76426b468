package dev.pekelund.receiptlens.analytics;

/**
 * A query parameter is missing, unknown or out of range.
 */
public class InvalidQueryException extends AnalyticsQueryException {

    public InvalidQueryException(String parameter, Object value, String message) {
        super(parameter, value, message);
    }
}
