package dev.pekelund.receiptlens.analytics;

/**
 * Base type for analytics query errors. Each error names the offending parameter and the rejected value
 * so callers can report exactly what was wrong with the query.
 */
public class AnalyticsQueryException extends RuntimeException {

    private final String parameter;
    private final transient Object value;

    public AnalyticsQueryException(String parameter, Object value, String message) {
        super(message);
        this.parameter = parameter;
        this.value = value;
    }

    public AnalyticsQueryException(String parameter, Object value, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
        this.value = value;
    }

    public String getParameter() {
        return parameter;
    }

    public Object getValue() {
        return value;
    }
}
