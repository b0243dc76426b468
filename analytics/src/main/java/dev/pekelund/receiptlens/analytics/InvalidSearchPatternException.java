package dev.pekelund.receiptlens.analytics;

import java.util.regex.PatternSyntaxException;

/**
 * The pattern search operand is not a valid regular expression.
 */
public class InvalidSearchPatternException extends AnalyticsQueryException {

    public InvalidSearchPatternException(String pattern, PatternSyntaxException cause) {
        super("pattern", pattern, "Invalid search pattern '" + pattern + "': " + cause.getDescription(), cause);
    }
}
