package dev.pekelund.receiptlens.analytics.search;

/**
 * How a binary search compares the query term with the sorted keys.
 */
public enum MatchMode {
    EXACT,
    PREFIX
}
