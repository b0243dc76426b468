package dev.pekelund.receiptlens.analytics.search;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import java.util.Arrays;
import java.util.Locale;

public enum SearchStrategyType {

    LINEAR("linear"),
    BINARY("binary"),
    HASH("hash"),
    FUZZY("fuzzy"),
    PATTERN("pattern"),
    RANGE("range");

    private final String id;

    SearchStrategyType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static SearchStrategyType fromId(String id) {
        if (id != null) {
            String normalised = id.trim().toLowerCase(Locale.ROOT);
            for (SearchStrategyType type : values()) {
                if (type.id.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new InvalidQueryException("strategy", id, "Unknown search strategy '" + id + "', expected one of "
            + Arrays.stream(values()).map(SearchStrategyType::id).toList());
    }

    @Override
    public String toString() {
        return id;
    }
}
