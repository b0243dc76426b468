package dev.pekelund.receiptlens.analytics.sort;

import dev.pekelund.receiptlens.analytics.InvalidQueryException;
import java.util.Locale;

public enum SortDirection {

    ASC,
    DESC;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SortDirection fromId(String id) {
        if (id != null) {
            String normalised = id.trim().toLowerCase(Locale.ROOT);
            if (normalised.equals("asc") || normalised.equals("ascending")) {
                return ASC;
            }
            if (normalised.equals("desc") || normalised.equals("descending")) {
                return DESC;
            }
        }
        throw new InvalidQueryException("direction", id, "Unknown sort direction '" + id + "', expected asc or desc");
    }

    @Override
    public String toString() {
        return id();
    }
}
