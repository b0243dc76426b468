package dev.pekelund.receiptlens.analytics.aggregation;

import dev.pekelund.receiptlens.records.RecordField;
import java.util.List;
import java.util.Optional;

/**
 * Occurrence counts and summed amounts per field value, ordered by descending count and then by key.
 */
public record FrequencyTable(RecordField groupedBy, List<FrequencyEntry> entries) {

    public FrequencyTable {
        entries = List.copyOf(entries);
    }

    public Optional<FrequencyEntry> find(String key) {
        return entries.stream().filter(entry -> entry.key().equals(key)).findFirst();
    }
}
