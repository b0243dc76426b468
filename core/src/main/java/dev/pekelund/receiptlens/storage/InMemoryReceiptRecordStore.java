package dev.pekelund.receiptlens.storage;

import dev.pekelund.receiptlens.records.InvalidRecordException;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record store backed by a concurrent map. Suitable for local runs and tests.
 */
public class InMemoryReceiptRecordStore implements ReceiptRecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryReceiptRecordStore.class);

    private static final Comparator<ReceiptRecord> NEWEST_FIRST = Comparator
        .comparing(ReceiptRecord::createdAt, Comparator.reverseOrder())
        .thenComparing(ReceiptRecord::id);

    private final Map<String, ReceiptRecord> records = new ConcurrentHashMap<>();

    @Override
    public ReceiptRecord save(ReceiptRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.id(), record);
        LOGGER.debug("Stored receipt record {}", record.id());
        return record;
    }

    @Override
    public Optional<ReceiptRecord> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<ReceiptRecord> list() {
        return records.values().stream()
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public ReceiptRecord update(ReceiptRecord record) {
        Objects.requireNonNull(record, "record");
        ReceiptRecord previous = records.computeIfPresent(record.id(), (id, existing) -> {
            requireImmutableFieldsUnchanged(existing, record);
            return record;
        });
        if (previous == null) {
            throw new RecordNotFoundException(record.id());
        }
        LOGGER.debug("Updated receipt record {}", record.id());
        return record;
    }

    private void requireImmutableFieldsUnchanged(ReceiptRecord existing, ReceiptRecord replacement) {
        if (!existing.rawText().equals(replacement.rawText())
            || !existing.createdAt().equals(replacement.createdAt())) {
            throw new InvalidRecordException(
                "Raw text and creation time of record " + existing.id() + " cannot change");
        }
    }

    @Override
    public int deleteAll() {
        int count = records.size();
        records.clear();
        LOGGER.info("Deleted {} receipt records", count);
        return count;
    }
}
