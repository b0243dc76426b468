package dev.pekelund.receiptlens.storage;

import dev.pekelund.receiptlens.records.ReceiptRecord;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for receipt records.
 */
public interface ReceiptRecordStore {

    ReceiptRecord save(ReceiptRecord record);

    Optional<ReceiptRecord> findById(String id);

    /**
     * Returns a snapshot of all records, newest first. Later writes never affect a returned list.
     */
    List<ReceiptRecord> list();

    /**
     * Replaces an existing record.
     *
     * @throws RecordNotFoundException when no record with the same id is stored
     */
    ReceiptRecord update(ReceiptRecord record);

    /**
     * Removes every stored record and returns how many were removed.
     */
    int deleteAll();

    default ReceiptRecord require(String id) {
        return findById(id).orElseThrow(() -> new RecordNotFoundException(id));
    }
}
