package dev.pekelund.receiptlens.records;

/**
 * Signals an attempt to create or edit a record that would break the record invariants.
 */
public class InvalidRecordException extends RuntimeException {

    public InvalidRecordException(String message) {
        super(message);
    }
}
