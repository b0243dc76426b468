package dev.pekelund.receiptlens.storage;

public class RecordNotFoundException extends RuntimeException {

    private final String recordId;

    public RecordNotFoundException(String recordId) {
        super("No receipt record with id '" + recordId + "'");
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
