package dev.pekelund.receiptlens.analytics.export;

/**
 * Signals a failure while serialising records for export.
 */
public class ReceiptExportException extends RuntimeException {

    public ReceiptExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
