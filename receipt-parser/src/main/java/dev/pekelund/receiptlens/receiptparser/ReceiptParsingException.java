package dev.pekelund.receiptlens.receiptparser;

/**
 * Signals that a receipt document could not be turned into text.
 */
public class ReceiptParsingException extends RuntimeException {

    public ReceiptParsingException(String message) {
        super(message);
    }

    public ReceiptParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
