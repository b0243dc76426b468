package dev.pekelund.receiptlens.receiptparser;

import dev.pekelund.receiptlens.records.ReceiptCategory;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.ReceiptRecordEditor;
import dev.pekelund.receiptlens.records.RecordPatch;
import dev.pekelund.receiptlens.storage.ReceiptRecordStore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Entry point for adding receipts to the record store and correcting them afterwards.
 */
public class ReceiptIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptIngestionService.class);

    private final ReceiptExtractionCoordinator coordinator;
    private final ReceiptRecordStore store;
    private final ReceiptRecordEditor editor;
    private final PdfReceiptTextReader pdfReader;

    public ReceiptIngestionService(ReceiptExtractionCoordinator coordinator, ReceiptRecordStore store,
        ReceiptRecordEditor editor, PdfReceiptTextReader pdfReader) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.store = Objects.requireNonNull(store, "store");
        this.editor = Objects.requireNonNull(editor, "editor");
        this.pdfReader = Objects.requireNonNull(pdfReader, "pdfReader");
    }

    public ReceiptRecord ingestText(String rawText, ReceiptCategory manualLabel) {
        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open(null)) {
            return extractAndSave(rawText, manualLabel);
        }
    }

    /**
     * Reads the PDF text layer and ingests it like plain text.
     *
     * @throws ReceiptParsingException when the document is empty, unreadable or has no text layer
     */
    public ReceiptRecord ingestPdf(byte[] pdfBytes, String fileName, ReceiptCategory manualLabel) {
        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open(fileName)) {
            ReceiptProcessingMdc.setStage("read-pdf");
            String text = pdfReader.readText(pdfBytes, fileName);
            if (!StringUtils.hasText(text)) {
                throw new ReceiptParsingException("PDF document did not contain any readable text");
            }
            return extractAndSave(text, manualLabel);
        }
    }

    /**
     * Applies a validated correction to a stored record.
     */
    public ReceiptRecord correct(String recordId, RecordPatch patch) {
        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open(null)) {
            ReceiptProcessingMdc.attachRecord(recordId);
            ReceiptProcessingMdc.setStage("correct");
            ReceiptRecord existing = store.require(recordId);
            ReceiptRecord corrected = editor.apply(existing, patch);
            if (corrected == existing) {
                return existing;
            }
            return store.update(corrected);
        }
    }

    public int reset() {
        int removed = store.deleteAll();
        LOGGER.info("Reset record store; removed {} records", removed);
        return removed;
    }

    private ReceiptRecord extractAndSave(String rawText, ReceiptCategory manualLabel) {
        ReceiptProcessingMdc.setStage("extract");
        ReceiptRecord record = coordinator.extract(rawText, manualLabel);
        ReceiptProcessingMdc.attachRecord(record.id());
        ReceiptProcessingMdc.setStage("store");
        ReceiptRecord saved = store.save(record);
        LOGGER.info("Ingested receipt record {} - vendor: {}, amount: {}, category: {} ({}), overall confidence {}",
            saved.id(), saved.vendor(), saved.amount(), saved.category(), saved.source(),
            String.format("%.2f", saved.confidence().overall()));
        return saved;
    }
}
