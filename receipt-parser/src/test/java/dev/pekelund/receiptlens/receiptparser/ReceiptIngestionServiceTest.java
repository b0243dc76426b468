package dev.pekelund.receiptlens.receiptparser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.receiptlens.receiptparser.heuristic.AmountExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.CategoryExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.DateExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.ExtractionRules;
import dev.pekelund.receiptlens.receiptparser.heuristic.TextNormalizer;
import dev.pekelund.receiptlens.receiptparser.heuristic.VendorExtractor;
import dev.pekelund.receiptlens.records.ReceiptCategory;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.ReceiptRecordEditor;
import dev.pekelund.receiptlens.records.RecordPatch;
import dev.pekelund.receiptlens.records.RecordSource;
import dev.pekelund.receiptlens.storage.InMemoryReceiptRecordStore;
import dev.pekelund.receiptlens.storage.RecordNotFoundException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ReceiptIngestionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T10:15:30Z"), ZoneOffset.UTC);

    private InMemoryReceiptRecordStore store;
    private ReceiptIngestionService service;

    @BeforeEach
    void setUp() {
        ExtractionRules rules = ExtractionRules.defaults();
        AtomicInteger ids = new AtomicInteger();
        ReceiptExtractionCoordinator coordinator = new ReceiptExtractionCoordinator(new TextNormalizer(),
            new VendorExtractor(rules), new DateExtractor(rules), new AmountExtractor(rules),
            new CategoryExtractor(rules), CLOCK, () -> "record-" + ids.incrementAndGet());
        store = new InMemoryReceiptRecordStore();
        service = new ReceiptIngestionService(coordinator, store, new ReceiptRecordEditor(CLOCK),
            new PdfReceiptTextReader());
    }

    @Test
    void ingestsTextIntoStore() {
        ReceiptRecord record = service.ingestText("WALMART\n01/15/2024\nTOTAL $45.67", null);

        assertThat(store.require(record.id())).isEqualTo(record);
        assertThat(record.vendor()).isEqualTo("WALMART");
        assertThat(MDC.get(ReceiptProcessingMdc.KEY_RECORD_ID)).isNull();
    }

    @Test
    void ingestsPdfTextLayer() throws IOException {
        byte[] pdf = pdfWithLines(List.of("CORNER MARKET", "2024-03-02", "Milk 2.49", "Bread 3.10", "TOTAL 5.59"));

        ReceiptRecord record = service.ingestPdf(pdf, "corner-market.pdf", null);

        assertThat(record.vendor()).isEqualTo("CORNER MARKET");
        assertThat(record.transactionDate()).isEqualTo(LocalDate.of(2024, 3, 2));
        assertThat(record.amount()).isEqualByComparingTo("5.59");
        assertThat(record.category()).isEqualTo(ReceiptCategory.GROCERIES);
        assertThat(store.list()).containsExactly(record);
    }

    @Test
    void rejectsEmptyPdfPayload() {
        assertThatThrownBy(() -> service.ingestPdf(new byte[0], "empty.pdf", null))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("empty PDF");
        assertThat(store.list()).isEmpty();
    }

    @Test
    void rejectsUnreadablePdf() {
        assertThatThrownBy(() -> service.ingestPdf("not a pdf".getBytes(), "broken.pdf", null))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("broken.pdf");
    }

    @Test
    void rejectsPdfWithoutTextLayer() throws IOException {
        byte[] pdf = pdfWithLines(List.of());

        assertThatThrownBy(() -> service.ingestPdf(pdf, "blank.pdf", null))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("readable text");
    }

    @Test
    void correctionIsValidatedAndStored() {
        ReceiptRecord record = service.ingestText("WALMART\n01/15/2024\nTOTAL $45.67", null);

        ReceiptRecord corrected = service.correct(record.id(), RecordPatch.builder()
            .category("groceries")
            .amount(new BigDecimal("44.00"))
            .build());

        assertThat(corrected.category()).isEqualTo(ReceiptCategory.GROCERIES);
        assertThat(corrected.source()).isEqualTo(RecordSource.MANUALLY_LABELED);
        assertThat(store.require(record.id()).amount()).isEqualByComparingTo("44.00");
    }

    @Test
    void correctingUnknownRecordFails() {
        assertThatThrownBy(() -> service.correct("missing", RecordPatch.builder().vendor("X").build()))
            .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void resetRemovesEverything() {
        service.ingestText("WALMART\nTOTAL $1.00", null);
        service.ingestText("SHELL\nTOTAL $40.00", ReceiptCategory.TRANSPORT);

        assertThat(service.reset()).isEqualTo(2);
        assertThat(store.list()).isEmpty();
    }

    private static byte[] pdfWithLines(List<String> lines) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                if (!lines.isEmpty()) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(50, 700);
                    for (String line : lines) {
                        content.showText(line);
                        content.newLineAtOffset(0, -16);
                    }
                    content.endText();
                }
            }
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            document.save(output);
            return output.toByteArray();
        }
    }
}
