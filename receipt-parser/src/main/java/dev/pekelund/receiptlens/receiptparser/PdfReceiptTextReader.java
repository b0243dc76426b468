package dev.pekelund.receiptlens.receiptparser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the text layer of a PDF receipt with Apache PDFBox.
 */
public class PdfReceiptTextReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfReceiptTextReader.class);

    public String readText(byte[] pdfBytes, String fileName) {
        LOGGER.debug("Reading PDF text for file {} with payload size {}", fileName,
            pdfBytes != null ? pdfBytes.length : null);
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new ReceiptParsingException("Cannot parse an empty PDF document");
        }
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            return text != null ? text : "";
        } catch (IOException ex) {
            throw new ReceiptParsingException("Failed to read PDF document " + fileName, ex);
        }
    }
}
