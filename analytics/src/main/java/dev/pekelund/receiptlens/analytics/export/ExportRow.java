package dev.pekelund.receiptlens.analytics.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

@JsonPropertyOrder({"id", "vendor", "transactionDate", "amount", "category", "source", "confidence", "createdAt"})
public record ExportRow(
    String id,
    String vendor,
    LocalDate transactionDate,
    BigDecimal amount,
    String category,
    String source,
    BigDecimal confidence,
    Instant createdAt
) {

    static ExportRow from(ReceiptRecord record) {
        return new ExportRow(
            record.id(),
            record.vendor(),
            record.transactionDate(),
            record.amount(),
            record.category().id(),
            record.source().id(),
            BigDecimal.valueOf(record.confidence().overall()).setScale(2, RoundingMode.HALF_UP),
            record.createdAt());
    }
}
