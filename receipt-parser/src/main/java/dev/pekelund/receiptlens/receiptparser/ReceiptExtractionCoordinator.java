package dev.pekelund.receiptlens.receiptparser;

import dev.pekelund.receiptlens.receiptparser.heuristic.FieldExtraction;
import dev.pekelund.receiptlens.receiptparser.heuristic.FieldExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.TextNormalizer;
import dev.pekelund.receiptlens.records.FieldConfidence;
import dev.pekelund.receiptlens.records.ReceiptCategory;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw receipt text into a {@link ReceiptRecord}.
 *
 * <p>Each extractor runs in isolation: a failure degrades only its own field to absent with zero
 * confidence. A manual category label bypasses the category extractor entirely. Malformed or empty
 * input never raises; the worst case is a record with every field absent and category
 * {@link ReceiptCategory#OTHER}.</p>
 */
public class ReceiptExtractionCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptExtractionCoordinator.class);

    private final TextNormalizer normalizer;
    private final FieldExtractor<String> vendorExtractor;
    private final FieldExtractor<LocalDate> dateExtractor;
    private final FieldExtractor<BigDecimal> amountExtractor;
    private final FieldExtractor<ReceiptCategory> categoryExtractor;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public ReceiptExtractionCoordinator(TextNormalizer normalizer, FieldExtractor<String> vendorExtractor,
        FieldExtractor<LocalDate> dateExtractor, FieldExtractor<BigDecimal> amountExtractor,
        FieldExtractor<ReceiptCategory> categoryExtractor, Clock clock) {
        this(normalizer, vendorExtractor, dateExtractor, amountExtractor, categoryExtractor, clock,
            () -> UUID.randomUUID().toString());
    }

    ReceiptExtractionCoordinator(TextNormalizer normalizer, FieldExtractor<String> vendorExtractor,
        FieldExtractor<LocalDate> dateExtractor, FieldExtractor<BigDecimal> amountExtractor,
        FieldExtractor<ReceiptCategory> categoryExtractor, Clock clock, Supplier<String> idGenerator) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.vendorExtractor = Objects.requireNonNull(vendorExtractor, "vendorExtractor");
        this.dateExtractor = Objects.requireNonNull(dateExtractor, "dateExtractor");
        this.amountExtractor = Objects.requireNonNull(amountExtractor, "amountExtractor");
        this.categoryExtractor = Objects.requireNonNull(categoryExtractor, "categoryExtractor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public ReceiptRecord extract(String rawText) {
        return extract(rawText, null);
    }

    public ReceiptRecord extract(String rawText, ReceiptCategory manualLabel) {
        String original = rawText != null ? rawText : "";
        String normalized = normalizer.normalize(original);

        FieldExtraction<String> vendor = run(vendorExtractor, normalized);
        FieldExtraction<LocalDate> date = run(dateExtractor, normalized);
        FieldExtraction<BigDecimal> amount = run(amountExtractor, normalized);
        if (amount.isPresent() && amount.value().signum() < 0) {
            LOGGER.warn("Discarding negative amount {} from extractor {}", amount.value(), amountExtractor.name());
            amount = FieldExtraction.absent();
        }

        ReceiptCategory category;
        double categoryConfidence;
        RecordSource source;
        if (manualLabel != null) {
            category = manualLabel;
            categoryConfidence = 1.0;
            source = RecordSource.MANUALLY_LABELED;
        } else {
            FieldExtraction<ReceiptCategory> detected = run(categoryExtractor, normalized);
            category = detected.isPresent() ? detected.value() : ReceiptCategory.OTHER;
            categoryConfidence = detected.isPresent() ? detected.confidence() : 0.0;
            source = RecordSource.AUTO_DETECTED;
        }

        Instant now = clock.instant();
        ReceiptRecord record = ReceiptRecord.builder()
            .id(idGenerator.get())
            .rawText(original)
            .vendor(vendor.value())
            .transactionDate(date.value())
            .amount(amount.value())
            .category(category)
            .confidence(new FieldConfidence(vendor.confidence(), date.confidence(), amount.confidence(),
                categoryConfidence))
            .source(source)
            .createdAt(now)
            .updatedAt(now)
            .build();

        LOGGER.debug("Extracted record {} - vendor: {}, date: {}, amount: {}, category: {} ({}), overall confidence {}",
            record.id(), record.vendor(), record.transactionDate(), record.amount(), record.category(),
            record.source(), String.format("%.2f", record.confidence().overall()));
        return record;
    }

    private <T> FieldExtraction<T> run(FieldExtractor<T> extractor, String normalizedText) {
        if (normalizedText.isEmpty()) {
            return FieldExtraction.absent();
        }
        try {
            FieldExtraction<T> extraction = extractor.extract(normalizedText);
            return extraction != null ? extraction : FieldExtraction.absent();
        } catch (RuntimeException ex) {
            LOGGER.warn("Extractor '{}' failed; leaving the field absent", extractor.name(), ex);
            return FieldExtraction.absent();
        }
    }
}
