package dev.pekelund.receiptlens.receiptparser;

import dev.pekelund.receiptlens.receiptparser.heuristic.AmountExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.CategoryExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.DateExtractor;
import dev.pekelund.receiptlens.receiptparser.heuristic.ExtractionRules;
import dev.pekelund.receiptlens.receiptparser.heuristic.TextNormalizer;
import dev.pekelund.receiptlens.receiptparser.heuristic.VendorExtractor;
import dev.pekelund.receiptlens.records.ReceiptRecordEditor;
import dev.pekelund.receiptlens.storage.ReceiptRecordStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the heuristic extraction pipeline and the ingestion service.
 */
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ReceiptParserConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptParserConfiguration.class);

    @Bean
    public ExtractionRules extractionRules(ExtractionProperties extractionProperties) {
        ExtractionRules rules = extractionProperties.toRules();
        LOGGER.info("Configured receipt extraction rules - vendor scan lines: {}, max symbol ratio: {}, "
                + "amount keywords: {}, categories with keywords: {}, date patterns: {}",
            rules.vendorScanLines(), rules.vendorMaxSymbolRatio(), rules.amountKeywords().size(),
            rules.categoryKeywords().size(), rules.datePatterns().size());
        return rules;
    }

    @Bean
    public ReceiptExtractionCoordinator receiptExtractionCoordinator(ExtractionRules extractionRules,
        ObjectProvider<Clock> clock) {
        return new ReceiptExtractionCoordinator(new TextNormalizer(), new VendorExtractor(extractionRules),
            new DateExtractor(extractionRules), new AmountExtractor(extractionRules),
            new CategoryExtractor(extractionRules), clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    public ReceiptRecordEditor receiptRecordEditor(ObjectProvider<Clock> clock) {
        return new ReceiptRecordEditor(clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    public PdfReceiptTextReader pdfReceiptTextReader() {
        return new PdfReceiptTextReader();
    }

    @Bean
    public ReceiptIngestionService receiptIngestionService(ReceiptExtractionCoordinator receiptExtractionCoordinator,
        ReceiptRecordStore receiptRecordStore, ReceiptRecordEditor receiptRecordEditor,
        PdfReceiptTextReader pdfReceiptTextReader) {
        return new ReceiptIngestionService(receiptExtractionCoordinator, receiptRecordStore, receiptRecordEditor,
            pdfReceiptTextReader);
    }
}
