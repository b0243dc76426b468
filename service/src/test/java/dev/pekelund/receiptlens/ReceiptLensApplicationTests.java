package dev.pekelund.receiptlens;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.receiptlens.analytics.AnalyticsQuery;
import dev.pekelund.receiptlens.analytics.AnalyticsResult;
import dev.pekelund.receiptlens.analytics.ReceiptAnalyticsService;
import dev.pekelund.receiptlens.analytics.SortRequest;
import dev.pekelund.receiptlens.analytics.export.ExportFormat;
import dev.pekelund.receiptlens.analytics.search.SearchQuery;
import dev.pekelund.receiptlens.receiptparser.ReceiptIngestionService;
import dev.pekelund.receiptlens.receiptparser.heuristic.AmountKeyword;
import dev.pekelund.receiptlens.receiptparser.heuristic.ExtractionRules;
import dev.pekelund.receiptlens.records.ReceiptCategory;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import dev.pekelund.receiptlens.records.RecordField;
import dev.pekelund.receiptlens.records.RecordPatch;
import dev.pekelund.receiptlens.records.RecordSource;
import java.math.BigDecimal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ReceiptLensApplicationTests {

    @Autowired
    private ReceiptIngestionService ingestionService;

    @Autowired
    private ReceiptAnalyticsService analyticsService;

    @Autowired
    private ExtractionRules extractionRules;

    @AfterEach
    void resetStore() {
        ingestionService.reset();
    }

    @Test
    void loadsExtractionRulesFromApplicationConfiguration() {
        assertThat(extractionRules.vendorScanLines()).isEqualTo(5);
        assertThat(extractionRules.amountKeywords()).containsExactly(
            new AmountKeyword("grand total", 0.9),
            new AmountKeyword("total", 0.9),
            new AmountKeyword("amount due", 0.8),
            new AmountKeyword("balance", 0.8));
    }

    @Test
    void ingestedReceiptsCanBeQueried() {
        ReceiptRecord walmart = ingestionService.ingestText("WALMART\n01/15/2024\nTOTAL $45.67", null);
        ingestionService.ingestText("CORNER MARKET\n2024-03-02\nMilk 2.49\nTOTAL 5.59", null);
        ReceiptRecord shell = ingestionService.ingestText("Shell\n02/10/2024\nGas 30.00\nTOTAL 30.00", null);

        assertThat(walmart.category()).isEqualTo(ReceiptCategory.SHOPPING);
        assertThat(shell.category()).isEqualTo(ReceiptCategory.TRANSPORT);

        AnalyticsResult result = analyticsService.query(AnalyticsQuery.builder()
            .search(SearchQuery.amountRange(new BigDecimal("10"), null))
            .sort(SortRequest.of("amount", "heapsort", "desc"))
            .aggregate()
            .build());

        assertThat(result.inputSize()).isEqualTo(3);
        assertThat(result.records()).extracting(ReceiptRecord::vendor).containsExactly("WALMART", "Shell");
        assertThat(result.aggregationReport().orElseThrow().statistics().sum()).isEqualByComparingTo("75.67");
        assertThat(analyticsService.aggregate().statistics().count()).isEqualTo(3);
        assertThat(analyticsService.search(SearchQuery.fuzzy(RecordField.VENDOR, "WALMRT")))
            .extracting(ReceiptRecord::id).containsExactly(walmart.id());
    }

    @Test
    void correctedRecordsFeedAnalytics() {
        ReceiptRecord record = ingestionService.ingestText("Happy Paws\n2024-05-04\nTOTAL 80.00", null);

        ReceiptRecord corrected = ingestionService.correct(record.id(),
            RecordPatch.builder().category("healthcare").build());

        assertThat(corrected.source()).isEqualTo(RecordSource.MANUALLY_LABELED);
        assertThat(analyticsService.aggregate().categories().find("healthcare")).isPresent();
        assertThat(analyticsService.export(AnalyticsQuery.builder().build(), ExportFormat.CSV))
            .contains("Happy Paws,2024-05-04,80.00,healthcare,manually-labeled");
    }
}
