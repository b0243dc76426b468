package dev.pekelund.receiptlens.receiptparser.heuristic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

class VendorExtractorTest {

    private final VendorExtractor extractor = new VendorExtractor(ExtractionRules.defaults());

    @Test
    void allCapsHeaderOnFirstLineScoresHighest() {
        FieldExtraction<String> vendor = extractor.extract("WALMART\n01/15/2024\nTOTAL $45.67");

        assertThat(vendor.value()).isEqualTo("WALMART");
        assertThat(vendor.confidence()).isCloseTo(0.9, offset(1e-9));
    }

    @Test
    void skipsBoilerplateAndSymbolHeavyLines() {
        FieldExtraction<String> vendor = extractor.extract("Receipt\n555-123-4567\nBlue Bottle Cafe\nLatte 4.50");

        assertThat(vendor.value()).isEqualTo("Blue Bottle Cafe");
        assertThat(vendor.confidence()).isCloseTo(0.6, offset(1e-9));
    }

    @Test
    void stripsTrailingStoreNumber() {
        FieldExtraction<String> vendor = extractor.extract("TARGET #1234\nAisle 5");

        assertThat(vendor.value()).isEqualTo("TARGET");
    }

    @Test
    void prefersStrongerHeaderShapeOverLongerLine() {
        FieldExtraction<String> vendor = extractor.extract("KROGER\nSave more on every visit");

        assertThat(vendor.value()).isEqualTo("KROGER");
    }

    @Test
    void lowercaseLineIsAGenericGuess() {
        FieldExtraction<String> vendor = extractor.extract("corner deli\n12.00");

        assertThat(vendor.value()).isEqualTo("corner deli");
        assertThat(vendor.confidence()).isCloseTo(0.3, offset(1e-9));
    }

    @Test
    void onlyScansTheConfiguredNumberOfLines() {
        VendorExtractor narrow = new VendorExtractor(ExtractionRules.builder().vendorScanLines(1).build());

        FieldExtraction<String> vendor = narrow.extract("12.00\nWALMART");

        assertThat(vendor.isPresent()).isFalse();
        assertThat(vendor.confidence()).isZero();
    }
}
