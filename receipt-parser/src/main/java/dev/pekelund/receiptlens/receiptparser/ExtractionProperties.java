package dev.pekelund.receiptlens.receiptparser;

import dev.pekelund.receiptlens.receiptparser.heuristic.AmountKeyword;
import dev.pekelund.receiptlens.receiptparser.heuristic.ExtractionRules;
import dev.pekelund.receiptlens.records.ReceiptCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt-parser.extraction")
public class ExtractionProperties {

    /**
     * Number of leading lines scanned for the vendor name.
     */
    private Integer vendorScanLines;

    /**
     * Highest share of digits and symbols a line may have and still be taken as the vendor name.
     */
    private Double vendorMaxSymbolRatio;

    /**
     * Words that disqualify a header line from being the vendor name.
     */
    private List<String> vendorSkipWords = new ArrayList<>();

    /**
     * Words such as "store" or "cafe" that make a header line look like a merchant name.
     */
    private List<String> vendorStoreSuffixes = new ArrayList<>();

    /**
     * Total keywords mapped to the confidence a match earns, e.g. {@code total: 0.9}.
     */
    private Map<String, Double> amountKeywords = new LinkedHashMap<>();

    /**
     * Category id mapped to its keyword list. Categories left out keep the built-in keywords.
     */
    private Map<String, List<String>> categoryKeywords = new LinkedHashMap<>();

    /**
     * Resolves the configured values on top of {@link ExtractionRules#defaults()}.
     *
     * @throws IllegalStateException when a keyword table names an unknown category
     */
    public ExtractionRules toRules() {
        ExtractionRules defaults = ExtractionRules.defaults();
        ExtractionRules.Builder builder = defaults.toBuilder();
        if (vendorScanLines != null) {
            builder.vendorScanLines(vendorScanLines);
        }
        if (vendorMaxSymbolRatio != null) {
            builder.vendorMaxSymbolRatio(vendorMaxSymbolRatio);
        }
        if (!vendorSkipWords.isEmpty()) {
            builder.vendorSkipWords(vendorSkipWords);
        }
        if (!vendorStoreSuffixes.isEmpty()) {
            builder.vendorStoreSuffixes(vendorStoreSuffixes);
        }
        if (!amountKeywords.isEmpty()) {
            List<AmountKeyword> keywords = new ArrayList<>();
            amountKeywords.forEach((phrase, confidence) -> keywords.add(new AmountKeyword(phrase, confidence)));
            builder.amountKeywords(keywords);
        }
        if (!categoryKeywords.isEmpty()) {
            Map<ReceiptCategory, List<String>> merged = new EnumMap<>(defaults.categoryKeywords());
            categoryKeywords.forEach((id, keywords) -> {
                ReceiptCategory category = ReceiptCategory.find(id)
                    .orElseThrow(() -> new IllegalStateException(
                        "Unknown category '" + id + "' in receipt-parser.extraction.category-keywords"));
                merged.put(category, keywords != null ? keywords : List.of());
            });
            builder.categoryKeywords(merged);
        }
        return builder.build();
    }

    public Integer getVendorScanLines() {
        return vendorScanLines;
    }

    public void setVendorScanLines(Integer vendorScanLines) {
        this.vendorScanLines = vendorScanLines;
    }

    public Double getVendorMaxSymbolRatio() {
        return vendorMaxSymbolRatio;
    }

    public void setVendorMaxSymbolRatio(Double vendorMaxSymbolRatio) {
        this.vendorMaxSymbolRatio = vendorMaxSymbolRatio;
    }

    public List<String> getVendorSkipWords() {
        return vendorSkipWords;
    }

    public void setVendorSkipWords(List<String> vendorSkipWords) {
        this.vendorSkipWords = vendorSkipWords != null ? vendorSkipWords : new ArrayList<>();
    }

    public List<String> getVendorStoreSuffixes() {
        return vendorStoreSuffixes;
    }

    public void setVendorStoreSuffixes(List<String> vendorStoreSuffixes) {
        this.vendorStoreSuffixes = vendorStoreSuffixes != null ? vendorStoreSuffixes : new ArrayList<>();
    }

    public Map<String, Double> getAmountKeywords() {
        return amountKeywords;
    }

    public void setAmountKeywords(Map<String, Double> amountKeywords) {
        this.amountKeywords = amountKeywords != null ? amountKeywords : new LinkedHashMap<>();
    }

    public Map<String, List<String>> getCategoryKeywords() {
        return categoryKeywords;
    }

    public void setCategoryKeywords(Map<String, List<String>> categoryKeywords) {
        this.categoryKeywords = categoryKeywords != null ? categoryKeywords : new LinkedHashMap<>();
    }
}
