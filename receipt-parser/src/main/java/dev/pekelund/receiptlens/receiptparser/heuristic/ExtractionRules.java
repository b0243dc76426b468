package dev.pekelund.receiptlens.receiptparser.heuristic;

import dev.pekelund.receiptlens.records.ReceiptCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable tables that drive the heuristic extractors: vendor scan limits, amount keywords, category
 * keywords and the ordered date pattern list.
 */
public record ExtractionRules(
    int vendorScanLines,
    double vendorMaxSymbolRatio,
    List<String> vendorSkipWords,
    List<String> vendorStoreSuffixes,
    List<AmountKeyword> amountKeywords,
    Map<ReceiptCategory, List<String>> categoryKeywords,
    List<DatePattern> datePatterns
) {

    public static final int DEFAULT_VENDOR_SCAN_LINES = 5;
    public static final double DEFAULT_VENDOR_MAX_SYMBOL_RATIO = 0.3;

    private static final List<String> DEFAULT_SKIP_WORDS = List.of(
        "receipt", "invoice", "total", "subtotal", "amount", "date", "time", "tax", "cashier", "register",
        "thank you", "welcome", "tel", "phone", "www", "http");

    private static final List<String> DEFAULT_STORE_SUFFIXES = List.of(
        "store", "stores", "market", "supermarket", "mart", "shop", "cafe", "restaurant", "pharmacy", "inc",
        "llc", "co", "company", "grill", "bistro", "station");

    private static final List<AmountKeyword> DEFAULT_AMOUNT_KEYWORDS = List.of(
        new AmountKeyword("grand total", 0.9),
        new AmountKeyword("total", 0.9),
        new AmountKeyword("amount due", 0.8),
        new AmountKeyword("balance", 0.8));

    private static final Map<ReceiptCategory, List<String>> DEFAULT_CATEGORY_KEYWORDS = defaultCategoryKeywords();

    public ExtractionRules {
        if (vendorScanLines < 1) {
            throw new IllegalArgumentException("vendorScanLines must be at least 1");
        }
        if (vendorMaxSymbolRatio < 0.0 || vendorMaxSymbolRatio > 1.0) {
            throw new IllegalArgumentException("vendorMaxSymbolRatio must be within [0, 1]");
        }
        vendorSkipWords = lowercase(vendorSkipWords);
        vendorStoreSuffixes = lowercase(vendorStoreSuffixes);
        amountKeywords = List.copyOf(Objects.requireNonNull(amountKeywords, "amountKeywords"));
        datePatterns = List.copyOf(Objects.requireNonNull(datePatterns, "datePatterns"));

        Objects.requireNonNull(categoryKeywords, "categoryKeywords");
        EnumMap<ReceiptCategory, List<String>> copy = new EnumMap<>(ReceiptCategory.class);
        categoryKeywords.forEach((category, keywords) -> copy.put(category, lowercase(keywords)));
        categoryKeywords = Collections.unmodifiableMap(copy);
    }

    public static ExtractionRules defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .vendorScanLines(vendorScanLines)
            .vendorMaxSymbolRatio(vendorMaxSymbolRatio)
            .vendorSkipWords(vendorSkipWords)
            .vendorStoreSuffixes(vendorStoreSuffixes)
            .amountKeywords(amountKeywords)
            .categoryKeywords(categoryKeywords)
            .datePatterns(datePatterns);
    }

    public List<String> keywordsFor(ReceiptCategory category) {
        return categoryKeywords.getOrDefault(category, List.of());
    }

    private static List<String> lowercase(List<String> values) {
        Objects.requireNonNull(values, "values");
        return values.stream()
            .filter(Objects::nonNull)
            .map(value -> value.trim().toLowerCase(Locale.ROOT))
            .filter(value -> !value.isEmpty())
            .distinct()
            .toList();
    }

    private static Map<ReceiptCategory, List<String>> defaultCategoryKeywords() {
        EnumMap<ReceiptCategory, List<String>> keywords = new EnumMap<>(ReceiptCategory.class);
        keywords.put(ReceiptCategory.GROCERIES, List.of(
            "grocery", "groceries", "supermarket", "market", "food", "fresh", "organic", "whole foods",
            "trader joe", "safeway", "kroger", "aldi", "produce", "milk", "bread", "eggs", "cheese", "vegetables",
            "fruits", "bananas", "apples"));
        keywords.put(ReceiptCategory.RESTAURANT, List.of(
            "restaurant", "cafe", "diner", "pizza", "burger", "mcdonalds", "kfc", "subway", "starbucks", "coffee",
            "bistro", "grill", "tip", "gratuity", "server", "table"));
        keywords.put(ReceiptCategory.TRANSPORT, List.of(
            "uber", "lyft", "taxi", "gas", "fuel", "shell", "exxon", "chevron", "transport", "parking", "metro",
            "transit", "gallons", "toll"));
        keywords.put(ReceiptCategory.ENTERTAINMENT, List.of(
            "movie", "theater", "theatre", "cinema", "netflix", "spotify", "amazon prime", "hulu", "disney",
            "game", "entertainment", "concert", "tickets"));
        keywords.put(ReceiptCategory.SHOPPING, List.of(
            "walmart", "target", "amazon", "best buy", "home depot", "lowes", "macys", "nordstrom", "shopping",
            "store", "mall", "outlet", "clothing"));
        keywords.put(ReceiptCategory.UTILITIES, List.of(
            "electric", "electricity", "water", "internet", "phone", "cable", "utility", "utilities", "at&t",
            "verizon", "comcast", "kwh", "gas"));
        keywords.put(ReceiptCategory.HEALTHCARE, List.of(
            "pharmacy", "drug", "cvs", "walgreens", "rite aid", "medical", "doctor", "hospital", "clinic",
            "health", "rx", "prescription"));
        return keywords;
    }

    public static final class Builder {

        private int vendorScanLines = DEFAULT_VENDOR_SCAN_LINES;
        private double vendorMaxSymbolRatio = DEFAULT_VENDOR_MAX_SYMBOL_RATIO;
        private List<String> vendorSkipWords = DEFAULT_SKIP_WORDS;
        private List<String> vendorStoreSuffixes = DEFAULT_STORE_SUFFIXES;
        private List<AmountKeyword> amountKeywords = DEFAULT_AMOUNT_KEYWORDS;
        private Map<ReceiptCategory, List<String>> categoryKeywords = DEFAULT_CATEGORY_KEYWORDS;
        private List<DatePattern> datePatterns = DatePattern.defaults();

        private Builder() {
        }

        public Builder vendorScanLines(int vendorScanLines) {
            this.vendorScanLines = vendorScanLines;
            return this;
        }

        public Builder vendorMaxSymbolRatio(double vendorMaxSymbolRatio) {
            this.vendorMaxSymbolRatio = vendorMaxSymbolRatio;
            return this;
        }

        public Builder vendorSkipWords(List<String> vendorSkipWords) {
            this.vendorSkipWords = vendorSkipWords;
            return this;
        }

        public Builder vendorStoreSuffixes(List<String> vendorStoreSuffixes) {
            this.vendorStoreSuffixes = vendorStoreSuffixes;
            return this;
        }

        public Builder amountKeywords(List<AmountKeyword> amountKeywords) {
            this.amountKeywords = amountKeywords;
            return this;
        }

        public Builder categoryKeywords(Map<ReceiptCategory, List<String>> categoryKeywords) {
            this.categoryKeywords = categoryKeywords;
            return this;
        }

        public Builder datePatterns(List<DatePattern> datePatterns) {
            this.datePatterns = datePatterns;
            return this;
        }

        public ExtractionRules build() {
            return new ExtractionRules(vendorScanLines, vendorMaxSymbolRatio, vendorSkipWords, vendorStoreSuffixes,
                amountKeywords, categoryKeywords, datePatterns);
        }
    }
}
