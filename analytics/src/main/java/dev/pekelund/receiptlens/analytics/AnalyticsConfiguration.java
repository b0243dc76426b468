package dev.pekelund.receiptlens.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.receiptlens.analytics.aggregation.AggregationEngine;
import dev.pekelund.receiptlens.analytics.export.ReceiptRecordExporter;
import dev.pekelund.receiptlens.analytics.search.SearchStrategyRegistry;
import dev.pekelund.receiptlens.analytics.sort.SortStrategyRegistry;
import dev.pekelund.receiptlens.storage.ReceiptRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the strategy tables, the aggregation engine and the analytics facade.
 */
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsConfiguration.class);

    @Bean
    public SortStrategyRegistry sortStrategyRegistry() {
        return SortStrategyRegistry.withDefaults();
    }

    @Bean
    public SearchStrategyRegistry searchStrategyRegistry(SortStrategyRegistry sortStrategyRegistry,
        AnalyticsProperties analyticsProperties) {
        if (analyticsProperties.getFuzzyDistanceDivisor() < 1) {
            throw new IllegalStateException("analytics.fuzzy-distance-divisor must be at least 1");
        }
        return SearchStrategyRegistry.withDefaults(
            sortStrategyRegistry.get(analyticsProperties.getBinarySearchSortAlgorithm()),
            analyticsProperties.getFuzzyDistanceDivisor());
    }

    @Bean
    public AggregationEngine aggregationEngine(SortStrategyRegistry sortStrategyRegistry,
        AnalyticsProperties analyticsProperties) {
        return new AggregationEngine(sortStrategyRegistry.get(analyticsProperties.getDefaultSortAlgorithm()));
    }

    @Bean
    public AnalyticsFacade analyticsFacade(SearchStrategyRegistry searchStrategyRegistry,
        SortStrategyRegistry sortStrategyRegistry, AggregationEngine aggregationEngine,
        AnalyticsProperties analyticsProperties) {
        if (analyticsProperties.getWindowSize() < 1) {
            throw new IllegalStateException("analytics.window-size must be at least 1");
        }
        LOGGER.info("Configured analytics - default sort: {}, binary search sort: {}, window size: {}, "
                + "fuzzy distance divisor: {}",
            analyticsProperties.getDefaultSortAlgorithm(), analyticsProperties.getBinarySearchSortAlgorithm(),
            analyticsProperties.getWindowSize(), analyticsProperties.getFuzzyDistanceDivisor());
        return new AnalyticsFacade(searchStrategyRegistry, sortStrategyRegistry, aggregationEngine,
            analyticsProperties.getDefaultSortAlgorithm(), analyticsProperties.getWindowSize());
    }

    @Bean
    public ReceiptRecordExporter receiptRecordExporter(ObjectProvider<ObjectMapper> objectMapper) {
        return new ReceiptRecordExporter(objectMapper.getIfAvailable(() -> {
            ObjectMapper mapper = new ObjectMapper();
            mapper.findAndRegisterModules();
            return mapper;
        }));
    }

    @Bean
    public ReceiptAnalyticsService receiptAnalyticsService(AnalyticsFacade analyticsFacade,
        ReceiptRecordStore receiptRecordStore, ReceiptRecordExporter receiptRecordExporter) {
        return new ReceiptAnalyticsService(analyticsFacade, receiptRecordStore, receiptRecordExporter);
    }
}
