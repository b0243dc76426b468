package dev.pekelund.receiptlens;

import dev.pekelund.receiptlens.analytics.AnalyticsProperties;
import dev.pekelund.receiptlens.storage.ReceiptRecordStore;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the active profiles and the resolved analytics settings once the application has started.
 */
@Component
public class ReceiptLensDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptLensDiagnostics.class);

    private final Environment environment;
    private final AnalyticsProperties analyticsProperties;
    private final ReceiptRecordStore recordStore;

    public ReceiptLensDiagnostics(Environment environment, AnalyticsProperties analyticsProperties,
        ReceiptRecordStore recordStore) {
        this.environment = environment;
        this.analyticsProperties = analyticsProperties;
        this.recordStore = recordStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Receipt Lens starting with profiles {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Analytics - default sort: {}, window size: {}", analyticsProperties.getDefaultSortAlgorithm(),
            analyticsProperties.getWindowSize());
        LOGGER.info("Record store implementation: {}", recordStore.getClass().getSimpleName());
    }
}
