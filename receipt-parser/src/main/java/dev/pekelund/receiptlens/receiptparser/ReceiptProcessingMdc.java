package dev.pekelund.receiptlens.receiptparser;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a receipt is
 * ingested or corrected share the same identifiers (record id, file name, stage).
 */
final class ReceiptProcessingMdc {

    static final String KEY_RECORD_ID = "receipt.recordId";
    static final String KEY_FILE_NAME = "receipt.fileName";
    static final String KEY_STAGE = "receipt.stage";

    private ReceiptProcessingMdc() {
        // Utility class
    }

    static Context open(String fileName) {
        return new Context(fileName);
    }

    static void attachRecord(String recordId) {
        putIfHasText(KEY_RECORD_ID, recordId);
    }

    static void setStage(String stage) {
        if (!StringUtils.hasText(stage)) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage);
        }
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String fileName) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_FILE_NAME, fileName);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
