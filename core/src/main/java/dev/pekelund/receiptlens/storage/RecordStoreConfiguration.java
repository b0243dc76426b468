package dev.pekelund.receiptlens.storage;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecordStoreConfiguration {

    @Bean
    public ReceiptRecordStore receiptRecordStore() {
        return new InMemoryReceiptRecordStore();
    }
}
