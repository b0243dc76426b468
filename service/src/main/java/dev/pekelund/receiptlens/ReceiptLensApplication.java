package dev.pekelund.receiptlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point wiring receipt extraction, the record store and analytics.
 */
@SpringBootApplication
public class ReceiptLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptLensApplication.class, args);
    }
}
