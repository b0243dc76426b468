package dev.pekelund.receiptlens;

/**
 * Anchor type for the core modules (records and storage) used when verifying module boundaries.
 */
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
