package dev.pekelund.receiptlens.receiptparser.heuristic;

/**
 * Heuristic extractor for a single record field. Implementations are pure functions of the normalized
 * text and report "nothing found" as {@link FieldExtraction#absent()} rather than by throwing.
 */
public interface FieldExtractor<T> {

    String name();

    FieldExtraction<T> extract(String normalizedText);
}
