package com.bookreader.nlp.enrich;

/**
 * Enrichment of one candidate failed; the candidate is kept without metadata.
 */
public class EnrichmentException extends RuntimeException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
