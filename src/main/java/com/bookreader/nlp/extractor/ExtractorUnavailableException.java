package com.bookreader.nlp.extractor;

/**
 * An extractor backend failed to load; the extractor is left out of the active set.
 */
public class ExtractorUnavailableException extends RuntimeException {

    private final String processorName;

    public ExtractorUnavailableException(String processorName, String message, Throwable cause) {
        super(String.format("Extractor '%s' unavailable: %s", processorName, message), cause);
        this.processorName = processorName;
    }

    public ExtractorUnavailableException(String processorName, String message) {
        this(processorName, message, null);
    }

    public String getProcessorName() {
        return processorName;
    }
}
