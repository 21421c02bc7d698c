package com.bookreader.nlp.extractor;

/**
 * A single extractor call exceeded its time budget; its contribution for the run is empty.
 */
public class ExtractorTimeoutException extends RuntimeException {

    private final String processorName;
    private final long timeoutMs;

    public ExtractorTimeoutException(String processorName, long timeoutMs) {
        super(String.format("Extractor '%s' did not finish within %d ms", processorName, timeoutMs));
        this.processorName = processorName;
        this.timeoutMs = timeoutMs;
    }

    public String getProcessorName() {
        return processorName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
