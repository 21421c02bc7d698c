package com.bookreader.exception;

/**
 * No extractor is usable, so the engine cannot run.
 */
public class ProcessorConfigurationException extends RuntimeException {

    public ProcessorConfigurationException(String message) {
        super(message);
    }
}
