package com.bookreader.nlp.core;

import java.util.concurrent.CancellationException;

/**
 * The caller cancelled an extraction; partial results are discarded.
 */
public class ExtractionCancelledException extends CancellationException {

    public ExtractionCancelledException(String message) {
        super(message);
    }
}
