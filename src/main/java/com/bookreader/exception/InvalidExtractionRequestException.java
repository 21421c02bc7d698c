package com.bookreader.exception;

/**
 * An extraction request the engine cannot act on, such as an unknown mode name or a missing body.
 */
public class InvalidExtractionRequestException extends RuntimeException {

    private final String field;

    public InvalidExtractionRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Request field at fault.
     */
    public String getField() {
        return field;
    }
}
