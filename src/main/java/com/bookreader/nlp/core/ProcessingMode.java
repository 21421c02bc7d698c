package com.bookreader.nlp.core;

import java.util.Locale;

/**
 * How registered extractors are orchestrated for one extraction call.
 */
public enum ProcessingMode {
    SINGLE,
    PARALLEL,
    SEQUENTIAL,
    ENSEMBLE,
    ADAPTIVE;

    /**
     * Parses a mode name case-insensitively, returning {@code fallback} when unknown.
     */
    public static ProcessingMode fromString(String value, ProcessingMode fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
