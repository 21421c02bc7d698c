package com.bookreader.nlp.core;

import java.util.Objects;

/**
 * A named entity or lexicon hit found by an extractor, with chapter offsets.
 */
public record EntityTag(String text, String label, int start, int end) {

    public EntityTag {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                String.format("invalid entity offsets [%d, %d) for '%s'", start, end, text));
        }
    }
}
