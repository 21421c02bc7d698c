package com.bookreader.nlp.core;

import java.util.Locale;

/**
 * Structural class of a paragraph, assigned by the segmenter.
 */
public enum ParagraphType {
    DESCRIPTION,
    NARRATIVE,
    DIALOGUE,
    MIXED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether paragraphs of this type are worth running phrase extraction on.
     */
    public boolean isDescriptive() {
        return this == DESCRIPTION || this == MIXED;
    }
}
