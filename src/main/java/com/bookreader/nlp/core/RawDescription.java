package com.bookreader.nlp.core;

import java.util.List;
import java.util.Objects;

/**
 * One extractor's proposal for a description span.
 *
 * @param text                candidate text
 * @param span                chapter offsets of the candidate
 * @param descriptionType     category assigned by the extractor
 * @param entityTags          entities or lexicon hits inside the span
 * @param sourceProcessor     name of the extractor that produced it
 * @param processorConfidence extractor's own confidence in [0.0, 1.0]
 * @param paragraphIndex      index of the source paragraph
 * @param paragraphScore      descriptiveness of the source paragraph, the structural signal
 */
public record RawDescription(
    String text,
    TextSpan span,
    DescriptionType descriptionType,
    List<EntityTag> entityTags,
    String sourceProcessor,
    double processorConfidence,
    int paragraphIndex,
    double paragraphScore
) {

    public RawDescription {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text cannot be null or blank");
        }
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(descriptionType, "descriptionType must not be null");
        if (sourceProcessor == null || sourceProcessor.isBlank()) {
            throw new IllegalArgumentException("sourceProcessor cannot be null or blank");
        }
        if (processorConfidence < 0.0 || processorConfidence > 1.0) {
            throw new IllegalArgumentException("processorConfidence must be in [0.0, 1.0]");
        }
        if (paragraphScore < 0.0 || paragraphScore > 1.0) {
            throw new IllegalArgumentException("paragraphScore must be in [0.0, 1.0]");
        }
        entityTags = entityTags == null ? List.of() : List.copyOf(entityTags);
    }

    public int wordCount() {
        return text.trim().split("\\s+").length;
    }
}
