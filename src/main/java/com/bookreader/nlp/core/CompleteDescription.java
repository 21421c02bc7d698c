package com.bookreader.nlp.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fused, scored description candidate returned to the caller.
 *
 * <p>{@code overallScore} is always the weighted sum of {@code confidenceBreakdown}
 * computed by the scorer; instances are never re-scored in place.</p>
 */
public record CompleteDescription(
    String text,
    DescriptionType descriptionType,
    int chapterOffset,
    int chapterEndOffset,
    ConfidenceBreakdown confidenceBreakdown,
    double overallScore,
    double consensusStrength,
    List<String> contributingProcessors,
    List<EntityTag> entities,
    int wordCount,
    Map<String, Object> enrichmentMetadata
) {

    public CompleteDescription {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text cannot be null or blank");
        }
        Objects.requireNonNull(descriptionType, "descriptionType must not be null");
        Objects.requireNonNull(confidenceBreakdown, "confidenceBreakdown must not be null");
        if (chapterOffset < 0 || chapterEndOffset < chapterOffset) {
            throw new IllegalArgumentException(
                String.format("invalid chapter offsets [%d, %d)", chapterOffset, chapterEndOffset));
        }
        if (overallScore < 0.0 || overallScore > 1.0) {
            throw new IllegalArgumentException("overallScore must be in [0.0, 1.0]");
        }
        if (consensusStrength < 0.0 || consensusStrength > 1.0) {
            throw new IllegalArgumentException("consensusStrength must be in [0.0, 1.0]");
        }
        contributingProcessors = List.copyOf(contributingProcessors);
        entities = entities == null ? List.of() : List.copyOf(entities);
        enrichmentMetadata = enrichmentMetadata == null ? Map.of() : Map.copyOf(enrichmentMetadata);
    }

    public TextSpan span() {
        return new TextSpan(chapterOffset, chapterEndOffset);
    }

    public CompleteDescription withEnrichment(Map<String, Object> metadata) {
        return new CompleteDescription(text, descriptionType, chapterOffset, chapterEndOffset,
            confidenceBreakdown, overallScore, consensusStrength, contributingProcessors,
            entities, wordCount, metadata);
    }
}
