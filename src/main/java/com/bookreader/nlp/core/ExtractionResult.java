package com.bookreader.nlp.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one {@code extract} call.
 *
 * @param chapterId      caller's chapter identifier
 * @param descriptions   candidates ordered by descending overall score, then type priority
 * @param processorsUsed extractors that actually ran
 * @param qualityMetrics aggregate quality signals
 * @param recommendations human-readable tuning hints
 * @param processingTime wall-clock seconds spent, &gt;= 0
 * @param mode           mode that was executed
 * @param paragraphCount paragraphs produced by the segmenter
 */
public record ExtractionResult(
    String chapterId,
    List<CompleteDescription> descriptions,
    List<String> processorsUsed,
    Map<String, Double> qualityMetrics,
    List<String> recommendations,
    double processingTime,
    ProcessingMode mode,
    int paragraphCount
) {

    public ExtractionResult {
        Objects.requireNonNull(mode, "mode must not be null");
        descriptions = List.copyOf(descriptions);
        processorsUsed = List.copyOf(processorsUsed);
        qualityMetrics = Map.copyOf(qualityMetrics);
        recommendations = List.copyOf(recommendations);
        if (processingTime < 0.0) {
            throw new IllegalArgumentException("processingTime must be >= 0");
        }
    }

    public static ExtractionResult empty(String chapterId, ProcessingMode mode, double processingTime) {
        return new ExtractionResult(chapterId, List.of(), List.of(), Map.of(), List.of(),
            processingTime, mode, 0);
    }

    public ExtractionResult withDescriptions(List<CompleteDescription> selected) {
        return new ExtractionResult(chapterId, selected, processorsUsed, qualityMetrics, recommendations,
            processingTime, mode, paragraphCount);
    }

    public boolean isEmpty() {
        return descriptions.isEmpty();
    }
}
