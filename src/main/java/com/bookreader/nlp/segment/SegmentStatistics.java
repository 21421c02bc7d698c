package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.ParagraphType;

import java.util.Map;

/**
 * Summary of a segmentation run.
 *
 * @param totalParagraphs          paragraph count
 * @param typeCounts               paragraphs per type
 * @param averageDescriptiveness   mean descriptiveness score
 * @param averageLength            mean paragraph length in characters
 * @param descriptiveParagraphs    paragraphs typed DESCRIPTION or MIXED
 */
public record SegmentStatistics(
    int totalParagraphs,
    Map<ParagraphType, Integer> typeCounts,
    double averageDescriptiveness,
    double averageLength,
    int descriptiveParagraphs
) {

    public SegmentStatistics {
        typeCounts = Map.copyOf(typeCounts);
    }
}
