package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.TextSpan;

import java.util.Objects;

/**
 * A run of consecutive paragraphs that reads as one description.
 *
 * @param startIndex             index of the first paragraph
 * @param endIndex               index of the last paragraph, inclusive
 * @param span                   chapter offsets from the first paragraph's start to the last one's end
 * @param charLength             summed paragraph lengths, separators excluded
 * @param coherence              mean coherence of consecutive paragraph pairs, 1.0 for a single paragraph
 * @param boundaryConfidence     how cleanly the run starts and ends, in [0.0, 1.0]
 * @param averageDescriptiveness mean descriptiveness of the paragraphs
 */
public record DescriptionBoundary(
    int startIndex,
    int endIndex,
    TextSpan span,
    int charLength,
    double coherence,
    double boundaryConfidence,
    double averageDescriptiveness
) {

    public DescriptionBoundary {
        Objects.requireNonNull(span, "span must not be null");
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException(
                String.format("invalid paragraph range [%d, %d]", startIndex, endIndex));
        }
    }

    public int paragraphCount() {
        return endIndex - startIndex + 1;
    }

    public boolean contains(TextSpan other) {
        return other.start() >= span.start() && other.end() <= span.end();
    }
}
