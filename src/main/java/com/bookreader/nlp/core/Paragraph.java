package com.bookreader.nlp.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A classified, scored paragraph of chapter text.
 *
 * @param index                position of the paragraph within the chapter (0-based)
 * @param text                 paragraph text, trimmed
 * @param startOffset          chapter offset of the first character
 * @param endOffset            chapter offset after the last character
 * @param type                 structural class
 * @param descriptivenessScore descriptiveness in [0.0, 1.0]
 * @param extractedPhrases     phrase patterns, empty when extraction was skipped or failed
 */
public record Paragraph(
    int index,
    String text,
    int startOffset,
    int endOffset,
    ParagraphType type,
    double descriptivenessScore,
    Map<PhraseKind, List<String>> extractedPhrases
) {

    public Paragraph {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                String.format("invalid paragraph offsets [%d, %d)", startOffset, endOffset));
        }
        if (descriptivenessScore < 0.0 || descriptivenessScore > 1.0) {
            throw new IllegalArgumentException("descriptivenessScore must be in [0.0, 1.0]");
        }
        extractedPhrases = copyPhrases(extractedPhrases);
    }

    public Paragraph(int index, String text, int startOffset, ParagraphType type, double descriptivenessScore) {
        this(index, text, startOffset, startOffset + text.length(), type, descriptivenessScore, Map.of());
    }

    public TextSpan span() {
        return new TextSpan(startOffset, endOffset);
    }

    public int wordCount() {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    public Paragraph withPhrases(Map<PhraseKind, List<String>> phrases) {
        return new Paragraph(index, text, startOffset, endOffset, type, descriptivenessScore, phrases);
    }

    private static Map<PhraseKind, List<String>> copyPhrases(Map<PhraseKind, List<String>> phrases) {
        if (phrases == null || phrases.isEmpty()) {
            return Map.of();
        }
        Map<PhraseKind, List<String>> copy = new EnumMap<>(PhraseKind.class);
        phrases.forEach((kind, values) -> copy.put(kind, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
