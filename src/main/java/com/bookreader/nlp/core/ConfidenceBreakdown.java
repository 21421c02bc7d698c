package com.bookreader.nlp.core;

import java.util.Locale;

/**
 * Per-factor confidence signals of a description, each in [0.0, 1.0].
 *
 * @param lexical       density of descriptive adjectives and sensory words
 * @param structural    descriptiveness of the source paragraph
 * @param entityDensity tagged entities per 100 words, normalized
 * @param typePriority  static value of the description type
 */
public record ConfidenceBreakdown(
    double lexical,
    double structural,
    double entityDensity,
    double typePriority
) {

    public ConfidenceBreakdown {
        requireUnit(lexical, "lexical");
        requireUnit(structural, "structural");
        requireUnit(entityDensity, "entityDensity");
        requireUnit(typePriority, "typePriority");
    }

    private static void requireUnit(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
        }
    }

    public String toLogString() {
        return String.format(Locale.ROOT, "[L:%.2f S:%.2f E:%.2f T:%.2f]", lexical, structural, entityDensity, typePriority);
    }
}
