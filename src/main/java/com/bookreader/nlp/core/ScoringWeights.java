package com.bookreader.nlp.core;

/**
 * Weights of the confidence factors; they must sum to 1.0.
 */
public record ScoringWeights(double lexical, double structural, double entityDensity, double typePriority) {

    private static final double SUM_TOLERANCE = 0.01;

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.30, 0.25, 0.15, 0.30);

    public ScoringWeights {
        if (lexical < 0.0 || structural < 0.0 || entityDensity < 0.0 || typePriority < 0.0) {
            throw new IllegalArgumentException("scoring weights must be non-negative");
        }
        double sum = lexical + structural + entityDensity + typePriority;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(String.format(
                "Scoring weights must sum to 1.0 (current sum: %.3f). " +
                "lexical=%.2f, structural=%.2f, entity-density=%.2f, type-priority=%.2f",
                sum, lexical, structural, entityDensity, typePriority));
        }
    }
}
