package com.bookreader.nlp.core;

import java.util.Optional;

/**
 * Tunable state of one extractor, read-only at request time.
 *
 * @param enabled              whether the registry should build the extractor
 * @param weight               relative reliability used by the voter, &gt; 0
 * @param confidenceThreshold  candidates below this confidence are dropped
 * @param minDescriptionLength minimum candidate length in characters
 * @param maxDescriptionLength maximum candidate length in characters
 * @param minWordCount         minimum candidate length in words
 * @param model                optional backend model hint
 */
public record ProcessorConfig(
    boolean enabled,
    double weight,
    double confidenceThreshold,
    int minDescriptionLength,
    int maxDescriptionLength,
    int minWordCount,
    Optional<String> model
) {

    public static final double DEFAULT_WEIGHT = 1.0;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.3;
    public static final int DEFAULT_MIN_LENGTH = 50;
    public static final int DEFAULT_MAX_LENGTH = 1000;
    public static final int DEFAULT_MIN_WORDS = 10;

    public ProcessorConfig {
        if (!(weight > 0.0)) {
            throw new IllegalArgumentException("weight must be > 0, got: " + weight);
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0.0, 1.0]");
        }
        if (minDescriptionLength < 0) {
            throw new IllegalArgumentException("minDescriptionLength must be >= 0");
        }
        if (maxDescriptionLength < minDescriptionLength) {
            throw new IllegalArgumentException(String.format(
                "maxDescriptionLength (%d) must be >= minDescriptionLength (%d)",
                maxDescriptionLength, minDescriptionLength));
        }
        if (minWordCount < 0) {
            throw new IllegalArgumentException("minWordCount must be >= 0");
        }
        model = model == null ? Optional.empty() : model;
    }

    public static ProcessorConfig defaults() {
        return new ProcessorConfig(true, DEFAULT_WEIGHT, DEFAULT_CONFIDENCE_THRESHOLD,
            DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH, DEFAULT_MIN_WORDS, Optional.empty());
    }

    public ProcessorConfig withEnabled(boolean value) {
        return new ProcessorConfig(value, weight, confidenceThreshold, minDescriptionLength,
            maxDescriptionLength, minWordCount, model);
    }

    public ProcessorConfig withWeight(double value) {
        return new ProcessorConfig(enabled, value, confidenceThreshold, minDescriptionLength,
            maxDescriptionLength, minWordCount, model);
    }

    public ProcessorConfig withThresholds(double confidence, int minLength, int minWords) {
        return new ProcessorConfig(enabled, weight, confidence, minLength,
            Math.max(minLength, maxDescriptionLength), minWords, model);
    }
}
