package com.bookreader.nlp.registry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

import java.util.Map;
import java.util.Optional;

/**
 * Configuration of the description-extraction engine.
 *
 * <p>All properties are read from application.properties with the prefix {@code bookreader.nlp}.</p>
 *
 * <h2>Example:</h2>
 * <pre>{@code
 * bookreader.nlp.mode=ensemble
 * bookreader.nlp.default-processor=lexicon
 * bookreader.nlp.processors.names.weight=1.2
 * bookreader.nlp.processors.corenlp.enabled=false
 * }</pre>
 */
@ConfigMapping(prefix = "bookreader.nlp")
public interface DescriptionEngineConfig {

    /**
     * Mode used when the caller does not choose one.
     */
    @WithDefault("ensemble")
    String mode();

    @WithDefault("lexicon")
    String defaultProcessor();

    @WithDefault("3")
    @Min(1)
    int maxParallelProcessors();

    /**
     * Time budget of one extractor call over a chapter, in milliseconds.
     */
    @WithDefault("10000")
    @Min(1)
    long extractorTimeoutMs();

    Ensemble ensemble();

    Adaptive adaptive();

    Scoring scoring();

    Dedup dedup();

    Segmenter segmenter();

    Boundary boundary();

    Enrichment enrichment();

    /**
     * Per-extractor overrides keyed by extractor name. Unset values fall back to
     * the built-in defaults of that extractor.
     */
    Map<String, Processor> processors();

    interface Ensemble {

        @WithDefault("0.6")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        double votingThreshold();

        @WithDefault("0.5")
        @DecimalMin("0.0")
        double acceptanceFloor();
    }

    interface Adaptive {

        @WithDefault("0.8")
        double ensembleComplexity();

        @WithDefault("2")
        @Min(1)
        int parallelProcessorCount();

        @WithDefault("0.7")
        double complexSyntaxThreshold();

        @WithDefault("1000")
        int longTextChars();

        @WithDefault("names")
        String namesProcessor();

        @WithDefault("lexicon")
        String lexiconProcessor();

        @WithDefault("corenlp")
        String syntaxProcessor();
    }

    interface Scoring {

        @WithDefault("0.3")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        double minOverallScore();

        Weight weight();

        interface Weight {

            @WithDefault("0.30")
            double lexical();

            @WithDefault("0.25")
            double structural();

            @WithDefault("0.15")
            double entityDensity();

            @WithDefault("0.30")
            double typePriority();
        }
    }

    interface Dedup {

        /**
         * Spans overlapping by more than this share of the shorter span are the same description.
         */
        @WithDefault("0.5")
        double overlapRatio();
    }

    interface Segmenter {

        @WithName("phrase-extraction.enabled")
        @WithDefault("true")
        boolean phraseExtractionEnabled();

        @WithName("phrase-extraction.max-chars")
        @WithDefault("5000")
        @Min(1)
        int phraseMaxChars();
    }

    /**
     * Detection of descriptions that run over several paragraphs.
     */
    interface Boundary {

        @WithDefault("true")
        boolean enabled();

        /**
         * Paragraphs examined after a start paragraph.
         */
        @WithDefault("20")
        @Min(1)
        int lookahead();

        @WithDefault("500")
        @Min(1)
        int minChars();

        @WithDefault("4000")
        @Min(1)
        int maxChars();

        @WithDefault("0.3")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        double minCoherence();
    }

    interface Enrichment {

        @WithDefault("false")
        boolean enabled();

        @WithDefault("0.6")
        double scoreGate();

        @WithDefault("15000")
        @Min(1)
        long timeoutMs();

        Optional<String> apiKey();

        @WithDefault("google/gemini-2.0-flash-001")
        String model();

        @WithDefault("0.2")
        double temperature();

        @WithDefault("800")
        int maxTokens();
    }

    interface Processor {

        Optional<Boolean> enabled();

        Optional<Double> weight();

        Optional<Double> confidenceThreshold();

        Optional<Integer> minDescriptionLength();

        Optional<Integer> maxDescriptionLength();

        Optional<Integer> minWordCount();

        Optional<String> model();
    }

    /**
     * Validates cross-field constraints at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        Scoring.Weight w = scoring().weight();
        double weightSum = w.lexical() + w.structural() + w.entityDensity() + w.typePriority();
        if (Math.abs(weightSum - 1.0) > 0.01) {
            throw new IllegalArgumentException(String.format(
                "Scoring weights must sum to 1.0 (current sum: %.3f). " +
                "Check bookreader.nlp.scoring.weight.* properties.", weightSum));
        }
        if (adaptive().ensembleComplexity() < 0.0 || adaptive().ensembleComplexity() > 1.0) {
            throw new IllegalArgumentException(String.format(
                "adaptive.ensemble-complexity must be in [0.0, 1.0] (current: %.2f)",
                adaptive().ensembleComplexity()));
        }
        if (dedup().overlapRatio() < 0.0 || dedup().overlapRatio() > 1.0) {
            throw new IllegalArgumentException(String.format(
                "dedup.overlap-ratio must be in [0.0, 1.0] (current: %.2f)", dedup().overlapRatio()));
        }
    }
}
