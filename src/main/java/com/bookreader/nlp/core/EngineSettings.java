package com.bookreader.nlp.core;

import java.util.Objects;

/**
 * Engine-wide tuning, read once at startup.
 *
 * <p>The adaptive and ensemble thresholds are empirical and kept configurable so they can be
 * recalibrated against a labeled corpus.</p>
 */
public record EngineSettings(
    ProcessingMode defaultMode,
    String defaultProcessor,
    int maxParallelProcessors,
    long extractorTimeoutMs,
    double overlapRatio,
    Ensemble ensemble,
    Adaptive adaptive,
    Scoring scoring,
    Segmentation segmentation,
    Boundaries boundaries,
    Enrichment enrichment
) {

    /**
     * @param votingThreshold share of active extractors that makes a group a consensus
     * @param acceptanceFloor weighted confidence above which a single extractor is trusted
     */
    public record Ensemble(double votingThreshold, double acceptanceFloor) {
        public Ensemble {
            requireUnit(votingThreshold, "ensemble.voting-threshold");
            if (acceptanceFloor < 0.0) {
                throw new IllegalArgumentException("ensemble.acceptance-floor must be >= 0");
            }
        }
    }

    /**
     * @param ensembleComplexity      complexity above which Ensemble is used
     * @param parallelProcessorCount  selected extractor count that maps to Parallel
     * @param complexSyntaxThreshold  complexity above which the syntax-heavy extractor is added
     * @param longTextChars           length above which the lexicon extractor is added
     * @param namesProcessor          extractor added when person names are present
     * @param lexiconProcessor        extractor added for long texts
     * @param syntaxProcessor         extractor added for complex syntax
     */
    public record Adaptive(
        double ensembleComplexity,
        int parallelProcessorCount,
        double complexSyntaxThreshold,
        int longTextChars,
        String namesProcessor,
        String lexiconProcessor,
        String syntaxProcessor
    ) {
        public Adaptive {
            requireUnit(ensembleComplexity, "adaptive.ensemble-complexity");
            requireUnit(complexSyntaxThreshold, "adaptive.complex-syntax-threshold");
            if (parallelProcessorCount < 1) {
                throw new IllegalArgumentException("adaptive.parallel-processor-count must be >= 1");
            }
        }
    }

    /**
     * @param weights         factor weights
     * @param minOverallScore candidates scoring below this are dropped
     */
    public record Scoring(ScoringWeights weights, double minOverallScore) {
        public Scoring {
            Objects.requireNonNull(weights, "weights must not be null");
            requireUnit(minOverallScore, "scoring.min-overall-score");
        }
    }

    /**
     * @param phraseExtractionEnabled whether syntactic phrases are collected
     * @param phraseMaxChars          phrase extraction only looks at this many leading characters
     */
    public record Segmentation(boolean phraseExtractionEnabled, int phraseMaxChars) {
        public Segmentation {
            if (phraseMaxChars <= 0) {
                throw new IllegalArgumentException("segmenter.phrase-max-chars must be > 0");
            }
        }
    }

    /**
     * Multi-paragraph description detection.
     *
     * @param enabled            whether spanning descriptions are detected at all
     * @param lookahead          paragraphs examined after a start paragraph
     * @param minChars           shortest accepted span
     * @param maxChars           longest accepted span
     * @param minCoherence       a paragraph joins the span only at or above this coherence
     */
    public record Boundaries(boolean enabled, int lookahead, int minChars, int maxChars, double minCoherence) {
        public Boundaries {
            if (lookahead < 1) {
                throw new IllegalArgumentException("boundary.lookahead must be >= 1");
            }
            if (minChars < 1 || maxChars < minChars) {
                throw new IllegalArgumentException(
                    "boundary.min-chars must be >= 1 and not above boundary.max-chars, got: " + minChars + ".." + maxChars);
            }
            requireUnit(minCoherence, "boundary.min-coherence");
        }

        public static Boundaries defaults() {
            return new Boundaries(true, 20, 500, 4000, 0.3);
        }
    }

    /**
     * @param enabled   whether the enricher should be built at all
     * @param scoreGate minimum overall score for enrichment
     * @param timeoutMs per-candidate time budget
     */
    public record Enrichment(boolean enabled, double scoreGate, long timeoutMs) {
        public Enrichment {
            requireUnit(scoreGate, "enrichment.score-gate");
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("enrichment.timeout-ms must be > 0");
            }
        }
    }

    public EngineSettings {
        Objects.requireNonNull(defaultMode, "defaultMode must not be null");
        if (defaultProcessor == null || defaultProcessor.isBlank()) {
            throw new IllegalArgumentException("defaultProcessor cannot be null or blank");
        }
        if (maxParallelProcessors < 1) {
            throw new IllegalArgumentException("max-parallel-processors must be >= 1");
        }
        if (extractorTimeoutMs <= 0) {
            throw new IllegalArgumentException("extractor-timeout-ms must be > 0");
        }
        requireUnit(overlapRatio, "dedup.overlap-ratio");
        Objects.requireNonNull(ensemble, "ensemble must not be null");
        Objects.requireNonNull(adaptive, "adaptive must not be null");
        Objects.requireNonNull(scoring, "scoring must not be null");
        Objects.requireNonNull(segmentation, "segmentation must not be null");
        Objects.requireNonNull(boundaries, "boundaries must not be null");
        Objects.requireNonNull(enrichment, "enrichment must not be null");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
            ProcessingMode.ENSEMBLE,
            "lexicon",
            3,
            10_000L,
            0.5,
            new Ensemble(0.6, 0.5),
            new Adaptive(0.8, 2, 0.7, 1000, "names", "lexicon", "corenlp"),
            new Scoring(ScoringWeights.DEFAULT, 0.3),
            new Segmentation(true, 5000),
            Boundaries.defaults(),
            new Enrichment(false, 0.6, 15_000L)
        );
    }

    public EngineSettings withDefaultMode(ProcessingMode mode) {
        return new EngineSettings(mode, defaultProcessor, maxParallelProcessors, extractorTimeoutMs,
            overlapRatio, ensemble, adaptive, scoring, segmentation, boundaries, enrichment);
    }

    public EngineSettings withExtractorTimeoutMs(long timeoutMs) {
        return new EngineSettings(defaultMode, defaultProcessor, maxParallelProcessors, timeoutMs,
            overlapRatio, ensemble, adaptive, scoring, segmentation, boundaries, enrichment);
    }

    public EngineSettings withScoring(Scoring value) {
        return new EngineSettings(defaultMode, defaultProcessor, maxParallelProcessors, extractorTimeoutMs,
            overlapRatio, ensemble, adaptive, value, segmentation, boundaries, enrichment);
    }

    public EngineSettings withEnrichment(Enrichment value) {
        return new EngineSettings(defaultMode, defaultProcessor, maxParallelProcessors, extractorTimeoutMs,
            overlapRatio, ensemble, adaptive, scoring, segmentation, boundaries, value);
    }

    public EngineSettings withBoundaries(Boundaries value) {
        return new EngineSettings(defaultMode, defaultProcessor, maxParallelProcessors, extractorTimeoutMs,
            overlapRatio, ensemble, adaptive, scoring, segmentation, value, enrichment);
    }

    private static void requireUnit(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
        }
    }
}
