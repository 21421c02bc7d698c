package com.bookreader.nlp;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.enrich.DescriptionEnricher;
import com.bookreader.nlp.extractor.DescriptionExtractor;
import com.bookreader.nlp.registry.ProcessorStatus;
import com.bookreader.nlp.scoring.ConfidenceScorer;
import com.bookreader.nlp.segment.DescriptionBoundaryDetector;
import com.bookreader.nlp.segment.ParagraphSegmenter;
import com.bookreader.nlp.strategy.ExtractorRunner;
import com.bookreader.nlp.strategy.StrategyFactory;
import com.bookreader.nlp.text.TextComplexityAnalyzer;
import com.bookreader.nlp.voting.DescriptionMerger;
import com.bookreader.nlp.voting.EnsembleVoter;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Everything one extraction needs, built once at startup and shared by every request.
 *
 * <p>Holds the active extractors with their configs, the collaborators strategies call into and
 * the extractor pool. Closing the context shuts the pool down.</p>
 */
public final class EngineContext implements AutoCloseable {

    private final EngineSettings settings;
    private final Map<String, DescriptionExtractor> activeProcessors;
    private final Map<String, ProcessorConfig> processorConfigs;
    private final List<ProcessorStatus> processorStatus;
    private final ParagraphSegmenter segmenter;
    private final DescriptionBoundaryDetector boundaryDetector;
    private final ExtractorRunner runner;
    private final DescriptionMerger merger;
    private final EnsembleVoter voter;
    private final ConfidenceScorer scorer;
    private final TextComplexityAnalyzer complexityAnalyzer;
    private final StrategyFactory strategies;
    private final Optional<DescriptionEnricher> enricher;

    private EngineContext(Builder builder) {
        this.settings = Objects.requireNonNull(builder.settings, "settings must not be null");
        this.activeProcessors = Collections.unmodifiableMap(new TreeMap<>(builder.activeProcessors));
        this.processorConfigs = Map.copyOf(builder.processorConfigs);
        this.processorStatus = List.copyOf(builder.processorStatus);
        this.segmenter = Objects.requireNonNull(builder.segmenter, "segmenter must not be null");
        this.boundaryDetector = new DescriptionBoundaryDetector(settings.boundaries());
        this.runner = Objects.requireNonNull(builder.runner, "runner must not be null");
        this.scorer = Objects.requireNonNull(builder.scorer, "scorer must not be null");
        this.merger = builder.merger != null ? builder.merger : new DescriptionMerger(settings.overlapRatio());
        this.voter = builder.voter != null ? builder.voter : new EnsembleVoter(merger, scorer, settings.ensemble());
        this.complexityAnalyzer = Objects.requireNonNull(builder.complexityAnalyzer,
            "complexityAnalyzer must not be null");
        this.strategies = builder.strategies != null ? builder.strategies : new StrategyFactory();
        this.enricher = Optional.ofNullable(builder.enricher);
    }

    public static Builder builder() {
        return new Builder();
    }

    @NotNull
    public EngineSettings settings() {
        return settings;
    }

    /**
     * Loaded extractors keyed by name, in name order.
     */
    @NotNull
    public Map<String, DescriptionExtractor> activeProcessors() {
        return activeProcessors;
    }

    @NotNull
    public Map<String, ProcessorConfig> processorConfigs() {
        return processorConfigs;
    }

    @NotNull
    public List<ProcessorStatus> processorStatus() {
        return processorStatus;
    }

    @NotNull
    public ParagraphSegmenter segmenter() {
        return segmenter;
    }

    @NotNull
    public DescriptionBoundaryDetector boundaryDetector() {
        return boundaryDetector;
    }

    @NotNull
    public ExtractorRunner runner() {
        return runner;
    }

    @NotNull
    public DescriptionMerger merger() {
        return merger;
    }

    @NotNull
    public EnsembleVoter voter() {
        return voter;
    }

    @NotNull
    public ConfidenceScorer scorer() {
        return scorer;
    }

    @NotNull
    public TextComplexityAnalyzer complexityAnalyzer() {
        return complexityAnalyzer;
    }

    @NotNull
    public StrategyFactory strategies() {
        return strategies;
    }

    @NotNull
    public Optional<DescriptionEnricher> enricher() {
        return enricher;
    }

    @Override
    public void close() {
        runner.close();
    }

    public static final class Builder {
        private EngineSettings settings;
        private Map<String, DescriptionExtractor> activeProcessors = Map.of();
        private Map<String, ProcessorConfig> processorConfigs = Map.of();
        private List<ProcessorStatus> processorStatus = List.of();
        private ParagraphSegmenter segmenter;
        private ExtractorRunner runner;
        private DescriptionMerger merger;
        private EnsembleVoter voter;
        private ConfidenceScorer scorer;
        private TextComplexityAnalyzer complexityAnalyzer;
        private StrategyFactory strategies;
        private DescriptionEnricher enricher;

        private Builder() {
        }

        public Builder settings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder activeProcessors(Map<String, DescriptionExtractor> activeProcessors) {
            this.activeProcessors = activeProcessors;
            return this;
        }

        public Builder processorConfigs(Map<String, ProcessorConfig> processorConfigs) {
            this.processorConfigs = processorConfigs;
            return this;
        }

        public Builder processorStatus(List<ProcessorStatus> processorStatus) {
            this.processorStatus = processorStatus;
            return this;
        }

        public Builder segmenter(ParagraphSegmenter segmenter) {
            this.segmenter = segmenter;
            return this;
        }

        public Builder runner(ExtractorRunner runner) {
            this.runner = runner;
            return this;
        }

        public Builder merger(DescriptionMerger merger) {
            this.merger = merger;
            return this;
        }

        public Builder voter(EnsembleVoter voter) {
            this.voter = voter;
            return this;
        }

        public Builder scorer(ConfidenceScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder complexityAnalyzer(TextComplexityAnalyzer complexityAnalyzer) {
            this.complexityAnalyzer = complexityAnalyzer;
            return this;
        }

        public Builder strategies(StrategyFactory strategies) {
            this.strategies = strategies;
            return this;
        }

        public Builder enricher(DescriptionEnricher enricher) {
            this.enricher = enricher;
            return this;
        }

        public EngineContext build() {
            return new EngineContext(this);
        }
    }
}
