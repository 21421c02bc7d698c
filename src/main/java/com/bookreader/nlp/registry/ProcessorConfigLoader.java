package com.bookreader.nlp.registry;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.ScoringWeights;
import com.bookreader.nlp.extractor.CoreNlpDescriptionExtractor;
import com.bookreader.nlp.extractor.LexiconDescriptionExtractor;
import com.bookreader.nlp.extractor.ProperNameDescriptionExtractor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns {@link DescriptionEngineConfig} into immutable engine values, once, at startup.
 *
 * <p>Each built-in extractor has calibrated defaults; properties under
 * {@code bookreader.nlp.processors.<name>} override them field by field.</p>
 */
@ApplicationScoped
public class ProcessorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessorConfigLoader.class);

    static final Map<String, ProcessorConfig> BUILT_IN_DEFAULTS = Map.of(
        LexiconDescriptionExtractor.NAME,
        new ProcessorConfig(true, 1.0, 0.3, 20, 1000, 4, Optional.empty()),
        ProperNameDescriptionExtractor.NAME,
        new ProcessorConfig(true, 1.2, 0.4, 40, 1200, 8, Optional.empty()),
        CoreNlpDescriptionExtractor.NAME,
        new ProcessorConfig(false, 0.8, 0.5, 50, 1000, 10, Optional.of("english"))
    );

    private final DescriptionEngineConfig config;
    private volatile Map<String, ProcessorConfig> processorConfigs;
    private volatile EngineSettings settings;

    @Inject
    public ProcessorConfigLoader(DescriptionEngineConfig config) {
        this.config = config;
    }

    /**
     * Per-extractor configs, sorted by name.
     */
    @NotNull
    public Map<String, ProcessorConfig> processorConfigs() {
        Map<String, ProcessorConfig> loaded = processorConfigs;
        if (loaded == null) {
            loaded = toProcessorConfigs(config);
            processorConfigs = loaded;
            loaded.forEach((name, c) -> LOG.info(
                "Processor '{}': enabled={}, weight={}, threshold={}, length=[{}, {}], minWords={}",
                name, c.enabled(), c.weight(), c.confidenceThreshold(),
                c.minDescriptionLength(), c.maxDescriptionLength(), c.minWordCount()));
        }
        return loaded;
    }

    @Produces
    @Singleton
    @NotNull
    public EngineSettings settings() {
        EngineSettings loaded = settings;
        if (loaded == null) {
            loaded = toSettings(config);
            settings = loaded;
        }
        return loaded;
    }

    @NotNull
    static Map<String, ProcessorConfig> toProcessorConfigs(@NotNull DescriptionEngineConfig config) {
        Map<String, ProcessorConfig> result = new TreeMap<>(BUILT_IN_DEFAULTS);
        config.processors().forEach((name, overrides) -> {
            ProcessorConfig base = BUILT_IN_DEFAULTS.getOrDefault(name, ProcessorConfig.defaults());
            result.put(name, merge(base, overrides));
        });
        return Collections.unmodifiableMap(result);
    }

    @NotNull
    static EngineSettings toSettings(@NotNull DescriptionEngineConfig config) {
        config.validate();
        ProcessingMode mode = ProcessingMode.fromString(config.mode(), ProcessingMode.ENSEMBLE);
        if (!mode.value().equalsIgnoreCase(config.mode().trim())) {
            LOG.warn("Unknown processing mode '{}', falling back to {}", config.mode(), mode);
        }
        DescriptionEngineConfig.Scoring.Weight w = config.scoring().weight();
        DescriptionEngineConfig.Adaptive adaptive = config.adaptive();
        DescriptionEngineConfig.Enrichment enrichment = config.enrichment();
        DescriptionEngineConfig.Boundary boundary = config.boundary();

        return new EngineSettings(
            mode,
            config.defaultProcessor(),
            config.maxParallelProcessors(),
            config.extractorTimeoutMs(),
            config.dedup().overlapRatio(),
            new EngineSettings.Ensemble(config.ensemble().votingThreshold(), config.ensemble().acceptanceFloor()),
            new EngineSettings.Adaptive(
                adaptive.ensembleComplexity(),
                adaptive.parallelProcessorCount(),
                adaptive.complexSyntaxThreshold(),
                adaptive.longTextChars(),
                adaptive.namesProcessor(),
                adaptive.lexiconProcessor(),
                adaptive.syntaxProcessor()
            ),
            new EngineSettings.Scoring(
                new ScoringWeights(w.lexical(), w.structural(), w.entityDensity(), w.typePriority()),
                config.scoring().minOverallScore()
            ),
            new EngineSettings.Segmentation(
                config.segmenter().phraseExtractionEnabled(),
                config.segmenter().phraseMaxChars()
            ),
            new EngineSettings.Boundaries(
                boundary.enabled(),
                boundary.lookahead(),
                boundary.minChars(),
                boundary.maxChars(),
                boundary.minCoherence()
            ),
            new EngineSettings.Enrichment(enrichment.enabled(), enrichment.scoreGate(), enrichment.timeoutMs())
        );
    }

    private static ProcessorConfig merge(ProcessorConfig base, DescriptionEngineConfig.Processor overrides) {
        int minLength = overrides.minDescriptionLength().orElse(base.minDescriptionLength());
        return new ProcessorConfig(
            overrides.enabled().orElse(base.enabled()),
            overrides.weight().orElse(base.weight()),
            overrides.confidenceThreshold().orElse(base.confidenceThreshold()),
            minLength,
            overrides.maxDescriptionLength().orElse(Math.max(minLength, base.maxDescriptionLength())),
            overrides.minWordCount().orElse(base.minWordCount()),
            overrides.model().or(base::model)
        );
    }
}
