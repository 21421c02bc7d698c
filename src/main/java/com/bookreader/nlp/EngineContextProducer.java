package com.bookreader.nlp;

import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.enrich.LlmDescriptionEnricher;
import com.bookreader.nlp.extractor.ExtractorCatalog;
import com.bookreader.nlp.llm.LlmFunction;
import com.bookreader.nlp.registry.DescriptionEngineConfig;
import com.bookreader.nlp.registry.ProcessorConfigLoader;
import com.bookreader.nlp.registry.ProcessorRegistry;
import com.bookreader.nlp.scoring.ConfidenceScorer;
import com.bookreader.nlp.segment.ParagraphSegmenter;
import com.bookreader.nlp.strategy.ExtractorRunner;
import com.bookreader.nlp.text.RussianLexicon;
import com.bookreader.nlp.text.RussianTextAnalyzer;
import com.bookreader.nlp.text.TextComplexityAnalyzer;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Builds the process-wide {@link EngineContext} at startup and closes it on shutdown.
 */
@ApplicationScoped
public class EngineContextProducer {

    private static final Logger LOG = Logger.getLogger(EngineContextProducer.class);

    @Inject
    ProcessorConfigLoader configLoader;

    @Inject
    DescriptionEngineConfig config;

    @Inject
    ExtractorCatalog catalog;

    @Inject
    ParagraphSegmenter segmenter;

    @Inject
    RussianTextAnalyzer analyzer;

    @Inject
    RussianLexicon lexicon;

    @Inject
    TextComplexityAnalyzer complexityAnalyzer;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Instance<LlmFunction> llmFunction;

    @Produces
    @Singleton
    public EngineContext engineContext() {
        EngineSettings settings = configLoader.settings();
        ProcessorRegistry registry = new ProcessorRegistry(catalog).initialize(configLoader.processorConfigs());

        EngineContext.Builder builder = EngineContext.builder()
            .settings(settings)
            .activeProcessors(registry.getActiveProcessors())
            .processorConfigs(registry.getProcessorConfigs())
            .processorStatus(registry.getStatus())
            .segmenter(segmenter)
            .runner(new ExtractorRunner(settings.maxParallelProcessors(), settings.extractorTimeoutMs()))
            .scorer(new ConfidenceScorer(analyzer, lexicon,
                settings.scoring().weights(), settings.scoring().minOverallScore()))
            .complexityAnalyzer(complexityAnalyzer);

        boolean hasApiKey = config.enrichment().apiKey().filter(k -> !k.isBlank()).isPresent();
        if (settings.enrichment().enabled() && hasApiKey) {
            builder.enricher(new LlmDescriptionEnricher(llmFunction.get(), objectMapper,
                settings.enrichment().timeoutMs()));
            LOG.infof("LLM enrichment enabled (gate=%.2f, model=%s)",
                settings.enrichment().scoreGate(), config.enrichment().model());
        } else if (settings.enrichment().enabled()) {
            LOG.warn("LLM enrichment is enabled but bookreader.nlp.enrichment.api-key is not set; enrichment disabled");
        } else {
            LOG.info("LLM enrichment disabled");
        }

        EngineContext context = builder.build();
        if (context.activeProcessors().isEmpty()) {
            LOG.error("No description processor could be loaded; extraction requests will fail");
        } else {
            LOG.infof("Description engine ready: mode=%s, processors=%s",
                settings.defaultMode().value(), context.activeProcessors().keySet());
        }
        return context;
    }

    void close(@Disposes EngineContext context) {
        LOG.info("Shutting down description engine");
        context.close();
    }
}
