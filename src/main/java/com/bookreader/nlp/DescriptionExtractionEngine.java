package com.bookreader.nlp;

import com.bookreader.exception.ProcessorConfigurationException;
import com.bookreader.nlp.core.CancellationToken;
import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.ExtractionResult;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.enrich.EnrichmentStage;
import com.bookreader.nlp.registry.ProcessorStatus;
import com.bookreader.nlp.scoring.QualityAssessor;
import com.bookreader.nlp.strategy.ExtractionJob;
import com.bookreader.nlp.strategy.StrategyResult;
import com.bookreader.nlp.text.ChapterTextNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point: turns chapter text into ranked description candidates.
 *
 * <h2>Pipeline:</h2>
 * <ol>
 *   <li>Normalize the text and split it into typed paragraphs</li>
 *   <li>Run the processing strategy for the requested mode over non-dialogue paragraphs</li>
 *   <li>Merge, vote and score, dropping candidates under the minimum score</li>
 *   <li>Optionally enrich high-scoring candidates</li>
 * </ol>
 *
 * <p>Offsets in the result point into the normalized text.</p>
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>nlp.chapterId</code> - chapter being processed</li>
 *   <li><code>nlp.mode</code> - processing mode executed</li>
 * </ul>
 */
@ApplicationScoped
public class DescriptionExtractionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptionExtractionEngine.class);

    private static final String MDC_CHAPTER_ID = "nlp.chapterId";
    private static final String MDC_MODE = "nlp.mode";

    private final EngineContext context;
    private final EnrichmentStage enrichmentStage;

    @Inject
    public DescriptionExtractionEngine(EngineContext context) {
        this.context = context;
        this.enrichmentStage = new EnrichmentStage(context.enricher(), context.settings().enrichment().scoreGate());
    }

    /**
     * Extracts descriptions with a fresh, never-cancelled token.
     *
     * @see #extract(String, String, String, ProcessingMode, CancellationToken)
     */
    @NotNull
    public ExtractionResult extract(
        @Nullable String chapterText,
        @Nullable String chapterId,
        @Nullable String processorName,
        @Nullable ProcessingMode mode
    ) {
        return extract(chapterText, chapterId, processorName, mode, CancellationToken.create());
    }

    /**
     * Extracts descriptions from one chapter.
     *
     * @param chapterText   raw chapter text; blank text yields an empty result
     * @param chapterId     caller's identifier, echoed back
     * @param processorName extractor for Single mode; other modes ignore it
     * @param mode          processing mode, or {@code null} for the configured default
     * @param token         cancellation signal
     * @return ranked candidates with quality metrics
     * @throws ProcessorConfigurationException if no extractor is active
     * @throws com.bookreader.nlp.core.ExtractionCancelledException if {@code token} is cancelled
     */
    @NotNull
    public ExtractionResult extract(
        @Nullable String chapterText,
        @Nullable String chapterId,
        @Nullable String processorName,
        @Nullable ProcessingMode mode,
        @NotNull CancellationToken token
    ) {
        long start = System.nanoTime();
        ProcessingMode effectiveMode = mode != null ? mode : context.settings().defaultMode();
        if (context.activeProcessors().isEmpty()) {
            throw new ProcessorConfigurationException("No description processors are available");
        }

        try {
            setMDC(chapterId, effectiveMode);
            token.throwIfCancelled();

            String text = chapterText == null ? "" : ChapterTextNormalizer.normalize(chapterText);
            if (text.isBlank()) {
                LOG.debug("Empty chapter text, nothing to extract");
                return ExtractionResult.empty(chapterId, effectiveMode, elapsedSeconds(start));
            }

            List<Paragraph> paragraphs = context.segmenter().segment(text);
            if (paragraphs.isEmpty()) {
                return ExtractionResult.empty(chapterId, effectiveMode, elapsedSeconds(start));
            }

            ExtractionJob job = new ExtractionJob(
                chapterId,
                text,
                paragraphs,
                Optional.ofNullable(processorName).filter(name -> !name.isBlank()),
                List.of(),
                token
            );
            StrategyResult strategyResult = context.strategies().get(effectiveMode).process(job, context);
            token.throwIfCancelled();

            List<CompleteDescription> descriptions = enrichmentStage.apply(strategyResult.descriptions(), token);

            Map<String, Double> metrics = new LinkedHashMap<>(strategyResult.qualityMetrics());
            metrics.putAll(QualityAssessor.segmentationMetrics(context.segmenter().statistics(paragraphs)));

            ExtractionResult result = new ExtractionResult(
                chapterId,
                descriptions,
                strategyResult.processorsUsed(),
                metrics,
                strategyResult.recommendations(),
                elapsedSeconds(start),
                effectiveMode,
                paragraphs.size()
            );
            LOG.info("Extraction completed - paragraphs={}, descriptions={}, processors={}, time={}s",
                paragraphs.size(), descriptions.size(), result.processorsUsed(),
                String.format(Locale.ROOT, "%.3f", result.processingTime()));
            return result;
        } finally {
            clearMDC();
        }
    }

    @NotNull
    public List<ProcessorStatus> getProcessorStatus() {
        return context.processorStatus();
    }

    @NotNull
    public EngineContext getContext() {
        return context;
    }

    private static double elapsedSeconds(long startNanos) {
        return Math.max(0.0, (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }

    private void setMDC(String chapterId, ProcessingMode mode) {
        MDC.put(MDC_CHAPTER_ID, chapterId == null ? "-" : chapterId);
        MDC.put(MDC_MODE, mode.value());
    }

    private void clearMDC() {
        MDC.remove(MDC_CHAPTER_ID);
        MDC.remove(MDC_MODE);
    }
}
