package com.bookreader.nlp.strategy;

import com.bookreader.nlp.EngineContext;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.extractor.DescriptionExtractor;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs exactly one extractor: the requested one, else the configured default, else the first active.
 */
public class SingleStrategy extends AbstractProcessingStrategy {

    @Override
    @NotNull
    public StrategyResult process(@NotNull ExtractionJob job, @NotNull EngineContext context) {
        Map<String, DescriptionExtractor> candidates = selectExtractors(job, context);
        String requested = job.requestedProcessor().orElse(context.settings().defaultProcessor());
        String chosen = resolve(requested, candidates, context);

        Map<String, List<RawDescription>> output = withSpanningDescriptions(context.runner().runSequential(
            Map.of(chosen, candidates.get(chosen)),
            job.eligibleParagraphs(), job.token()), job, context);

        StrategyResult result = finish(mergeAndScore(output, context), List.of(chosen), context);
        if (job.requestedProcessor().isPresent() && !chosen.equals(requested)) {
            result = result.withRecommendation(
                "Processor '" + requested + "' is not available; used '" + chosen + "' instead.");
        }
        return result;
    }

    @Override
    @NotNull
    public ProcessingMode getMode() {
        return ProcessingMode.SINGLE;
    }

    private String resolve(String requested, Map<String, DescriptionExtractor> candidates, EngineContext context) {
        if (candidates.containsKey(requested)) {
            return requested;
        }
        String fallback = Optional.of(context.settings().defaultProcessor())
            .filter(candidates::containsKey)
            .orElseGet(() -> new ArrayList<>(candidates.keySet()).get(0));
        logger.warn("Processor '{}' is not active, falling back to '{}'", requested, fallback);
        return fallback;
    }
}
