package com.bookreader.nlp.strategy;

import com.bookreader.nlp.EngineContext;
import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.core.DescriptionGroup;
import com.bookreader.nlp.core.DescriptionType;
import com.bookreader.nlp.core.EntityTag;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.extractor.DescriptionExtractor;
import com.bookreader.nlp.scoring.DescriptionRanking;
import com.bookreader.nlp.scoring.QualityAssessor;
import com.bookreader.nlp.segment.DescriptionBoundary;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared scoring and finishing steps of the processing strategies.
 */
public abstract class AbstractProcessingStrategy implements ProcessingStrategy {

    protected static final Logger logger = LoggerFactory.getLogger(AbstractProcessingStrategy.class);

    /**
     * Active extractors the job asks for, in name order. An empty or fully unknown subset
     * selects every active extractor.
     */
    protected Map<String, DescriptionExtractor> selectExtractors(
        @NotNull ExtractionJob job,
        @NotNull EngineContext context
    ) {
        Map<String, DescriptionExtractor> active = context.activeProcessors();
        if (job.processors().isEmpty()) {
            return active;
        }
        Map<String, DescriptionExtractor> selected = new LinkedHashMap<>();
        active.forEach((name, extractor) -> {
            if (job.processors().contains(name)) {
                selected.put(name, extractor);
            }
        });
        if (selected.isEmpty()) {
            logger.warn("None of the requested processors {} is active, using all of {}",
                job.processors(), active.keySet());
            return active;
        }
        return selected;
    }

    /**
     * Adds, for every multi-paragraph run, one candidate per extractor that found descriptions
     * inside it. The candidate covers the whole run, so merging folds the contained ones into it.
     */
    protected Map<String, List<RawDescription>> withSpanningDescriptions(
        @NotNull Map<String, List<RawDescription>> perProcessor,
        @NotNull ExtractionJob job,
        @NotNull EngineContext context
    ) {
        List<DescriptionBoundary> runs = context.boundaryDetector().detect(job.paragraphs()).stream()
            .filter(run -> run.paragraphCount() > 1)
            .toList();
        if (runs.isEmpty()) {
            return perProcessor;
        }
        Map<String, List<RawDescription>> extended = new LinkedHashMap<>();
        perProcessor.forEach((name, descriptions) -> {
            List<RawDescription> withRuns = new ArrayList<>(descriptions);
            for (DescriptionBoundary run : runs) {
                spanning(name, descriptions, run, job.text()).ifPresent(withRuns::add);
            }
            extended.put(name, withRuns);
        });
        logger.debug("Chapter {}: {} multi-paragraph runs", job.chapterId(), runs.size());
        return extended;
    }

    private static Optional<RawDescription> spanning(
        String processor,
        List<RawDescription> descriptions,
        DescriptionBoundary run,
        String text
    ) {
        List<RawDescription> inside = descriptions.stream()
            .filter(d -> run.contains(d.span()))
            .toList();
        if (inside.isEmpty()) {
            return Optional.empty();
        }
        Map<DescriptionType, Integer> votes = new EnumMap<>(DescriptionType.class);
        Set<EntityTag> tags = new LinkedHashSet<>();
        double best = 0.0;
        for (RawDescription description : inside) {
            votes.merge(description.descriptionType(), 1, Integer::sum);
            tags.addAll(description.entityTags());
            best = Math.max(best, description.processorConfidence());
        }
        DescriptionType type = votes.entrySet().stream()
            .max(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElseThrow();
        double confidence = Math.min(1.0, best * (0.5 + 0.5 * run.boundaryConfidence()));
        return Optional.of(new RawDescription(
            text.substring(run.span().start(), run.span().end()),
            run.span(),
            type,
            new ArrayList<>(tags),
            processor,
            confidence,
            run.startIndex(),
            run.averageDescriptiveness()
        ));
    }

    /**
     * Merges overlapping output without voting and scores every group.
     */
    protected List<CompleteDescription> mergeAndScore(
        @NotNull Map<String, List<RawDescription>> perProcessor,
        @NotNull EngineContext context
    ) {
        int active = Math.max(1, perProcessor.size());
        List<RawDescription> all = perProcessor.values().stream()
            .flatMap(List::stream)
            .toList();
        List<CompleteDescription> scored = new ArrayList<>();
        for (DescriptionGroup group : context.merger().group(all)) {
            scored.add(context.scorer().score(group, (double) group.processors().size() / active));
        }
        return scored;
    }

    /**
     * Drops low scores, orders the rest and attaches quality metrics.
     */
    protected StrategyResult finish(
        @NotNull List<CompleteDescription> scored,
        @NotNull List<String> processorsUsed,
        @NotNull EngineContext context
    ) {
        List<CompleteDescription> kept = DescriptionRanking.sort(scored.stream()
            .filter(context.scorer()::passes)
            .toList());
        Map<String, Double> metrics = QualityAssessor.metrics(kept, processorsUsed);
        List<String> recommendations = QualityAssessor.recommendations(metrics, processorsUsed);

        logger.debug("{} finished: candidates={}, kept={}, processors={}",
            getMode(), scored.size(), kept.size(), processorsUsed);
        return new StrategyResult(kept, processorsUsed, metrics, recommendations);
    }
}
