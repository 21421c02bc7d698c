package com.bookreader.nlp.strategy;

import com.bookreader.nlp.EngineContext;
import com.bookreader.nlp.core.EngineSettings;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.text.TextComplexityAnalyzer.TextProfile;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks extractors and a delegate mode from measured text complexity.
 *
 * <ul>
 *   <li>names extractor when confident person names occur</li>
 *   <li>lexicon extractor for long texts</li>
 *   <li>syntax extractor for complex sentences</li>
 * </ul>
 * <p>High complexity or more than the parallel count of extractors delegates to Ensemble, exactly
 * the parallel count to Parallel, anything else to Single.</p>
 */
public class AdaptiveStrategy extends AbstractProcessingStrategy {

    /**
     * Extractors and delegate mode chosen for a text.
     */
    public record Plan(List<String> processors, ProcessingMode delegate, double complexity) {
        public Plan {
            processors = List.copyOf(processors);
        }
    }

    @Override
    @NotNull
    public StrategyResult process(@NotNull ExtractionJob job, @NotNull EngineContext context) {
        Plan plan = plan(context.complexityAnalyzer().profile(job.text()), context);
        logger.info("Adaptive plan: delegate={}, processors={}, complexity={}",
            plan.delegate(), plan.processors(), String.format(Locale.ROOT, "%.2f", plan.complexity()));

        ProcessingStrategy delegate = context.strategies().get(plan.delegate());
        ExtractionJob narrowed = job.withProcessors(plan.processors());
        if (plan.delegate() == ProcessingMode.SINGLE) {
            narrowed = new ExtractionJob(job.chapterId(), job.text(), job.paragraphs(),
                plan.processors().stream().findFirst(), plan.processors(), job.token());
        }
        return delegate.process(narrowed, context).withRecommendation(String.format(Locale.ROOT,
            "Adaptive mode selected %s (complexity: %.2f)", plan.delegate(), plan.complexity()));
    }

    /**
     * Decides extractors and delegate mode. Only active extractors are ever selected.
     */
    @NotNull
    public Plan plan(@NotNull TextProfile profile, @NotNull EngineContext context) {
        EngineSettings.Adaptive adaptive = context.settings().adaptive();
        Set<String> active = context.activeProcessors().keySet();

        Set<String> selected = new LinkedHashSet<>();
        if (profile.hasPersonNames()) {
            selected.add(adaptive.namesProcessor());
        }
        if (profile.length() > adaptive.longTextChars()) {
            selected.add(adaptive.lexiconProcessor());
        }
        if (profile.complexity() > adaptive.complexSyntaxThreshold()) {
            selected.add(adaptive.syntaxProcessor());
        }
        selected.retainAll(active);
        if (selected.isEmpty()) {
            String fallback = active.contains(context.settings().defaultProcessor())
                ? context.settings().defaultProcessor()
                : active.iterator().next();
            selected.add(fallback);
        }

        ProcessingMode delegate;
        if (profile.complexity() > adaptive.ensembleComplexity()
            || selected.size() > adaptive.parallelProcessorCount()) {
            delegate = ProcessingMode.ENSEMBLE;
        } else if (selected.size() == adaptive.parallelProcessorCount()) {
            delegate = ProcessingMode.PARALLEL;
        } else {
            delegate = ProcessingMode.SINGLE;
        }
        return new Plan(new ArrayList<>(selected), delegate, profile.complexity());
    }

    @Override
    @NotNull
    public ProcessingMode getMode() {
        return ProcessingMode.ADAPTIVE;
    }
}
