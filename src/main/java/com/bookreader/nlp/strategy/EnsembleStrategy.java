package com.bookreader.nlp.strategy;

import com.bookreader.nlp.EngineContext;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.voting.VoteOutcome;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the selected extractors concurrently and keeps only groups that pass the weighted vote.
 */
public class EnsembleStrategy extends AbstractProcessingStrategy {

    @Override
    @NotNull
    public StrategyResult process(@NotNull ExtractionJob job, @NotNull EngineContext context) {
        Map<String, List<RawDescription>> output = withSpanningDescriptions(context.runner().runParallel(
            selectExtractors(job, context), job.eligibleParagraphs(), job.token()), job, context);
        VoteOutcome outcome = context.voter().vote(output, context.processorConfigs());
        if (outcome.rejectedGroups() > 0) {
            logger.debug("Ensemble rejected {} of {} groups", outcome.rejectedGroups(),
                outcome.rejectedGroups() + outcome.accepted().size());
        }
        return finish(outcome.accepted(), new ArrayList<>(output.keySet()), context);
    }

    @Override
    @NotNull
    public ProcessingMode getMode() {
        return ProcessingMode.ENSEMBLE;
    }
}
