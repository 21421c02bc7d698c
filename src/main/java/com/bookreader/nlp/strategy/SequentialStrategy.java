package com.bookreader.nlp.strategy;

import com.bookreader.nlp.EngineContext;
import com.bookreader.nlp.core.ProcessingMode;
import com.bookreader.nlp.core.RawDescription;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the selected extractors one after another, in name order.
 */
public class SequentialStrategy extends AbstractProcessingStrategy {

    @Override
    @NotNull
    public StrategyResult process(@NotNull ExtractionJob job, @NotNull EngineContext context) {
        Map<String, List<RawDescription>> output = withSpanningDescriptions(context.runner().runSequential(
            selectExtractors(job, context), job.eligibleParagraphs(), job.token()), job, context);
        return finish(mergeAndScore(output, context), new ArrayList<>(output.keySet()), context);
    }

    @Override
    @NotNull
    public ProcessingMode getMode() {
        return ProcessingMode.SEQUENTIAL;
    }
}
