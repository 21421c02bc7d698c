package com.bookreader.nlp.strategy;

import com.bookreader.nlp.EngineContext;
import com.bookreader.nlp.core.ProcessingMode;
import org.jetbrains.annotations.NotNull;

/**
 * Orchestrates how active extractors are invoked for one chapter.
 *
 * <p>Implementations are stateless; everything they need comes from the job and the context,
 * so one instance per mode is shared by all requests.</p>
 */
public interface ProcessingStrategy {

    /**
     * Runs extractors over the job's eligible paragraphs and returns scored, filtered and
     * ordered descriptions.
     *
     * @throws com.bookreader.nlp.core.ExtractionCancelledException if the job's token is cancelled
     */
    @NotNull
    StrategyResult process(@NotNull ExtractionJob job, @NotNull EngineContext context);

    @NotNull
    ProcessingMode getMode();
}
