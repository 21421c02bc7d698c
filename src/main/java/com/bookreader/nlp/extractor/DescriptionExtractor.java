package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.ProcessorConfig;
import com.bookreader.nlp.core.RawDescription;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * A linguistic backend that proposes description candidates from paragraphs.
 *
 * <p>Construction is cheap; the backend is loaded by {@link #ensureLoaded()} on first use.
 * Implementations are process-wide singletons and must be safe for concurrent
 * {@link #extract(Paragraph)} calls once loaded.</p>
 */
public interface DescriptionExtractor {

    /**
     * Fixed identifier recorded as {@code sourceProcessor} on every candidate.
     */
    @NotNull
    String getName();

    @NotNull
    ProcessorConfig getConfig();

    /**
     * Loads the backend once. Later calls return immediately, or rethrow the recorded failure.
     *
     * @throws ExtractorUnavailableException if the backend cannot be loaded
     */
    void ensureLoaded();

    boolean isLoaded();

    /**
     * Failure message recorded by {@link #ensureLoaded()}, if loading failed.
     */
    @NotNull
    Optional<String> getLoadError();

    /**
     * Proposes candidates for one paragraph, already filtered by the processor thresholds.
     *
     * @throws ExtractorUnavailableException if the backend cannot be loaded
     */
    @NotNull
    List<RawDescription> extract(@NotNull Paragraph paragraph);
}
