package com.bookreader.nlp.enrich;

import com.bookreader.nlp.core.CompleteDescription;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Adds visual attributes (colors, lighting, mood, ...) to a high-scoring description.
 */
public interface DescriptionEnricher {

    /**
     * @return attributes to store as enrichment metadata
     * @throws EnrichmentException if the backend fails or answers with something unusable
     */
    @NotNull
    Map<String, Object> enrich(@NotNull CompleteDescription description);

    @NotNull
    String getName();
}
