package com.bookreader.nlp.extractor;

import com.bookreader.nlp.core.ProcessorConfig;
import org.jetbrains.annotations.NotNull;

/**
 * Cheap constructor of a named extractor; must not load any backend.
 */
@FunctionalInterface
public interface ExtractorConstructor {

    @NotNull
    DescriptionExtractor create(@NotNull ProcessorConfig config);
}
