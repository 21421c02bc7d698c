package com.bookreader.nlp.segment;

import com.bookreader.nlp.core.PhraseKind;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Collects syntactic phrase patterns from descriptive text.
 * Implementations may throw when their linguistic backend cannot be used.
 */
public interface PhraseExtractor {

    /**
     * @param text text to scan, already truncated by the caller
     * @return phrases per pattern in text order, each list capped at {@link PhraseKind#limit()}
     */
    @NotNull
    Map<PhraseKind, List<String>> extract(@NotNull String text);

    /**
     * Checks if the backend can be used.
     */
    default boolean isAvailable() {
        return true;
    }

    @NotNull
    String getName();
}
