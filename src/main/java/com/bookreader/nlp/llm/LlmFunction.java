package com.bookreader.nlp.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Chat completion against a language model.
 */
@FunctionalInterface
public interface LlmFunction {

    /**
     * @param prompt       user prompt
     * @param systemPrompt optional system prompt
     * @param kwargs       overrides such as {@code temperature} or {@code max_tokens}
     * @return the completion text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @NotNull Map<String, Object> kwargs
    );

    default CompletableFuture<String> apply(@NotNull String prompt, @Nullable String systemPrompt) {
        return apply(prompt, systemPrompt, Map.of());
    }
}
