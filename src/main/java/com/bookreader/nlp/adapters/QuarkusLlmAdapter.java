package com.bookreader.nlp.adapters;

import com.bookreader.chat.EnrichmentChatClient;
import com.bookreader.chat.EnrichmentChatClient.ChatMessage;
import com.bookreader.chat.EnrichmentChatClient.ChatRequest;
import com.bookreader.chat.EnrichmentChatClient.ChatResponse;
import com.bookreader.nlp.llm.LlmFunction;
import com.bookreader.nlp.registry.DescriptionEngineConfig;
import io.quarkus.arc.Arc;
import io.quarkus.arc.ManagedContext;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges the enrichment REST client to {@link LlmFunction}.
 *
 * <p>Calls run on a small dedicated pool whose threads carry the Quarkus classloader and get a
 * request context activated for the duration of the call.</p>
 */
@ApplicationScoped
public class QuarkusLlmAdapter implements LlmFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLlmAdapter.class);
    private static final ClassLoader QUARKUS_CLASSLOADER = QuarkusLlmAdapter.class.getClassLoader();
    private static final int POOL_SIZE = 2;

    private final ExecutorService executor = Executors.newFixedThreadPool(POOL_SIZE, threadFactory());

    @Inject
    @RestClient
    EnrichmentChatClient chatClient;

    @Inject
    DescriptionEngineConfig config;

    @Override
    public CompletableFuture<String> apply(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @NotNull final Map<String, Object> kwargs) {

        return CompletableFuture.supplyAsync(() -> {
            final ManagedContext requestContext = Arc.container().requestContext();
            if (!requestContext.isActive()) {
                requestContext.activate();
            }
            try {
                final DescriptionEngineConfig.Enrichment enrichment = config.enrichment();
                final String model = (String) kwargs.getOrDefault("model", enrichment.model());
                final Double temperature = getDoubleParam(kwargs, "temperature", enrichment.temperature());
                final Integer maxTokens = getIntegerParam(kwargs, "max_tokens", enrichment.maxTokens());

                LOG.debugf("Enrichment LLM request - model: %s, prompt length: %d, thread: %s",
                        model, Integer.valueOf(prompt.length()), Thread.currentThread().getName());

                final ChatResponse response = chatClient.chat(new ChatRequest(
                        model, buildMessages(prompt, systemPrompt), Boolean.FALSE, maxTokens, temperature));

                if (response.choices() == null || response.choices().isEmpty()) {
                    throw new IllegalStateException("LLM returned no choices in response");
                }
                final String content = response.choices().get(0).message().content();
                LOG.debugf("Enrichment LLM response - length: %d, tokens: %s",
                        Integer.valueOf(content == null ? 0 : content.length()),
                        response.usage() != null ? String.valueOf(response.usage().totalTokens()) : "unknown");
                return content;
            } finally {
                requestContext.deactivate();
            }
        }, executor);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private List<ChatMessage> buildMessages(@NotNull final String prompt, @Nullable final String systemPrompt) {
        final List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(new ChatMessage("system", systemPrompt));
        }
        messages.add(new ChatMessage("user", prompt));
        return messages;
    }

    private Double getDoubleParam(final Map<String, Object> kwargs, final String key, final double defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private Integer getIntegerParam(final Map<String, Object> kwargs, final String key, final int defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static ThreadFactory threadFactory() {
        final AtomicInteger counter = new AtomicInteger();
        return task -> {
            final Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
                task.run();
            }, "nlp-enricher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
