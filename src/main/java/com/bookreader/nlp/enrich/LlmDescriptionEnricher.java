package com.bookreader.nlp.enrich;

import com.bookreader.nlp.core.CompleteDescription;
import com.bookreader.nlp.llm.LlmFunction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks a language model for the visual attributes of a description and parses its JSON answer.
 */
public class LlmDescriptionEnricher implements DescriptionEnricher {

    private static final Logger LOG = LoggerFactory.getLogger(LlmDescriptionEnricher.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() { };

    static final String SYSTEM_PROMPT =
        "You analyse passages from Russian fiction for an illustrator. "
            + "Answer with a single JSON object and nothing else. Use English keys and short values.";

    private static final String LOCATION_PROMPT = """
        Describe the place in this passage as JSON with keys:
        "setting", "time_of_day", "weather", "lighting", "colors" (array), "architecture", "mood".

        Passage:
        %s
        """;

    private static final String CHARACTER_PROMPT = """
        Describe the person in this passage as JSON with keys:
        "age", "gender", "build", "hair", "clothing", "distinctive_features" (array), "expression".

        Passage:
        %s
        """;

    private static final String ATMOSPHERE_PROMPT = """
        Describe the atmosphere of this passage as JSON with keys:
        "mood", "lighting", "sounds" (array), "smells" (array), "colors" (array), "weather".

        Passage:
        %s
        """;

    private static final String GENERIC_PROMPT = """
        Describe what an illustrator should draw for this passage as JSON with keys:
        "subject", "details" (array), "colors" (array), "mood".

        Passage:
        %s
        """;

    private final LlmFunction llm;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;

    public LlmDescriptionEnricher(@NotNull LlmFunction llm, @NotNull ObjectMapper objectMapper, long timeoutMs) {
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.timeoutMs = timeoutMs;
    }

    @Override
    @NotNull
    public Map<String, Object> enrich(@NotNull CompleteDescription description) {
        String prompt = prompt(description);
        CompletableFuture<String> call = llm.apply(prompt, SYSTEM_PROMPT);
        String answer;
        try {
            answer = call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new EnrichmentException("LLM did not answer within " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            throw new EnrichmentException("LLM call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new EnrichmentException("Interrupted while waiting for LLM", e);
        }
        Map<String, Object> attributes = parse(answer);
        LOG.debug("Enriched {} description at offset {} with {} attributes",
            description.descriptionType(), description.chapterOffset(), attributes.size());
        return attributes;
    }

    @Override
    @NotNull
    public String getName() {
        return "llm";
    }

    @NotNull
    String prompt(@NotNull CompleteDescription description) {
        String template = switch (description.descriptionType()) {
            case LOCATION -> LOCATION_PROMPT;
            case CHARACTER -> CHARACTER_PROMPT;
            case ATMOSPHERE -> ATMOSPHERE_PROMPT;
            default -> GENERIC_PROMPT;
        };
        return String.format(template, description.text());
    }

    @NotNull
    Map<String, Object> parse(String answer) {
        if (answer == null || answer.isBlank()) {
            throw new EnrichmentException("LLM returned an empty answer");
        }
        String json = stripFences(answer.trim());
        Map<String, Object> parsed;
        try {
            parsed = objectMapper.readValue(json, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            throw new EnrichmentException("LLM answer is not a JSON object: " + e.getOriginalMessage(), e);
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        parsed.forEach((key, value) -> {
            if (value != null) {
                attributes.put(key, value);
            }
        });
        return attributes;
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }
}
