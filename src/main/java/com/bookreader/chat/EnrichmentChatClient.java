package com.bookreader.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * OpenAI-compatible chat completions endpoint used for description enrichment.
 *
 * <pre>
 * quarkus.rest-client.llm-enricher.url=https://openrouter.ai/api/v1
 * bookreader.nlp.enrichment.api-key=...
 * </pre>
 */
@RegisterRestClient(configKey = "llm-enricher")
@RegisterProvider(EnrichmentClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface EnrichmentChatClient {

    @POST
    @Path("/chat/completions")
    @Timeout(20000)
    @CircuitBreaker(
        requestVolumeThreshold = 4,
        failureRatio = 0.5,
        delay = 10000,
        successThreshold = 2
    )
    ChatResponse chat(ChatRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("bookreader.nlp.enrichment.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatMessage(String role, String content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatRequest(
        String model,
        List<ChatMessage> messages,
        Boolean stream,

        @JsonProperty("max_tokens")
        Integer maxTokens,

        Double temperature
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatResponse(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
    ) {
        public record Choice(
            Integer index,
            ChatMessage message,

            @JsonProperty("finish_reason")
            String finishReason
        ) {
        }

        public record Usage(
            @JsonProperty("prompt_tokens")
            Integer promptTokens,

            @JsonProperty("completion_tokens")
            Integer completionTokens,

            @JsonProperty("total_tokens")
            Integer totalTokens
        ) {
        }
    }
}
