package com.piperplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piperplatform.common.exception.GenerationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin reactive wrapper over {@code POST /v1/messages}.
 *
 * <p>Single attempt, no retries. Every failure surfaces as a {@link GenerationException};
 * callers decide the fallback.
 */
@Component
public class AnthropicMessagesClient {

    private static final String COMPONENT = "AnthropicClient";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    public AnthropicMessagesClient(@Qualifier("anthropicClient") WebClient anthropicClient,
                                   ObjectMapper objectMapper) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
    }

    public boolean isConfigured() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    /**
     * @return the text of the first content block
     */
    public Mono<String> complete(String model, String systemPrompt, String userMessage,
                                 int maxTokens, Duration timeout) {
        if (!isConfigured()) {
            return Mono.error(new GenerationException(COMPONENT, "No Anthropic API key configured"));
        }

        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "system", systemPrompt,
            "messages", List.of(Map.of("role", "user", "content", userMessage))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", anthropicApiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
            )
            .map(this::extractText)
            .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException(COMPONENT, "Anthropic call failed: " + e.getMessage(), e));
    }

    String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode text = root.path("content").path(0).path("text");
            if (text.isMissingNode() || text.asText().isBlank()) {
                throw new GenerationException(COMPONENT, "Anthropic response has no text content");
            }
            return text.asText();
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException(COMPONENT, "Failed to extract text from Anthropic response", e);
        }
    }

    /** Strips markdown code fences models sometimes wrap JSON in. */
    static String stripFences(String text) {
        return text.replaceAll("```json", "").replaceAll("```", "").trim();
    }
}
