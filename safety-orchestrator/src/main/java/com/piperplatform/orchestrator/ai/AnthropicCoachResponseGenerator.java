package com.piperplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.piperplatform.common.exception.GenerationException;
import com.piperplatform.common.model.CoachGeneration;
import com.piperplatform.common.model.ResponseContext;
import com.piperplatform.common.model.SafetyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Claude-backed {@link CoachResponseGenerator}.
 *
 * <p>Non-blocking: the HTTP call is composed as a {@code Mono}. When the API key is
 * absent or the call fails the returned {@code Mono} errors with a
 * {@link GenerationException} and the pipeline substitutes its fallback line.
 */
@Service
public class AnthropicCoachResponseGenerator implements CoachResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicCoachResponseGenerator.class);
    private static final String COMPONENT = "ResponseGenerator";

    private final AnthropicMessagesClient messagesClient;
    private final ObjectMapper objectMapper;

    @Value("${safety-gate.generator.max-tokens:300}")
    private int maxTokens;

    @Value("${safety-gate.generator.timeout-ms:4000}")
    private long timeoutMs;

    public AnthropicCoachResponseGenerator(AnthropicMessagesClient messagesClient, ObjectMapper objectMapper) {
        this.messagesClient = messagesClient;
        this.objectMapper   = objectMapper;
    }

    @Override
    public Mono<CoachGeneration> generate(String systemPrompt, ResponseContext context, SafetyLevel level) {
        String model = ModelSelector.selectModel(level);
        return Mono.fromCallable(() -> userMessage(context))
            .flatMap(message -> messagesClient.complete(model, systemPrompt, message,
                                                        maxTokens, Duration.ofMillis(timeoutMs)))
            .map(this::parseResponse)
            .doOnSuccess(g -> log.debug("[ResponseGenerator] Candidate generated. model={} outcome={}",
                                        model, context.outcome()));
    }

    private String userMessage(ResponseContext context) throws Exception {
        return "Respond to this turn with the JSON object only.\n"
            + objectMapper.writeValueAsString(context);
    }

    CoachGeneration parseResponse(String responseText) {
        try {
            JsonNode json = objectMapper.readTree(AnthropicMessagesClient.stripFences(responseText));
            String coachLine = json.path("coach_line").asText("");
            if (coachLine.isBlank()) {
                throw new GenerationException(COMPONENT, "Generator output has no coach_line");
            }
            return new CoachGeneration(coachLine, json.path("choice_presentation").asText(""));
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException(COMPONENT, "Unparsable generator output: " + responseText, e);
        }
    }
}
