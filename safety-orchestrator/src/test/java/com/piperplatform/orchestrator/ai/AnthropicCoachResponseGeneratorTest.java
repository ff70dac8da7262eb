package com.piperplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piperplatform.common.exception.GenerationException;
import com.piperplatform.common.model.CoachGeneration;
import com.piperplatform.common.model.Outcome;
import com.piperplatform.common.model.ResponseContext;
import com.piperplatform.common.model.SafetyLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicCoachResponseGeneratorTest {

    private AnthropicMessagesClient client;
    private AnthropicCoachResponseGenerator generator;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        client    = new AnthropicMessagesClient(WebClient.builder().build(), mapper);
        generator = new AnthropicCoachResponseGenerator(client, mapper);
    }

    @Test
    @DisplayName("fenced JSON with both fields parses")
    void parse_fencedJson() {
        CoachGeneration g = generator.parseResponse("""
            ```json
            {"coach_line": "I heard warm. Good try!", "choice_presentation": "Pick a picture"}
            ```""");

        assertEquals("I heard warm. Good try!", g.coachLine());
        assertEquals("Pick a picture", g.choicePresentation());
    }

    @Test
    @DisplayName("missing choice_presentation becomes empty")
    void parse_missingChoices() {
        CoachGeneration g = generator.parseResponse("{\"coach_line\": \"Nice!\"}");
        assertEquals("", g.choicePresentation());
    }

    @Test
    @DisplayName("blank coach_line or non-JSON output is a GenerationException")
    void parse_invalid() {
        assertThrows(GenerationException.class, () -> generator.parseResponse("{\"coach_line\": \"  \"}"));
        assertThrows(GenerationException.class, () -> generator.parseResponse("Sure! Here you go."));
    }

    @Test
    @DisplayName("without an API key the call errors instead of reaching the network")
    void generate_withoutKey_errors() {
        assertFalse(client.isConfigured());

        ResponseContext context = new ResponseContext(Outcome.INCORRECT_RESPONSE, "hot", "cold", 1, null);
        StepVerifier.create(generator.generate("system", context, SafetyLevel.GREEN))
            .expectError(GenerationException.class)
            .verify();
    }

    @Test
    void stripFences_removesMarkdown() {
        assertEquals("{}", AnthropicMessagesClient.stripFences("```json\n{}\n```"));
    }
}
