package com.piperplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.piperplatform.common.exception.GenerationException;
import com.piperplatform.common.model.Signal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicTextSignalClassifierTest {

    private AnthropicTextSignalClassifier classifier;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        classifier = new AnthropicTextSignalClassifier(
            new AnthropicMessagesClient(WebClient.builder().build(), mapper), mapper, Duration.ofMillis(500));
    }

    @Test
    void unavailableModel_fallsBackToKeywords() {
        StepVerifier.create(classifier.classify("I'm tired, ugh"))
            .expectNext(Set.of(Signal.WANTS_BREAK, Signal.FRUSTRATION))
            .verifyComplete();
    }

    @Test
    void blankText_noSignals() {
        StepVerifier.create(classifier.classify("  "))
            .expectNext(Set.of())
            .verifyComplete();
    }

    @Test
    void parseSignals_keepsTextSignalsOnly() {
        Set<Signal> signals = classifier.parseSignals(
            "{\"signals\": [\"wants_break\", \"SCREAMING\", \"DISTRESS\", \"nonsense\"]}");

        assertEquals(Set.of(Signal.WANTS_BREAK, Signal.DISTRESS), signals);
    }

    @Test
    void parseSignals_missingArray_throws() {
        assertThrows(GenerationException.class, () -> classifier.parseSignals("{\"labels\": []}"));
    }
}
