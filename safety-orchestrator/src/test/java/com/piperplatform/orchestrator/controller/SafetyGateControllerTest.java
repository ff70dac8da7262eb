package com.piperplatform.orchestrator.controller;

import com.piperplatform.orchestrator.MutableClock;
import com.piperplatform.orchestrator.ai.KeywordTextSignalClassifier;
import com.piperplatform.orchestrator.logger.SafetyGateFlowLogger;
import com.piperplatform.orchestrator.pipeline.SafetyGatePipeline;
import com.piperplatform.orchestrator.session.SafetyGateSession;
import com.piperplatform.orchestrator.session.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SafetyGateControllerTest {

    private static final String BASE = "/api/v1/safety-gate";

    private SessionRegistry registry;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        SafetyGateFlowLogger flowLogger = new SafetyGateFlowLogger();
        SafetyGatePipeline pipeline = new SafetyGatePipeline(
            (prompt, ctx, level) -> Mono.error(new IllegalStateException("offline")),
            new KeywordTextSignalClassifier(), flowLogger, scheduler, 4000, 450);
        registry = new SessionRegistry(pipeline, (childSaid, target, category) -> Mono.just(false),
            flowLogger, new MutableClock(), scheduler);
        client = WebTestClient.bindToController(new SafetyGateController(registry))
            .controllerAdvice(new SafetyGateExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    private String openSession() {
        return registry.open().getId();
    }

    @Nested
    @DisplayName("session lifecycle")
    class LifecycleTests {

        @Test
        void open_returnsCreatedWithId() {
            Map<?, ?> body = client.post().uri(BASE + "/sessions")
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult().getResponseBody();

            assertNotNull(body);
            SafetyGateSession session = registry.get((String) body.get("sessionId"));
            assertNotNull(session);
        }

        @Test
        void close_thenUnknown() {
            String id = openSession();

            client.delete().uri(BASE + "/sessions/{id}", id).exchange().expectStatus().isNoContent();
            client.delete().uri(BASE + "/sessions/{id}", id).exchange().expectStatus().isNotFound();
        }

        @Test
        void unknownSession_isNotFound() {
            client.get().uri(BASE + "/sessions/{id}/state", "missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").value(msg -> assertTrue(((String) msg).contains("missing")));
        }

        @Test
        void health() {
            client.get().uri(BASE + "/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
        }
    }

    @Nested
    @DisplayName("turns")
    class TurnTests {

        @Test
        @DisplayName("card then correct response")
        void cardAndResponse() {
            String id = openSession();

            client.put().uri(BASE + "/sessions/{id}/card", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"category": "Adjectives - Opposites", "question": "What is the opposite of hot?",
                     "targetAnswers": ["cold"], "imageLabels": ["ice"]}""")
                .exchange()
                .expectStatus().isNoContent();

            client.post().uri(BASE + "/sessions/{id}/responses", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"transcription\": \"cold\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.isCorrect").isEqualTo(true)
                .jsonPath("$.feedbackText").isEqualTo("Great job! You got it!")
                .jsonPath("$.uiPackage.overlay.safetyLevel").isEqualTo("GREEN")
                .jsonPath("$.attemptNumber").isEqualTo(1);
        }

        @Test
        @DisplayName("missing transcription is a bad request")
        void missingTranscription() {
            String id = openSession();

            client.post().uri(BASE + "/sessions/{id}/responses", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("raw event with a distress cue")
        void rawEvent() {
            String id = openSession();

            client.post().uri(BASE + "/sessions/{id}/events", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"event": {"type": "RESPONSE_RECEIVED", "response": "aaaah", "correct": false}}""")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overlay.safetyLevel").isEqualTo("ORANGE")
                .jsonPath("$.choiceMessage").isNotEmpty();
        }

        @Test
        @DisplayName("unknown choice action is a bad request, break then resume succeeds")
        void choices() {
            String id = openSession();

            client.post().uri(BASE + "/sessions/{id}/choices", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"action\": \"dance\"}")
                .exchange()
                .expectStatus().isBadRequest();

            client.post().uri(BASE + "/sessions/{id}/choices", id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"action\": \"start_break\"}")
                .exchange()
                .expectStatus().isNoContent();

            client.post().uri(BASE + "/sessions/{id}/resume", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.timeSinceBreak").isEqualTo(0.0);
        }
    }
}
