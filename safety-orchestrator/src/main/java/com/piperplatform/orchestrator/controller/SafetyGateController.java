package com.piperplatform.orchestrator.controller;

import com.piperplatform.common.exception.InvalidEventException;
import com.piperplatform.common.model.AudioCues;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.CardContext;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.SafetyGateResult;
import com.piperplatform.common.model.UIPackage;
import com.piperplatform.orchestrator.session.SafetyGateSession;
import com.piperplatform.orchestrator.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Thin transport adapter over {@link SessionRegistry}. No safety logic lives here.
 */
@RestController
@RequestMapping("/api/v1/safety-gate")
public class SafetyGateController {

    private static final Logger log = LoggerFactory.getLogger(SafetyGateController.class);

    private final SessionRegistry registry;

    public SafetyGateController(SessionRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/sessions")
    public ResponseEntity<Map<String, String>> openSession() {
        SafetyGateSession session = registry.open();
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("sessionId", session.getId()));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        registry.close(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/sessions/{sessionId}/card")
    public ResponseEntity<Void> setCard(@PathVariable String sessionId, @RequestBody CardContext card) {
        log.info("Card set. sessionId={} question={}", sessionId, card.question());
        registry.get(sessionId).setCurrentCard(card);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sessions/{sessionId}/responses")
    public Mono<SafetyGateResult> respond(@PathVariable String sessionId,
                                          @RequestBody ChildResponseRequest request) {
        if (request.transcription() == null) {
            throw new InvalidEventException("transcription is required");
        }
        AudioCues cues = request.audioCues() != null ? request.audioCues() : AudioCues.NONE;
        return registry.get(sessionId).processChildResponse(request.transcription(), cues)
            .doOnError(e -> log.error("Response processing failed. sessionId={}", sessionId, e));
    }

    @PostMapping("/sessions/{sessionId}/events")
    public Mono<UIPackage> processEvent(@PathVariable String sessionId, @RequestBody EventRequest request) {
        if (request.event() == null) {
            throw new InvalidEventException("event is required");
        }
        return registry.get(sessionId).processEvent(request.event(), request.task())
            .doOnError(e -> log.error("Event processing failed. sessionId={}", sessionId, e));
    }

    @PostMapping("/sessions/{sessionId}/choices")
    public ResponseEntity<Void> selectChoice(@PathVariable String sessionId, @RequestBody ChoiceRequest request) {
        SafetyGateSession session = registry.get(sessionId);
        session.handleChoiceSelection(Intervention.fromAction(request.action()));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sessions/{sessionId}/resume")
    public Mono<BehaviorState> resume(@PathVariable String sessionId) {
        return registry.get(sessionId).resumeSession();
    }

    @GetMapping("/sessions/{sessionId}/state")
    public Mono<BehaviorState> state(@PathVariable String sessionId) {
        return registry.get(sessionId).currentState();
    }

    @GetMapping(value = "/sessions/{sessionId}/inactivity", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SafetyGateResult>> inactivityStream(@PathVariable String sessionId) {
        log.info("Inactivity stream client connected. sessionId={}", sessionId);
        return registry.get(sessionId).inactivityResults()
            .map(result -> ServerSentEvent.<SafetyGateResult>builder()
                .event("inactivity")
                .data(result)
                .build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
