package com.piperplatform.orchestrator.pipeline;

import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.fallback.FallbackResponder;
import com.piperplatform.common.intervention.InterventionSelector;
import com.piperplatform.common.level.LevelAssessor;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.CoachGeneration;
import com.piperplatform.common.model.GenerationRequest;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.ResponseConstraints;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.SessionConfig;
import com.piperplatform.common.model.Signal;
import com.piperplatform.common.model.TaskContext;
import com.piperplatform.common.model.TurnAssessment;
import com.piperplatform.common.model.UIPackage;
import com.piperplatform.common.planner.SessionPlanner;
import com.piperplatform.common.prompt.PromptBuilder;
import com.piperplatform.common.signal.SignalDetector;
import com.piperplatform.common.state.StateEngine;
import com.piperplatform.common.validation.ResponseValidator;
import com.piperplatform.common.validation.ValidationResult;
import com.piperplatform.orchestrator.ai.CoachResponseGenerator;
import com.piperplatform.orchestrator.ai.TextSignalClassifier;
import com.piperplatform.orchestrator.logger.SafetyGateFlowLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Per-event control flow of the safety gate.
 *
 * <pre>
 * classify text ─► detect signals ─► update state ─► assess level ─► select interventions
 *   ─► plan session ─► build prompt ─► generate (responses only) ─► validate ─► emit
 * </pre>
 *
 * <p>Stateless and shared by all sessions; the {@link StateEngine} passed in is owned by
 * the calling session, which must serialize calls for the same engine.
 *
 * <p>The generator is the only suspension point with a deadline. It has no retries:
 * timeout, error or validation failure all resolve to the deterministic fallback line.
 */
@Component
public class SafetyGatePipeline {

    private final CoachResponseGenerator generator;
    private final TextSignalClassifier   classifier;
    private final SafetyGateFlowLogger   flowLogger;
    private final Scheduler              scheduler;
    private final Duration               generatorTimeout;
    private final Duration               plannedSessionDuration;

    public SafetyGatePipeline(CoachResponseGenerator generator,
                              TextSignalClassifier classifier,
                              SafetyGateFlowLogger flowLogger,
                              @Qualifier("safetyGateScheduler") Scheduler scheduler,
                              @Value("${safety-gate.generator.timeout-ms:4000}") long generatorTimeoutMs,
                              @Value("${safety-gate.session.planned-duration-seconds:450}") long plannedSeconds) {
        this.generator              = generator;
        this.classifier             = classifier;
        this.flowLogger             = flowLogger;
        this.scheduler              = scheduler;
        this.generatorTimeout       = Duration.ofMillis(generatorTimeoutMs);
        this.plannedSessionDuration = Duration.ofSeconds(plannedSeconds);
    }

    /**
     * Runs one event through the full pipeline.
     *
     * @param engine    the session's state owner; mutated exactly once
     * @param event     validated event
     * @param task      current card, nullable
     * @param sessionId for logging only
     */
    public Mono<TurnResult> process(StateEngine engine, SafetyEvent event, TaskContext task, String sessionId) {
        Mono<Set<Signal>> textSignals = event.isResponse()
            ? classifier.classify(event.response())
            : Mono.just(Set.of());

        return textSignals
            .map(text -> assess(engine, event, text))
            .doOnNext(turn -> flowLogger.logAssessment(turn, sessionId))
            .flatMap(turn -> respond(turn, task, sessionId));
    }

    /**
     * Deterministic half: detector, state engine, level, interventions, planner.
     */
    TurnAssessment assess(StateEngine engine, SafetyEvent event, Set<Signal> textSignals) {
        Set<Signal>        detected      = SignalDetector.detect(event, textSignals);
        BehaviorState      state         = engine.processEvent(event, detected);
        Set<Signal>        signals       = SignalDetector.withStateSignals(detected, state);
        SafetyLevel        level         = LevelAssessor.assess(state, signals);
        List<Intervention> interventions = InterventionSelector.select(level, state, signals);
        SessionConfig      config        = SessionPlanner.plan(level);
        return TurnAssessment.of(event, signals, state, level, interventions, config);
    }

    private Mono<TurnResult> respond(TurnAssessment turn, TaskContext task, String sessionId) {
        GenerationRequest   request     = PromptBuilder.build(turn, task);
        ResponseConstraints constraints = request.constraints();

        Mono<Spoken> spoken = turn.event().isInactivity()
            ? Mono.fromSupplier(() -> fallback(turn, request, sessionId, "inactivity"))
            : generateValidated(turn, request, sessionId);

        boolean breakDue = SessionPlanner.shouldTriggerScheduledBreak(turn.state(), plannedSessionDuration);

        return spoken.map(s -> {
            String text = constraints.mustOfferChoices() ? FallbackResponder.ensureChoicePrompt(s.text()) : s.text();
            String choiceMessage = constraints.mustOfferChoices() ? s.choiceMessage() : "";
            UIPackage ui = new UIPackage(
                new UIPackage.Overlay(turn.signals(), turn.state(), turn.level()),
                turn.interventions(),
                turn.sessionConfig(),
                new UIPackage.Speech(text),
                choiceMessage);
            return new TurnResult(ui, turn, s.fallback(), breakDue);
        }).doOnEach(flowLogger.stage(SafetyGateFlowLogger.RESPONSE_EMITTED));
    }

    private Mono<Spoken> generateValidated(TurnAssessment turn, GenerationRequest request, String sessionId) {
        flowLogger.logStage(SafetyGateFlowLogger.GENERATION_REQUESTED, sessionId);
        return Mono.defer(() -> generator.generate(request.systemPrompt(), request.context(), turn.level()))
            .timeout(generatorTimeout, scheduler)
            .map(candidate -> accept(candidate, turn, request, sessionId))
            .switchIfEmpty(Mono.fromSupplier(() -> fallback(turn, request, sessionId, "empty generator result")))
            .onErrorResume(e -> Mono.just(fallback(turn, request, sessionId, "generation failed: " + e.getMessage())));
    }

    /**
     * Validates the line as it will be spoken: when choices are required the prompt is
     * appended first, so it counts against the sentence and word limits.
     */
    private Spoken accept(CoachGeneration candidate, TurnAssessment turn, GenerationRequest request,
                          String sessionId) {
        CoachGeneration spoken = withChoicePrompt(candidate, request.constraints());
        ValidationResult validation = ResponseValidator.validate(spoken, request.constraints());
        if (!validation.valid()) {
            return fallback(turn, request, sessionId, "validation failed: " + validation.reason());
        }
        flowLogger.logStage(SafetyGateFlowLogger.GENERATION_ACCEPTED, sessionId);
        return new Spoken(spoken.coachLine(), spoken.choicePresentation(), false);
    }

    private static CoachGeneration withChoicePrompt(CoachGeneration candidate, ResponseConstraints constraints) {
        String line = candidate.coachLine();
        // a blank line must still fail validation, not become the bare prompt
        if (!constraints.mustOfferChoices() || line == null || line.isBlank()) {
            return candidate;
        }
        return new CoachGeneration(FallbackResponder.ensureChoicePrompt(line), candidate.choicePresentation());
    }

    private Spoken fallback(TurnAssessment turn, GenerationRequest request, String sessionId, String reason) {
        flowLogger.logFallback(sessionId, reason);
        String line = FallbackResponder.fallbackLine(request.context().outcome(), turn.level());
        return new Spoken(line, PromptBuilder.CHOICE_PROMPT, true);
    }

    private record Spoken(String text, String choiceMessage, boolean fallback) {}
}
