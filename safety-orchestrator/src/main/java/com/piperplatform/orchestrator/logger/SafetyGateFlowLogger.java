package com.piperplatform.orchestrator.logger;

import com.piperplatform.common.model.TurnAssessment;
import com.piperplatform.common.trace.SessionTraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Observability for one event's journey through the safety-gate pipeline.
 *
 * <p>Logs already-computed values only; never changes pipeline behavior.
 *
 * <p>Stages (in order for a response event):
 * <ol>
 *   <li>{@link #EVENT_RECEIVED}         event accepted into the session queue</li>
 *   <li>{@link #TURN_ASSESSED}          signals, state, level and interventions computed</li>
 *   <li>{@link #GENERATION_REQUESTED}   response generator called</li>
 *   <li>{@link #GENERATION_ACCEPTED}    generated line passed validation</li>
 *   <li>{@link #FALLBACK_USED}          deterministic line substituted</li>
 *   <li>{@link #RESPONSE_EMITTED}       UI package handed to the transport layer</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads session id and turn from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(SafetyGateFlowLogger.RESPONSE_EMITTED))
 * </pre>
 */
@Component
public class SafetyGateFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SafetyGateFlowLogger.class);

    public static final String EVENT_RECEIVED       = "EVENT_RECEIVED";
    public static final String TURN_ASSESSED        = "TURN_ASSESSED";
    public static final String GENERATION_REQUESTED = "GENERATION_REQUESTED";
    public static final String GENERATION_ACCEPTED  = "GENERATION_ACCEPTED";
    public static final String FALLBACK_USED        = "FALLBACK_USED";
    public static final String RESPONSE_EMITTED     = "RESPONSE_EMITTED";

    public static final String TIMER_STARTED    = "TIMER_STARTED";
    public static final String TIMER_STOPPED    = "TIMER_STOPPED";
    public static final String INACTIVITY_FIRED = "INACTIVITY_FIRED";
    public static final String CHOICE_SELECTED  = "CHOICE_SELECTED";
    public static final String SESSION_RESUMED  = "SESSION_RESUMED";
    public static final String SESSION_OPENED   = "SESSION_OPENED";
    public static final String SESSION_CLOSED   = "SESSION_CLOSED";

    /**
     * Returns a {@code doOnEach} consumer logging the stage on {@code onNext} only.
     * Session id and turn are read from the Reactor Context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            ContextView ctx = signal.getContextView();
            SessionTraceContext.withMdc(ctx, () ->
                log.info("[SafetyGateFlow] stage={} turn={} sessionId={}",
                         stageName, SessionTraceContext.turn(ctx), SessionTraceContext.sessionId(ctx))
            );
        };
    }

    public void logStage(String stageName, String sessionId) {
        SessionTraceContext.withMdc(sessionId, () ->
            log.info("[SafetyGateFlow] stage={} sessionId={}", stageName, sessionId)
        );
    }

    /**
     * One compact line per event with the deterministic half of the pipeline.
     */
    public void logAssessment(TurnAssessment turn, String sessionId) {
        SessionTraceContext.withMdc(sessionId, () ->
            log.info("[SafetyGateFlow] stage={} event={} signals={} level={} interventions={} "
                     + "engagement={} dysregulation={} fatigue={} consecutiveErrors={} decision={} sessionId={}",
                     TURN_ASSESSED,
                     turn.event().type(), turn.signals(), turn.level(), turn.interventions(),
                     turn.state().engagementLevel(), turn.state().dysregulationLevel(),
                     turn.state().fatigueLevel(), turn.state().consecutiveErrors(),
                     turn.decision(), sessionId)
        );
    }

    public void logFallback(String sessionId, String reason) {
        SessionTraceContext.withMdc(sessionId, () ->
            log.warn("[SafetyGateFlow] stage={} reason={} sessionId={}", FALLBACK_USED, reason, sessionId)
        );
    }

    public void logTimer(String stageName, String sessionId, Duration timeout) {
        SessionTraceContext.withMdc(sessionId, () ->
            log.info("[SafetyGateFlow] stage={} timeoutSeconds={} sessionId={}",
                     stageName, timeout != null ? timeout.toSeconds() : "-", sessionId)
        );
    }

    public void logChoice(String sessionId, Object action) {
        SessionTraceContext.withMdc(sessionId, () ->
            log.info("[SafetyGateFlow] stage={} action={} sessionId={}", CHOICE_SELECTED, action, sessionId)
        );
    }
}
