package com.piperplatform.orchestrator.session;

import com.piperplatform.common.answer.AnswerEvaluator;
import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.exception.SafetyGateException;
import com.piperplatform.common.model.AudioCues;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.CardContext;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.SafetyGateResult;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.TaskContext;
import com.piperplatform.common.model.UIPackage;
import com.piperplatform.common.planner.SessionPlanner;
import com.piperplatform.common.state.StateEngine;
import com.piperplatform.common.trace.SessionTraceContext;
import com.piperplatform.orchestrator.ai.AnswerSimilarityChecker;
import com.piperplatform.orchestrator.logger.SafetyGateFlowLogger;
import com.piperplatform.orchestrator.pipeline.SafetyGatePipeline;
import com.piperplatform.orchestrator.pipeline.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * One child's play-through: owns the {@link StateEngine}, the card context, the
 * response history and the inactivity timer, and serializes every event through
 * the shared {@link SafetyGatePipeline}.
 *
 * <p>Events are processed strictly one at a time in arrival order: each call enqueues
 * a job on a per-session queue drained with {@code concatMap}, so event N+1 never
 * observes state before event N has been fully applied. Timer-fired inactivity goes
 * through the same queue.
 *
 * <p>Timer policy:
 * <ul>
 *   <li>new card: start</li>
 *   <li>response received: restart, then after processing stop on a correct answer or
 *       when choices are shown (YELLOW+), otherwise restart with the new timeout</li>
 *   <li>inactivity: stop when choices are shown (YELLOW+), otherwise restart</li>
 *   <li>choice selected: retry restarts, everything else stops</li>
 *   <li>resume: restart if a card is active</li>
 * </ul>
 *
 * <p>Response history and attempt count persist across cards for the whole session.
 */
public class SafetyGateSession {

    private static final Logger log = LoggerFactory.getLogger(SafetyGateSession.class);

    static final String INACTIVE_MARKER = "[INACTIVE]";

    private final String               id;
    private final StateEngine          engine;
    private final SafetyGatePipeline   pipeline;
    private final AnswerSimilarityChecker similarityChecker;
    private final SafetyGateFlowLogger flowLogger;
    private final InactivityTimer      timer;
    private final Clock                clock;
    private final Instant              startedAt;

    private final Sinks.Many<Mono<Void>>       jobs              = Sinks.many().unicast().onBackpressureBuffer();
    // autoCancel off: the stream must survive a UI reconnect
    private final Sinks.Many<SafetyGateResult> inactivityResults =
        Sinks.many().multicast().onBackpressureBuffer(64, false);
    private final AtomicLong turns = new AtomicLong();

    // guarded by this
    private CardContext        currentCard;
    private final List<String> responseHistory = new ArrayList<>();
    private int                attemptCount;
    private Duration           inactivityTimeout = SessionPlanner.initial().inactivityTimeout();
    private boolean            regulationPending;
    private boolean            closed;

    public SafetyGateSession(String id, SafetyGatePipeline pipeline, AnswerSimilarityChecker similarityChecker,
                             SafetyGateFlowLogger flowLogger, Clock clock, Scheduler scheduler) {
        this.id         = id;
        this.engine     = new StateEngine(clock);
        this.pipeline   = pipeline;
        this.similarityChecker = similarityChecker;
        this.flowLogger = flowLogger;
        this.timer      = new InactivityTimer(scheduler);
        this.clock      = clock;
        this.startedAt  = clock.instant();

        jobs.asFlux()
            .concatMap(job -> job)
            .subscribe();
    }

    // ── card context ────────────────────────────────────────────────────────

    /**
     * Sets the displayed card and starts waiting for the child's answer.
     */
    public void setCurrentCard(CardContext card) {
        synchronized (this) {
            ensureOpen();
            currentCard = card;
        }
        startTimer();
    }

    public synchronized CardContext getCurrentCard() {
        return currentCard;
    }

    public synchronized boolean hasActiveCard() {
        return currentCard != null;
    }

    // ── events ──────────────────────────────────────────────────────────────

    /**
     * Judges the transcription against the current card and runs it through the pipeline.
     * Without a card the response is treated as correct and not recorded.
     */
    public Mono<SafetyGateResult> processChildResponse(String transcription, AudioCues audioCues) {
        return enqueue(() -> handleResponse(transcription, audioCues));
    }

    /**
     * Runs a caller-built event through the pipeline with the same timer policy.
     */
    public Mono<UIPackage> processEvent(SafetyEvent event, TaskContext task) {
        return enqueue(() -> {
            flowLogger.logStage(SafetyGateFlowLogger.EVENT_RECEIVED, id);
            if (event.isResponse() && timer.isRunning()) {
                startTimer();
            }
            return pipeline.process(engine, event, task, id)
                .doOnNext(this::afterTurn)
                .map(TurnResult::uiPackage);
        });
    }

    /**
     * Applies the timer effect of a choice from the intervention menu.
     */
    public void handleChoiceSelection(Intervention action) {
        flowLogger.logChoice(id, action);
        switch (action) {
            case RETRY_CARD -> startTimer();
            case SKIP_CARD, CALL_GROWNUP -> stopTimer();
            case START_BREAK, BUBBLE_BREATHING -> {
                synchronized (this) {
                    regulationPending = true;
                }
                stopTimer();
            }
        }
    }

    /**
     * Returns to the card flow after a break, regulation activity or adult help.
     * A completed break or breathing exercise applies the break-taken transition first.
     */
    public Mono<BehaviorState> resumeSession() {
        return enqueue(() -> Mono.fromCallable(() -> {
            boolean applyBreak;
            synchronized (this) {
                applyBreak = regulationPending;
                regulationPending = false;
            }
            BehaviorState state = applyBreak ? engine.applyBreakTaken() : engine.getState();
            flowLogger.logStage(SafetyGateFlowLogger.SESSION_RESUMED, id);
            if (hasActiveCard()) {
                startTimer();
            }
            return state;
        }));
    }

    /** Consistent snapshot, read behind any queued event. */
    public Mono<BehaviorState> currentState() {
        return enqueue(() -> Mono.fromCallable(engine::getState));
    }

    /**
     * Results of timer-fired inactivity events. No caller waits for those, so they are
     * pushed here for the transport layer.
     */
    public Flux<SafetyGateResult> inactivityResults() {
        return inactivityResults.asFlux();
    }

    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        timer.cancel();
        synchronized (jobs) {
            jobs.tryEmitComplete();
        }
        inactivityResults.tryEmitComplete();
        flowLogger.logStage(SafetyGateFlowLogger.SESSION_CLOSED, id);
    }

    // ── accessors ───────────────────────────────────────────────────────────

    public String getId() {
        return id;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized List<String> getResponseHistory() {
        return List.copyOf(responseHistory);
    }

    public Duration getSessionDuration() {
        return Duration.between(startedAt, clock.instant());
    }

    public boolean isWaitingForResponse() {
        return timer.isRunning();
    }

    public synchronized Duration getInactivityTimeout() {
        return inactivityTimeout;
    }

    // ── handlers (run on the session queue) ─────────────────────────────────

    private Mono<SafetyGateResult> handleResponse(String transcription, AudioCues audioCues) {
        flowLogger.logStage(SafetyGateFlowLogger.EVENT_RECEIVED, id);
        if (timer.isRunning()) {
            startTimer();
        }

        CardContext  card;
        int          attempt;
        List<String> history;
        synchronized (this) {
            card = currentCard;
            if (card != null) {
                attemptCount++;
                responseHistory.add(transcription);
            }
            attempt = attemptCount;
            history = List.copyOf(responseHistory);
        }

        return evaluate(transcription, card).flatMap(correct -> {
            SafetyEvent event = card == null
                ? SafetyEvent.response(transcription, true, null, null, audioCues)
                : SafetyEvent.response(transcription, correct, fromEnd(history, 2), fromEnd(history, 3), audioCues);
            TaskContext task = card != null ? card.toTaskContext() : null;

            return pipeline.process(engine, event, task, id)
                .doOnNext(this::afterTurn)
                .map(turn -> toResult(turn, correct, transcription, card, attempt, history));
        });
    }

    /**
     * Deterministic match first; only a miss on a descriptive-word card asks the
     * similarity checker, against the first target answer.
     */
    private Mono<Boolean> evaluate(String transcription, CardContext card) {
        if (card == null || AnswerEvaluator.isCorrect(transcription, card.targetAnswers())) {
            return Mono.just(true);
        }
        if (card.targetAnswers().isEmpty() || !AnswerEvaluator.supportsSimilarityCheck(card.category())) {
            return Mono.just(false);
        }
        return similarityChecker.isSimilar(transcription, card.targetAnswers().get(0), card.category())
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.warn("Similarity check failed, answer counted as a miss. sessionId={} reason={}",
                         id, e.getMessage());
                return Mono.just(false);
            });
    }

    private Mono<SafetyGateResult> handleInactivity() {
        CardContext  card;
        int          attempt;
        List<String> history;
        synchronized (this) {
            if (closed) {
                return Mono.empty();
            }
            card    = currentCard;
            attempt = attemptCount;
            history = List.copyOf(responseHistory);
        }

        SafetyEvent event = SafetyEvent.inactivity(fromEnd(history, 1), fromEnd(history, 2));
        TaskContext task  = card != null ? card.toTaskContext() : null;

        return pipeline.process(engine, event, task, id)
            .doOnNext(this::afterTurn)
            .map(turn -> toResult(turn, false, INACTIVE_MARKER, card, attempt, history));
    }

    private void onTimerFired() {
        flowLogger.logStage(SafetyGateFlowLogger.INACTIVITY_FIRED, id);
        enqueue(this::handleInactivity)
            .subscribe(this::publishInactivity,
                       e -> log.error("Inactivity processing failed. sessionId={}", id, e));
    }

    private void publishInactivity(SafetyGateResult result) {
        Sinks.EmitResult emitted = inactivityResults.tryEmitNext(result);
        if (emitted.isFailure()) {
            log.warn("Inactivity result not delivered. sessionId={} reason={}", id, emitted);
        }
    }

    private void afterTurn(TurnResult turn) {
        synchronized (this) {
            inactivityTimeout = turn.uiPackage().sessionConfig().inactivityTimeout();
        }
        SafetyEvent event     = turn.assessment().event();
        boolean choicesShown  = turn.assessment().level().isAtLeast(SafetyLevel.YELLOW);
        boolean answered      = event.isResponse() && event.correct();

        if (answered || choicesShown) {
            stopTimer();
        } else if (hasActiveCard()) {
            startTimer();
        }
    }

    // ── timer ───────────────────────────────────────────────────────────────

    private void startTimer() {
        Duration timeout = getInactivityTimeout();
        timer.start(timeout, this::onTimerFired);
        flowLogger.logTimer(SafetyGateFlowLogger.TIMER_STARTED, id, timeout);
    }

    private void stopTimer() {
        if (timer.isRunning()) {
            flowLogger.logTimer(SafetyGateFlowLogger.TIMER_STOPPED, id, timer.currentTimeout());
        }
        timer.cancel();
    }

    // ── queue ───────────────────────────────────────────────────────────────

    private <T> Mono<T> enqueue(Supplier<Mono<T>> work) {
        Sinks.One<T> reply = Sinks.one();
        Mono<Void> job = SessionTraceContext.withTurn(Mono.defer(work), id, turns.incrementAndGet())
            .doOnSuccess(value -> {
                if (value == null) reply.tryEmitEmpty();
                else reply.tryEmitValue(value);
            })
            .doOnError(reply::tryEmitError)
            // the error was handed to the caller; keep draining the queue
            .onErrorResume(e -> Mono.empty())
            .then();

        Sinks.EmitResult emitted;
        synchronized (jobs) {
            emitted = jobs.tryEmitNext(job);
        }
        if (emitted.isFailure()) {
            return Mono.error(new SafetyGateException("SafetyGateSession", "Session closed: " + id));
        }
        return reply.asMono();
    }

    private void ensureOpen() {
        if (closed) {
            throw new SafetyGateException("SafetyGateSession", "Session closed: " + id);
        }
    }

    /** n = 1 is the last element. */
    private static String fromEnd(List<String> list, int n) {
        return list.size() >= n ? list.get(list.size() - n) : null;
    }

    private static SafetyGateResult toResult(TurnResult turn, boolean correct, String childSaid,
                                             CardContext card, int attempt, List<String> history) {
        UIPackage ui = turn.uiPackage();
        return new SafetyGateResult(
            ui,
            ui.speech().text(),
            ui.choiceMessage(),
            true,
            ui.safetyLevel().isAtLeast(SafetyLevel.YELLOW),
            correct,
            childSaid,
            card != null ? card.targetAnswers() : List.of(),
            attempt,
            history,
            turn.usedFallback(),
            turn.assessment().decision(),
            turn.scheduledBreakDue());
    }
}
