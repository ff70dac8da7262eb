package com.piperplatform.common.state;

import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.exception.StateInvariantException;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.Signal;
import com.piperplatform.common.signal.SignalDetector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

import static com.piperplatform.common.state.StateModifiers.*;

/**
 * Owns the continuous per-session {@link BehaviorState} and applies the
 * deterministic transition rules.
 *
 * <p>Transition order for {@link #processEvent}:
 * <ol>
 *   <li>event delta (correct / incorrect / inactivity, triple repetition)</li>
 *   <li>signal deltas, additive for every signal present</li>
 *   <li>clamp engagement, dysregulation and fatigue to [0, 10]</li>
 *   <li>advance the session timers by wall-clock delta and recompute error frequency</li>
 * </ol>
 *
 * <p>Not thread-safe: one instance per session, mutated only from that session's
 * serialized handler. No logging, no I/O; time comes from the injected {@link Clock}.
 */
public class StateEngine {

    private final Clock clock;
    private final Deque<Instant> errorHistory = new ArrayDeque<>();

    private BehaviorState state;
    private Instant lastActivity;

    public StateEngine(Clock clock) {
        this(clock, BehaviorState.initial());
    }

    public StateEngine(Clock clock, BehaviorState initialState) {
        this.clock        = clock;
        this.state        = initialState;
        this.lastActivity = clock.instant();
        verifyInvariants(initialState);
    }

    /**
     * Applies one event and its signals, returning the new snapshot.
     */
    public BehaviorState processEvent(SafetyEvent event, Set<Signal> signals) {
        Instant now = clock.instant();

        double engagement    = state.engagementLevel();
        double dysregulation = state.dysregulationLevel();
        double fatigue       = state.fatigueLevel();
        int    errors        = state.consecutiveErrors();

        // 1. event delta
        switch (event.type()) {
            case RESPONSE_RECEIVED -> {
                if (event.correct()) {
                    errors = 0;
                    engagement    += CORRECT_ENGAGEMENT;
                    dysregulation += CORRECT_DYSREGULATION;
                } else {
                    errors++;
                    errorHistory.addLast(now);
                    engagement += INCORRECT_ENGAGEMENT;
                    if (isTripleRepetition(event)) {
                        dysregulation += TRIPLE_REPEAT_DYSREGULATION;
                    }
                }
            }
            case INACTIVITY_FIRED -> engagement += INACTIVE_ENGAGEMENT;
        }

        // 2. signal deltas
        for (Signal signal : signals) {
            switch (signal) {
                case SCREAMING   -> dysregulation += SCREAMING_DYSREGULATION;
                case CRYING      -> dysregulation += CRYING_DYSREGULATION;
                case DISTRESS    -> dysregulation += DISTRESS_DYSREGULATION;
                case FRUSTRATION -> dysregulation += FRUSTRATION_DYSREGULATION;
                case WANTS_QUIT  -> engagement    += WANTS_QUIT_ENGAGEMENT;
                case WANTS_BREAK -> fatigue       += WANTS_BREAK_FATIGUE;
                case PROLONGED_SILENCE, REPETITIVE_RESPONSE, CONSECUTIVE_ERRORS -> { /* level only */ }
            }
        }

        // 3. clamp
        engagement    = clamp(engagement);
        dysregulation = clamp(dysregulation);
        fatigue       = clamp(fatigue);

        // 4. timers and error frequency
        double elapsed = secondsBetween(lastActivity, now);
        lastActivity = now;

        BehaviorState next = new BehaviorState(
            engagement, dysregulation, fatigue, errors,
            errorFrequency(now),
            state.timeInSession() + elapsed,
            state.timeSinceBreak() + elapsed);

        verifyInvariants(next);
        state = next;
        return next;
    }

    /**
     * Break-taken transition, applied when a START_BREAK or BUBBLE_BREATHING
     * activity is resolved. Not driven by a normal event.
     */
    public BehaviorState applyBreakTaken() {
        Instant now = clock.instant();
        double elapsed = secondsBetween(lastActivity, now);
        lastActivity = now;

        BehaviorState next = new BehaviorState(
            state.engagementLevel(),
            clamp(state.dysregulationLevel() + BREAK_DYSREGULATION),
            clamp(state.fatigueLevel() + BREAK_FATIGUE),
            state.consecutiveErrors(),
            errorFrequency(now),
            state.timeInSession() + elapsed,
            0.0);

        verifyInvariants(next);
        state = next;
        return next;
    }

    public BehaviorState getState() {
        return state;
    }

    /**
     * Replaces the current snapshot. Used by therapist tooling and tests to
     * seed a state; the invariants are still enforced.
     */
    public void overrideState(BehaviorState newState) {
        verifyInvariants(newState);
        this.state = newState;
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static boolean isTripleRepetition(SafetyEvent event) {
        return SignalDetector.sameAnswer(event.response(), event.previousResponse())
            && SignalDetector.sameAnswer(event.previousResponse(), event.previousPreviousResponse());
    }

    private double errorFrequency(Instant now) {
        Instant cutoff = now.minusSeconds(ERROR_WINDOW_SECONDS);
        while (!errorHistory.isEmpty() && !errorHistory.peekFirst().isAfter(cutoff)) {
            errorHistory.removeFirst();
        }
        // window is exactly one minute, so the count is the per-minute rate
        return errorHistory.size();
    }

    private static double secondsBetween(Instant from, Instant to) {
        long millis = Duration.between(from, to).toMillis();
        return Math.max(0L, millis) / 1000.0;
    }

    private static double clamp(double value) {
        return Math.max(BehaviorState.LEVEL_MIN, Math.min(BehaviorState.LEVEL_MAX, value));
    }

    static void verifyInvariants(BehaviorState s) {
        checkLevel("engagementLevel", s.engagementLevel());
        checkLevel("dysregulationLevel", s.dysregulationLevel());
        checkLevel("fatigueLevel", s.fatigueLevel());
        if (s.consecutiveErrors() < 0) {
            throw new StateInvariantException("consecutiveErrors negative: " + s.consecutiveErrors());
        }
        if (s.errorFrequency() < 0 || s.timeInSession() < 0 || s.timeSinceBreak() < 0) {
            throw new StateInvariantException("negative counter in " + s);
        }
    }

    private static void checkLevel(String field, double value) {
        if (Double.isNaN(value) || value < BehaviorState.LEVEL_MIN || value > BehaviorState.LEVEL_MAX) {
            throw new StateInvariantException(field + " out of [0,10]: " + value);
        }
    }
}
