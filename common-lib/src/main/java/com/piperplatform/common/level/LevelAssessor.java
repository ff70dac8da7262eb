package com.piperplatform.common.level;

import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.Signal;

import java.util.Set;

/**
 * Pure stateless classifier that maps a {@link BehaviorState} and the event's
 * {@link Signal}s to a {@link SafetyLevel}.
 *
 * <p>Rules (evaluated most-severe-first, first match wins):
 * <ol>
 *   <li>dysregulation &ge; 9, or acute distress with dysregulation &ge; 7 &rarr; {@link SafetyLevel#RED}</li>
 *   <li>acute distress, repetitive response, dysregulation &ge; 7, errors &ge; 5
 *       or fatigue &ge; 8 &rarr; {@link SafetyLevel#ORANGE}</li>
 *   <li>mild distress, engagement &le; 3, dysregulation &ge; 5, errors &ge; 3
 *       or fatigue &ge; 6 &rarr; {@link SafetyLevel#YELLOW}</li>
 *   <li>otherwise &rarr; {@link SafetyLevel#GREEN}</li>
 * </ol>
 *
 * <p>Acute distress is any of SCREAMING, CRYING, DISTRESS. Mild distress is any of
 * WANTS_BREAK, WANTS_QUIT, FRUSTRATION, PROLONGED_SILENCE.
 *
 * <p>No hidden memory: identical inputs always yield the same level.
 */
public final class LevelAssessor {

    static final double RED_DYSREGULATION               = 9.0;
    static final double RED_DYSREGULATION_WITH_DISTRESS = 7.0;

    static final double ORANGE_DYSREGULATION      = 7.0;
    static final int    ORANGE_CONSECUTIVE_ERRORS = 5;
    static final double ORANGE_FATIGUE            = 8.0;

    static final double YELLOW_ENGAGEMENT         = 3.0;
    static final double YELLOW_DYSREGULATION      = 5.0;
    static final int    YELLOW_CONSECUTIVE_ERRORS = 3;
    static final double YELLOW_FATIGUE            = 6.0;

    private LevelAssessor() {}

    public static SafetyLevel assess(BehaviorState state, Set<Signal> signals) {
        if (isRed(state, signals))    return SafetyLevel.RED;
        if (isOrange(state, signals)) return SafetyLevel.ORANGE;
        if (isYellow(state, signals)) return SafetyLevel.YELLOW;
        return SafetyLevel.GREEN;
    }

    static boolean isRed(BehaviorState state, Set<Signal> signals) {
        return state.dysregulationLevel() >= RED_DYSREGULATION
            || (hasAcuteDistress(signals) && state.dysregulationLevel() >= RED_DYSREGULATION_WITH_DISTRESS);
    }

    static boolean isOrange(BehaviorState state, Set<Signal> signals) {
        return hasAcuteDistress(signals)
            || signals.contains(Signal.REPETITIVE_RESPONSE)
            || state.dysregulationLevel() >= ORANGE_DYSREGULATION
            || state.consecutiveErrors() >= ORANGE_CONSECUTIVE_ERRORS
            || state.fatigueLevel() >= ORANGE_FATIGUE;
    }

    static boolean isYellow(BehaviorState state, Set<Signal> signals) {
        return signals.stream().anyMatch(Signal::isMildDistress)
            || state.engagementLevel() <= YELLOW_ENGAGEMENT
            || state.dysregulationLevel() >= YELLOW_DYSREGULATION
            || state.consecutiveErrors() >= YELLOW_CONSECUTIVE_ERRORS
            || state.fatigueLevel() >= YELLOW_FATIGUE;
    }

    private static boolean hasAcuteDistress(Set<Signal> signals) {
        return signals.stream().anyMatch(Signal::isAcuteDistress);
    }
}
