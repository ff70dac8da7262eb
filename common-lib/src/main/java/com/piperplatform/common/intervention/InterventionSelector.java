package com.piperplatform.common.intervention;

import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.Intervention;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps a {@link SafetyLevel} (plus state) to the ordered list of interventions
 * offered to the child. The first entry is presented first.
 *
 * <pre>
 * GREEN  : RETRY_CARD
 * YELLOW : SKIP_CARD, RETRY_CARD
 * ORANGE : [BUBBLE_BREATHING if dysregulation &ge; 4], RETRY_CARD, START_BREAK,
 *          [SKIP_CARD if consecutiveErrors &ge; 3]
 * RED    : BUBBLE_BREATHING, SKIP_CARD, RETRY_CARD, START_BREAK, CALL_GROWNUP
 * </pre>
 */
public final class InterventionSelector {

    static final double BREATHING_DYSREGULATION = 4.0;
    static final int    SKIP_CONSECUTIVE_ERRORS = 3;

    private InterventionSelector() {}

    /**
     * @param signals currently unused by the rules; part of the contract so
     *                signal-driven additions stay local to this class
     * @return immutable, ordered, duplicate-free list
     */
    public static List<Intervention> select(SafetyLevel level, BehaviorState state, Set<Signal> signals) {
        return switch (level) {
            case GREEN  -> List.of(Intervention.RETRY_CARD);
            case YELLOW -> List.of(Intervention.SKIP_CARD, Intervention.RETRY_CARD);
            case ORANGE -> orange(state);
            case RED    -> List.of(Intervention.BUBBLE_BREATHING, Intervention.SKIP_CARD,
                                   Intervention.RETRY_CARD, Intervention.START_BREAK,
                                   Intervention.CALL_GROWNUP);
        };
    }

    private static List<Intervention> orange(BehaviorState state) {
        List<Intervention> interventions = new ArrayList<>(4);
        if (state.dysregulationLevel() >= BREATHING_DYSREGULATION) {
            interventions.add(Intervention.BUBBLE_BREATHING);
        }
        interventions.add(Intervention.RETRY_CARD);
        interventions.add(Intervention.START_BREAK);
        if (state.consecutiveErrors() >= SKIP_CONSECUTIVE_ERRORS) {
            interventions.add(Intervention.SKIP_CARD);
        }
        return List.copyOf(interventions);
    }
}
