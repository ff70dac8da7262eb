package com.piperplatform.common.model;

import com.piperplatform.common.event.SafetyEvent;

import java.util.List;
import java.util.Set;

/**
 * Everything the deterministic half of the pipeline computed for one event,
 * before any text is generated.
 */
public record TurnAssessment(
    SafetyEvent        event,
    Set<Signal>        signals,
    BehaviorState      state,
    SafetyLevel        level,
    List<Intervention> interventions,
    SessionConfig      sessionConfig,
    Decision           decision
) {
    public static TurnAssessment of(SafetyEvent event, Set<Signal> signals, BehaviorState state,
                                    SafetyLevel level, List<Intervention> interventions,
                                    SessionConfig sessionConfig) {
        return new TurnAssessment(event, signals, state, level, interventions, sessionConfig,
            Decision.resolve(level, interventions));
    }
}
