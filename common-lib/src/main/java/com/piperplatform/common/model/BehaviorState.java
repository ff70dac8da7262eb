package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of a session's continuous behavioral estimate.
 *
 * <p>The live state is owned by {@link com.piperplatform.common.state.StateEngine};
 * every value handed out of the engine is one of these snapshots.
 *
 * <ul>
 *   <li>{@code engagementLevel}, {@code dysregulationLevel}, {@code fatigueLevel} in [0, 10]</li>
 *   <li>{@code consecutiveErrors} reset to 0 by a correct response</li>
 *   <li>{@code errorFrequency} errors per minute over a trailing 60 s window</li>
 *   <li>{@code timeInSession}, {@code timeSinceBreak} elapsed seconds</li>
 * </ul>
 */
public record BehaviorState(
    @JsonProperty("engagementLevel")    double engagementLevel,
    @JsonProperty("dysregulationLevel") double dysregulationLevel,
    @JsonProperty("fatigueLevel")       double fatigueLevel,
    @JsonProperty("consecutiveErrors")  int    consecutiveErrors,
    @JsonProperty("errorFrequency")     double errorFrequency,
    @JsonProperty("timeInSession")      double timeInSession,
    @JsonProperty("timeSinceBreak")     double timeSinceBreak
) {
    public static final double LEVEL_MIN = 0.0;
    public static final double LEVEL_MAX = 10.0;

    /** Start optimistic, start calm, start fresh. */
    public static BehaviorState initial() {
        return new BehaviorState(8.0, 1.0, 1.0, 0, 0.0, 0.0, 0.0);
    }

    public BehaviorState withDysregulation(double value) {
        return new BehaviorState(engagementLevel, value, fatigueLevel, consecutiveErrors,
            errorFrequency, timeInSession, timeSinceBreak);
    }

    public BehaviorState withEngagement(double value) {
        return new BehaviorState(value, dysregulationLevel, fatigueLevel, consecutiveErrors,
            errorFrequency, timeInSession, timeSinceBreak);
    }

    public BehaviorState withFatigue(double value) {
        return new BehaviorState(engagementLevel, dysregulationLevel, value, consecutiveErrors,
            errorFrequency, timeInSession, timeSinceBreak);
    }

    public BehaviorState withConsecutiveErrors(int value) {
        return new BehaviorState(engagementLevel, dysregulationLevel, fatigueLevel, value,
            errorFrequency, timeInSession, timeSinceBreak);
    }
}
