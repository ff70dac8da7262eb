package com.piperplatform.common.planner;

import com.piperplatform.common.model.AvatarTone;
import com.piperplatform.common.model.BehaviorState;
import com.piperplatform.common.model.SafetyLevel;
import com.piperplatform.common.model.SessionConfig;

import java.time.Duration;

/**
 * Total lookup from {@link SafetyLevel} to {@link SessionConfig}, plus the
 * periodic break rule.
 *
 * <pre>
 * level   intensity  tone   maxTask  inactivity
 * GREEN   2          warm   60s      30s
 * YELLOW  1          calm   45s      25s
 * ORANGE  0          calm   30s      20s
 * RED     0          calm   60s      15s
 * </pre>
 */
public final class SessionPlanner {

    private static final SessionConfig GREEN  = new SessionConfig(2, AvatarTone.WARM, 60, 30);
    private static final SessionConfig YELLOW = new SessionConfig(1, AvatarTone.CALM, 45, 25);
    private static final SessionConfig ORANGE = new SessionConfig(0, AvatarTone.CALM, 30, 20);
    private static final SessionConfig RED    = new SessionConfig(0, AvatarTone.CALM, 60, 15);

    private SessionPlanner() {}

    public static SessionConfig plan(SafetyLevel level) {
        return switch (level) {
            case GREEN  -> GREEN;
            case YELLOW -> YELLOW;
            case ORANGE -> ORANGE;
            case RED    -> RED;
        };
    }

    /** Config used before the first event of a session. */
    public static SessionConfig initial() {
        return GREEN;
    }

    /**
     * True once the time since the last break reaches a third of the planned session length.
     */
    public static boolean shouldTriggerScheduledBreak(BehaviorState state, Duration sessionDuration) {
        double breakInterval = sessionDuration.toMillis() / 1000.0 / 3.0;
        return state.timeSinceBreak() >= breakInterval;
    }
}
