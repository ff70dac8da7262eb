package com.piperplatform.common.model;

import java.util.List;

/**
 * Coarse label for what the pipeline decided this turn. Observability only.
 */
public enum Decision {
    CALL_GROWNUP_IMMEDIATELY,
    TRIGGER_REGULATION_WITH_CHOICES,
    START_BREAK_NOW,
    ADAPT_AND_CONTINUE,
    CONTINUE_NORMAL;

    public static Decision resolve(SafetyLevel level, List<Intervention> interventions) {
        if (level == SafetyLevel.RED) {
            return CALL_GROWNUP_IMMEDIATELY;
        }
        if (interventions.contains(Intervention.BUBBLE_BREATHING)) {
            return TRIGGER_REGULATION_WITH_CHOICES;
        }
        if (interventions.contains(Intervention.START_BREAK)) {
            return START_BREAK_NOW;
        }
        if (level.isAtLeast(SafetyLevel.YELLOW)) {
            return ADAPT_AND_CONTINUE;
        }
        return CONTINUE_NORMAL;
    }
}
