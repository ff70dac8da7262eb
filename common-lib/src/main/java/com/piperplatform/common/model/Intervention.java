package com.piperplatform.common.model;

import java.util.Locale;

/**
 * Closed set of corrective actions that can be offered to the child.
 */
public enum Intervention {
    RETRY_CARD,
    SKIP_CARD,
    BUBBLE_BREATHING,
    START_BREAK,
    CALL_GROWNUP;

    /** Regulation activities whose completion applies the break-taken transition. */
    public boolean isRegulationActivity() {
        return this == START_BREAK || this == BUBBLE_BREATHING;
    }

    /**
     * Parses a choice action coming from the transport layer.
     *
     * @throws IllegalArgumentException for an unknown or blank action
     */
    public static Intervention fromAction(String action) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Choice action must not be blank");
        }
        return Intervention.valueOf(action.trim().toUpperCase(Locale.ROOT));
    }
}
