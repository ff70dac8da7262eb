package com.piperplatform.common.model;

/**
 * Four-step ordered safety classification. Never stored; always recomputed
 * from the current {@link BehaviorState} and the event's signals.
 */
public enum SafetyLevel {
    GREEN,
    YELLOW,
    ORANGE,
    RED;

    public boolean isAtLeast(SafetyLevel other) {
        return compareTo(other) >= 0;
    }
}
