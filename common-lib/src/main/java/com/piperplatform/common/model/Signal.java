package com.piperplatform.common.model;

/**
 * Discrete behavioral indicator derived fresh for every event.
 *
 * <p>Signals are never stored across events; only their effects on
 * {@link BehaviorState} persist. Declaration order is the stable iteration
 * order used for logging and tests.
 */
public enum Signal {
    // audio cues, flagged upstream by amplitude analysis
    SCREAMING,
    CRYING,
    PROLONGED_SILENCE,

    // text cues, from the classifier or keyword rules
    WANTS_BREAK,
    WANTS_QUIT,
    FRUSTRATION,
    DISTRESS,

    // event pattern
    REPETITIVE_RESPONSE,

    // state-derived, appended after the state update
    CONSECUTIVE_ERRORS;

    /** Signals that indicate acute distress (screaming, crying, verbal distress). */
    public boolean isAcuteDistress() {
        return this == SCREAMING || this == CRYING || this == DISTRESS;
    }

    /** Signals that indicate mild distress or withdrawal. */
    public boolean isMildDistress() {
        return this == WANTS_BREAK || this == WANTS_QUIT
            || this == FRUSTRATION || this == PROLONGED_SILENCE;
    }
}
