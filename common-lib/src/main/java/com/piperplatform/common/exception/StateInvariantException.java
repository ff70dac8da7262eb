package com.piperplatform.common.exception;

/**
 * A bounded state field left its declared range. Programmer error: raised, never clamped away.
 */
public class StateInvariantException extends SafetyGateException {

    public StateInvariantException(String message) {
        super("StateEngine", message);
    }
}
