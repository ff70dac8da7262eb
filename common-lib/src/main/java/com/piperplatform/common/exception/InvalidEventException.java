package com.piperplatform.common.exception;

/**
 * A malformed event rejected before it enters the pipeline. Caller's responsibility.
 */
public class InvalidEventException extends SafetyGateException {

    public InvalidEventException(String message) {
        super("SafetyEvent", message);
    }
}
