package com.piperplatform.common.exception;

/**
 * The external generator or classifier failed: no key, transport error, timeout
 * or unparsable output. Always resolved by fallback, never shown to the child.
 */
public class GenerationException extends SafetyGateException {

    public GenerationException(String component, String message) {
        super(component, message);
    }

    public GenerationException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
