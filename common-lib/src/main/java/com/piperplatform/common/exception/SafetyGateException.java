package com.piperplatform.common.exception;

public class SafetyGateException extends RuntimeException {
    private final String component;

    public SafetyGateException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SafetyGateException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
