package com.churnguard.common.exception;

/**
 * Base for failures raised by the intervention engine. The message is prefixed with
 * the component that raised it, e.g. {@code [sentinel] cycle already running}.
 */
public class InterventionEngineException extends RuntimeException {

    private final String component;

    public InterventionEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public InterventionEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
