package com.pokerplatform.common.exception;

/**
 * Programmer-error class failure of a decision cycle, e.g. a required collaborator was
 * never wired. Subsystem failures never surface as this exception.
 */
public class DecisionPipelineException extends RuntimeException {
    private final String component;

    public DecisionPipelineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public DecisionPipelineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
