package org.carball.induction.exception;

import lombok.Getter;

/**
 * Base exception for the induction planner. Carries an error code so callers
 * can map failures without inspecting message text.
 */
@Getter
public abstract class PlannerException extends RuntimeException {

    private final String errorCode;

    protected PlannerException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected PlannerException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass provides its own default error code.
     */
    protected abstract String getDefaultErrorCode();
}
