package org.carball.induction.exception;

/**
 * Model artifact missing, corrupt, or inconsistent with itself.
 */
public class ModelLoadException extends PlannerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-ML-002";

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
