package org.carball.induction.exception;

/**
 * The underlying learning library failed while fitting or scoring a model.
 */
public class PredictionException extends PlannerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-ML-003";

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
