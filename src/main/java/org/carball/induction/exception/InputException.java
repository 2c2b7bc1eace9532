package org.carball.induction.exception;

/**
 * Structurally invalid train dataset: empty where rows are required, missing or
 * duplicate identifiers, or an unreadable source.
 */
public class InputException extends PlannerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-IN-001";

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
