package org.carball.induction.exception;

import lombok.Getter;
import org.carball.induction.model.decision.SolveStatus;

/**
 * The integer program did not reach an optimal solution. Never escapes the
 * optimizer: it selects the predictor fallback path instead.
 */
@Getter
public class SolverNonOptimalException extends PlannerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-OPT-001";

    private final SolveStatus status;

    public SolverNonOptimalException(SolveStatus status, String message) {
        super(message);
        this.status = status;
    }

    public SolverNonOptimalException(SolveStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
