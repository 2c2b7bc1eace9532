package org.carball.induction.exception;

import lombok.Getter;

/**
 * Training data below the minimum viable size or carrying a single label class.
 */
@Getter
public class InsufficientDataException extends PlannerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-ML-001";

    private final int sampleCount;

    public InsufficientDataException(String message, int sampleCount) {
        super(message);
        this.sampleCount = sampleCount;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
