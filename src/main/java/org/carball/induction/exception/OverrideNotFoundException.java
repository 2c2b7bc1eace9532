package org.carball.induction.exception;

import lombok.Getter;

/**
 * Manual override targeting a train that is not part of the current plan.
 */
@Getter
public class OverrideNotFoundException extends PlannerException {
    private static final String DEFAULT_ERROR_CODE = "ERR-OVR-001";

    private final String trainId;

    public OverrideNotFoundException(String trainId) {
        super(String.format("Train %s not found in current induction plan", trainId));
        this.trainId = trainId;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
