package org.carball.induction.model.decision;

/**
 * Operator decision for one train. {@code decision} is 1 to induct, 0 to hold.
 */
public record ManualOverride(String trainId, int decision, String reason) {

    public ManualOverride {
        if (decision != 0 && decision != 1) {
            throw new IllegalArgumentException("Override decision must be 0 or 1, got " + decision);
        }
    }
}
