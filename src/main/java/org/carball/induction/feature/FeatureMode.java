package org.carball.induction.feature;

public enum FeatureMode {
    /** Registers new categories and records the emitted column order. */
    TRAINING,
    /** Frozen encoders; output aligned to the recorded column order. */
    PREDICTION
}
