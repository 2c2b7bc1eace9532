package org.carball.induction.model.prediction;

/**
 * Where the training labels came from.
 */
public enum LabelSource {
    PROVIDED,
    SYNTHETIC,
    MIXED
}
