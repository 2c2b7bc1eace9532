package org.carball.induction.model.decision;

/**
 * Which path produced the decision map of an outcome.
 */
public enum DecisionSource {
    /** Decisions read from an optimal integer program solution. */
    OPTIMIZER,
    /** Solver was not optimal; decisions copied from the predictor's labels. */
    PREDICTOR_FALLBACK
}
