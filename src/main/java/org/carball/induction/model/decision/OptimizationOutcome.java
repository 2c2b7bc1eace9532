package org.carball.induction.model.decision;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Result of one optimization run, possibly with manual overrides applied.
 * Decision values are 1 (induct) or 0 (hold), keyed by train identifier in
 * input order.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationOutcome {
    SolveStatus status;
    DecisionSource source;
    Double objectiveValue;
    int targetInductions;
    Map<String, Integer> decisions;
    Map<String, String> reasoning;
    Set<String> overriddenTrains;
    DecisionSummary summary;

    public int decisionFor(String trainId) {
        return decisions.getOrDefault(trainId, 0);
    }

    public boolean isInducted(String trainId) {
        return decisionFor(trainId) == 1;
    }

    public boolean isFallback() {
        return source == DecisionSource.PREDICTOR_FALLBACK;
    }

    public boolean constraintsSatisfied() {
        return status != null && status.isOptimal();
    }

    public boolean isOverridden(String trainId) {
        return overriddenTrains.contains(trainId);
    }
}
