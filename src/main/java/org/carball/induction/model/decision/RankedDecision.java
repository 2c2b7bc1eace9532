package org.carball.induction.model.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One row of the ranked induction list.
 */
public record RankedDecision(
        int priorityRank,
        String trainId,
        String finalDecision,
        double fitnessScore,
        String depot,
        int mileage,
        int openWorkOrders,
        int recentDelays,
        boolean certValid,
        String reasoning,
        boolean manualOverride
) {

    public static final String INDUCT = "Induct";
    public static final String HOLD = "Hold";

    @JsonIgnore
    public boolean isInduct() {
        return INDUCT.equals(finalDecision);
    }
}
