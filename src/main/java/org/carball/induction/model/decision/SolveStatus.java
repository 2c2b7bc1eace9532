package org.carball.induction.model.decision;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    TIMEOUT,
    ERROR;

    public boolean isOptimal() {
        return this == OPTIMAL;
    }
}
