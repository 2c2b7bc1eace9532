package org.carball.induction.session;

import org.carball.induction.model.decision.DecisionSource;
import org.carball.induction.model.decision.SolveStatus;
import org.carball.induction.model.prediction.PredictorState;

import java.time.Instant;

/**
 * Snapshot of a planning session for health and status displays.
 * Plan fields are null until the first plan has been produced.
 */
public record SessionStatus(
        int trainsLoaded,
        PredictorState predictorState,
        Instant modelTrainedAt,
        boolean planAvailable,
        SolveStatus solveStatus,
        DecisionSource decisionSource,
        Integer trainsInducted,
        int manualOverrides
) {
}
