package org.carball.induction.output;

import org.carball.induction.model.decision.OptimizationOutcome;
import org.carball.induction.model.decision.RankedDecision;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Joins train records with their decisions into the ranked induction list:
 * inducted trains first, then by fitness descending, ties kept in input order.
 */
public class DecisionAssembler {

    private static final String UNKNOWN_DEPOT = "Unknown";

    public List<RankedDecision> assemble(OptimizationOutcome outcome, TrainDataset dataset) {
        List<TrainRecord> ordered = new ArrayList<>(dataset.getRecords());
        // List.sort is stable, so equal keys keep input order
        ordered.sort(Comparator
                .comparingInt((TrainRecord train) -> outcome.decisionFor(train.getTrainId()))
                .reversed()
                .thenComparing(Comparator.comparingDouble((TrainRecord train) -> fitnessOf(train)).reversed()));

        List<RankedDecision> ranking = new ArrayList<>(ordered.size());
        int rank = 1;
        for (TrainRecord train : ordered) {
            String id = train.getTrainId();
            boolean induct = outcome.isInducted(id);
            ranking.add(new RankedDecision(
                    rank++,
                    id,
                    induct ? RankedDecision.INDUCT : RankedDecision.HOLD,
                    fitnessOf(train),
                    train.getDepot() != null ? train.getDepot() : UNKNOWN_DEPOT,
                    train.getMileage() != null ? train.getMileage() : 0,
                    train.getOpenWorkOrders() != null ? train.getOpenWorkOrders() : 0,
                    train.getRecentDelays() != null ? train.getRecentDelays() : 0,
                    !train.isCertificateInvalid(),
                    outcome.getReasoning().getOrDefault(id, "No reasoning available"),
                    outcome.isOverridden(id)));
        }
        return ranking;
    }

    private static double fitnessOf(TrainRecord train) {
        return train.getFitnessScore() != null ? train.getFitnessScore() : 0.0;
    }
}
