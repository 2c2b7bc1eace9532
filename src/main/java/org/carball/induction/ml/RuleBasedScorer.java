package org.carball.induction.ml;

import org.carball.induction.model.prediction.PredictionResult;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic induction probability used while no model has been trained.
 */
public class RuleBasedScorer {

    static final double BLOCKED_PROBABILITY = 0.1;
    private static final double DEFAULT_FITNESS = 70;

    public double probability(TrainRecord train) {
        double fitness = train.getFitnessScore() != null ? train.getFitnessScore() : DEFAULT_FITNESS;

        double probability = 0.7;
        if (fitness >= 85) {
            probability = 0.9;
        } else if (fitness >= 75) {
            probability = 0.8;
        } else if (fitness < 65) {
            probability = 0.3;
        }

        // Blocking conditions win over any fitness tier
        if (train.hasOpenWorkOrders() || train.isCertificateInvalid()) {
            probability = BLOCKED_PROBABILITY;
        }
        return probability;
    }

    public List<PredictionResult> predict(TrainDataset dataset) {
        return dataset.stream()
                .map(train -> PredictionResult.fromProbability(train.getTrainId(), probability(train)))
                .collect(Collectors.toList());
    }
}
