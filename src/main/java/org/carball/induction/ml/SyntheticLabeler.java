package org.carball.induction.ml;

import org.carball.induction.model.train.TrainRecord;

import java.util.Random;

/**
 * Generates training labels from business rules when no ground truth exists.
 * Each label consumes exactly one draw from the supplied random source, so the
 * labels are reproducible only when that source is seeded.
 */
public class SyntheticLabeler {

    private final Random random;

    public SyntheticLabeler(Random random) {
        this.random = random;
    }

    /**
     * Rule score in [0, 1]; the label is 1 with this probability.
     */
    public static double score(TrainRecord train) {
        double score = 0.5;

        double fitness = train.getFitnessScore() != null ? train.getFitnessScore() : 70;
        if (fitness >= 90) {
            score += 0.3;
        } else if (fitness >= 80) {
            score += 0.1;
        } else if (fitness < 70) {
            score -= 0.4;
        }

        if (train.hasOpenWorkOrders()) {
            score -= 0.5;
        }

        if (train.isCertificateInvalid()) {
            score -= 0.6;
        }

        int delays = train.getRecentDelays() != null ? train.getRecentDelays() : 0;
        if (delays > 3) {
            score -= 0.2;
        } else if (delays == 0) {
            score += 0.1;
        }

        int daysSince = train.getDaysSinceMaintenance() != null ? train.getDaysSinceMaintenance() : 15;
        if (daysSince > 21) {
            score -= 0.1;
        } else if (daysSince < 7) {
            score += 0.1;
        }

        return Math.max(0, Math.min(1, score));
    }

    public int label(TrainRecord train) {
        return random.nextDouble() < score(train) ? 1 : 0;
    }
}
