package org.carball.induction.model.prediction;

/**
 * Induction propensity for one train.
 *
 * @param predictedLabel 1 to induct, 0 to hold
 * @param probability    estimated induction probability in [0, 1]
 * @param confidence     {@code |probability - 0.5| * 2}
 */
public record PredictionResult(String trainId, int predictedLabel, double probability, double confidence) {

    /**
     * Derives label and confidence from the probability.
     */
    public static PredictionResult fromProbability(String trainId, double probability) {
        double p = Math.max(0.0, Math.min(1.0, probability));
        return new PredictionResult(trainId, p > 0.5 ? 1 : 0, p, Math.abs(p - 0.5) * 2);
    }

    public boolean recommendsInduction() {
        return predictedLabel == 1;
    }
}
