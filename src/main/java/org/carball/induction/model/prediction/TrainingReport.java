package org.carball.induction.model.prediction;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Metrics produced by one training run.
 */
@Value
@Builder
public class TrainingReport {
    ModelType modelType;
    double accuracy;
    double cvMean;
    double cvStd;
    int cvFolds;
    double precision;
    double recall;
    double f1;

    /** Permutation importance per feature, ranked descending, summing to 1 when non-empty. */
    Map<String, Double> featureImportance;

    /** Rows are actual class (hold, induct), columns predicted class. */
    int[][] confusionMatrix;

    int trainingSize;
    int testSize;
    boolean stratified;
    LabelSource labelSource;
    Instant trainedAt;
}
