package org.carball.induction.model.prediction;

public enum PredictorState {
    UNTRAINED,
    TRAINED
}
