package org.carball.induction.optimizer;

import org.carball.induction.model.train.TrainRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable rationale for a single induct or hold decision.
 */
public class ReasoningGenerator {

    public static final String INDUCTED = "Inducted";
    public static final String HELD = "Held";
    public static final String RESIDUAL_CHOICE = "Residual optimization choice";
    public static final String OVERRIDE_MARKER = "Manual override";

    /**
     * Lists the factors supporting {@code decision}. A null probability means
     * the predictor had no opinion for this train.
     */
    public String explain(TrainRecord train, int decision, Double probability) {
        List<String> factors = decision == 1 ? inductFactors(train, probability) : holdFactors(train, probability);
        if (factors.isEmpty()) {
            factors.add(RESIDUAL_CHOICE);
        }
        return action(decision) + ": " + String.join(", ", factors);
    }

    /**
     * Reasoning that replaces the computed rationale after an operator changes a decision.
     */
    public String explainOverride(int decision, String reason) {
        if (reason == null || reason.isBlank() || reason.trim().equalsIgnoreCase(OVERRIDE_MARKER)) {
            return action(decision) + ": " + OVERRIDE_MARKER + " by operator";
        }
        return action(decision) + ": " + OVERRIDE_MARKER + " (" + reason.trim() + ")";
    }

    public static boolean isOverrideReasoning(String reasoning) {
        return reasoning != null && reasoning.contains(OVERRIDE_MARKER);
    }

    private static String action(int decision) {
        return decision == 1 ? INDUCTED : HELD;
    }

    private static List<String> inductFactors(TrainRecord train, Double probability) {
        List<String> factors = new ArrayList<>();
        if (train.getFitnessScore() != null && train.getFitnessScore() >= 85) {
            factors.add(String.format("High fitness score (%.1f)", train.getFitnessScore()));
        }
        if (!train.hasOpenWorkOrders()) {
            factors.add("No open work orders");
        }
        if (Boolean.TRUE.equals(train.getCertValid())) {
            factors.add("Valid fitness certificate");
        }
        if (train.getRecentDelays() == null || train.getRecentDelays() == 0) {
            factors.add("No recent service delays");
        }
        if (probability != null && probability > 0.7) {
            factors.add(String.format("ML model recommends induction (%.2f confidence)", probability));
        }
        return factors;
    }

    private static List<String> holdFactors(TrainRecord train, Double probability) {
        List<String> factors = new ArrayList<>();
        if (train.hasOpenWorkOrders()) {
            factors.add("Open work orders (" + train.getOpenWorkOrders() + ")");
        }
        if (train.isCertificateInvalid()) {
            factors.add("Invalid/expired fitness certificate");
        }
        if (train.getFitnessScore() != null && train.getFitnessScore() < 70) {
            factors.add(String.format("Low fitness score (%.1f)", train.getFitnessScore()));
        }
        if (train.getRecentDelays() != null && train.getRecentDelays() > 2) {
            factors.add("Multiple recent delays (" + train.getRecentDelays() + ")");
        }
        if (train.getMechanicalIssues() != null && train.getMechanicalIssues() > 0) {
            factors.add("Mechanical issues (" + train.getMechanicalIssues() + ")");
        }
        if (probability != null && probability < 0.3) {
            factors.add("ML model recommends holding");
        }
        return factors;
    }
}
