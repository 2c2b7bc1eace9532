package org.carball.induction.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.induction.model.prediction.ModelType;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@Slf4j
public class PlannerSettings {

    // Induction target
    @Builder.Default
    private int targetInductions = 25;

    // Objective weights (shunting is subtracted)
    @Builder.Default
    private double servicePriorityWeight = 0.30;

    @Builder.Default
    private double mileageBalanceWeight = 0.25;

    @Builder.Default
    private double shuntingCostWeight = 0.30;

    @Builder.Default
    private double depotEfficiencyWeight = 0.15;

    // Depots
    @Builder.Default
    private Map<String, Integer> depotCapacities = defaultDepotCapacities();

    @Builder.Default
    private int defaultDepotCapacity = 10;

    // Solver
    @Builder.Default
    private String solverId = "SCIP";

    @Builder.Default
    private int solverTimeoutSeconds = 60;

    @Builder.Default
    private double mipGap = 0.01;

    // Predictor
    @Builder.Default
    private ModelType modelType = ModelType.RANDOM_FOREST;

    @Builder.Default
    private double testFraction = 0.2;

    @Builder.Default
    private int cvFolds = 5;

    @Builder.Default
    private long randomSeed = 42L;

    @Builder.Default
    private int minTrainingSamples = 10;

    @Builder.Default
    private String modelPath = "train_induction_model.ser";

    @Builder.Default
    private boolean timeFeatures = true;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced planning settings";

    public static PlannerSettings defaults() {
        return PlannerSettings.builder().build();
    }

    public static Map<String, Integer> defaultDepotCapacities() {
        Map<String, Integer> capacities = new LinkedHashMap<>();
        capacities.put("Aluva", 12);
        capacities.put("Palarivattom", 8);
        capacities.put("Kalamassery", 5);
        return capacities;
    }

    public int capacityOf(String depot) {
        if (depot == null) {
            return defaultDepotCapacity;
        }
        return depotCapacities.getOrDefault(depot, defaultDepotCapacity);
    }

    /**
     * Logs warnings for values that are legal but probably unintended.
     */
    public void validate() {
        double weightSum = servicePriorityWeight + mileageBalanceWeight + shuntingCostWeight + depotEfficiencyWeight;
        if (Math.abs(weightSum - 1.0) > 0.01) {
            log.warn("Objective weights sum to {} rather than 1.0", String.format("%.2f", weightSum));
        }

        if (targetInductions <= 0) {
            log.warn("Target inductions ({}) should be positive", targetInductions);
        }

        if (mipGap < 0 || mipGap >= 1) {
            log.warn("MIP gap ({}) should lie in [0, 1)", mipGap);
        }

        if (solverTimeoutSeconds <= 0) {
            log.warn("Solver timeout ({}s) should be positive", solverTimeoutSeconds);
        }

        depotCapacities.forEach((depot, capacity) -> {
            if (capacity <= 0) {
                log.warn("Depot {} has non-positive capacity ({})", depot, capacity);
            }
        });

        if (cvFolds < 2) {
            log.warn("Cross-validation folds ({}) should be at least 2", cvFolds);
        }

        if (testFraction <= 0 || testFraction >= 1) {
            log.warn("Test fraction ({}) should lie in (0, 1)", testFraction);
        }

        log.debug("Using settings - Target: {}, Solver: {}, Model: {}, Profile: {}",
                targetInductions, solverId, modelType, profileName);
    }

    public String getConfigurationSummary() {
        return String.format(
                "Profile: %s | Target: %d | Weights: service=%.2f, mileage=%.2f, shunting=%.2f, depot=%.2f | " +
                "Solver: %s (%ds, gap=%.3f) | Model: %s, seed=%d",
                profileName, targetInductions,
                servicePriorityWeight, mileageBalanceWeight, shuntingCostWeight, depotEfficiencyWeight,
                solverId, solverTimeoutSeconds, mipGap,
                modelType.getConfigName(), randomSeed);
    }
}
