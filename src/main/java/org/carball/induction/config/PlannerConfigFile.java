package org.carball.induction.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.induction.model.prediction.ModelType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML representation of planner settings. Every field is optional; only the
 * keys present in the file override the settings they are applied to.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlannerConfigFile {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("optimization")
    private Optimization optimization;

    @JsonProperty("ml_model")
    private MlModel mlModel;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Optimization {
        @JsonProperty("target_inductions")
        private Integer targetInductions;

        @JsonProperty("optimization_weights")
        private Weights weights;

        @JsonProperty("depot_capacities")
        private Map<String, Integer> depotCapacities;

        @JsonProperty("default_depot_capacity")
        private Integer defaultDepotCapacity;

        @JsonProperty("solver")
        private String solver;

        @JsonProperty("solver_timeout")
        private Integer solverTimeout;

        @JsonProperty("mip_gap")
        private Double mipGap;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Weights {
        @JsonProperty("service_priority")
        private Double servicePriority;

        @JsonProperty("mileage_balance")
        private Double mileageBalance;

        @JsonProperty("shunting_cost")
        private Double shuntingCost;

        @JsonProperty("depot_efficiency")
        private Double depotEfficiency;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MlModel {
        @JsonProperty("model_type")
        private String modelType;

        @JsonProperty("train_test_split")
        private Double testFraction;

        @JsonProperty("cross_validation_folds")
        private Integer cvFolds;

        @JsonProperty("random_state")
        private Long randomSeed;

        @JsonProperty("min_training_samples")
        private Integer minTrainingSamples;

        @JsonProperty("model_path")
        private String modelPath;

        @JsonProperty("time_features")
        private Boolean timeFeatures;
    }

    /**
     * Copies every value present in this file onto {@code builder}.
     */
    public void applyTo(PlannerSettings.PlannerSettingsBuilder builder) {
        if (optimization != null) {
            if (optimization.targetInductions != null) {
                builder.targetInductions(optimization.targetInductions);
            }
            if (optimization.weights != null) {
                Weights w = optimization.weights;
                if (w.servicePriority != null) {
                    builder.servicePriorityWeight(w.servicePriority);
                }
                if (w.mileageBalance != null) {
                    builder.mileageBalanceWeight(w.mileageBalance);
                }
                if (w.shuntingCost != null) {
                    builder.shuntingCostWeight(w.shuntingCost);
                }
                if (w.depotEfficiency != null) {
                    builder.depotEfficiencyWeight(w.depotEfficiency);
                }
            }
            if (optimization.depotCapacities != null && !optimization.depotCapacities.isEmpty()) {
                builder.depotCapacities(new LinkedHashMap<>(optimization.depotCapacities));
            }
            if (optimization.defaultDepotCapacity != null) {
                builder.defaultDepotCapacity(optimization.defaultDepotCapacity);
            }
            if (optimization.solver != null) {
                builder.solverId(optimization.solver);
            }
            if (optimization.solverTimeout != null) {
                builder.solverTimeoutSeconds(optimization.solverTimeout);
            }
            if (optimization.mipGap != null) {
                builder.mipGap(optimization.mipGap);
            }
        }

        if (mlModel != null) {
            if (mlModel.modelType != null) {
                builder.modelType(ModelType.fromName(mlModel.modelType));
            }
            if (mlModel.testFraction != null) {
                builder.testFraction(mlModel.testFraction);
            }
            if (mlModel.cvFolds != null) {
                builder.cvFolds(mlModel.cvFolds);
            }
            if (mlModel.randomSeed != null) {
                builder.randomSeed(mlModel.randomSeed);
            }
            if (mlModel.minTrainingSamples != null) {
                builder.minTrainingSamples(mlModel.minTrainingSamples);
            }
            if (mlModel.modelPath != null) {
                builder.modelPath(mlModel.modelPath);
            }
            if (mlModel.timeFeatures != null) {
                builder.timeFeatures(mlModel.timeFeatures);
            }
        }
    }
}
