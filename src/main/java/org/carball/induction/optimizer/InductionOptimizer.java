package org.carball.induction.optimizer;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;
import org.carball.induction.config.PlannerSettings;
import org.carball.induction.exception.InputException;
import org.carball.induction.exception.SolverNonOptimalException;
import org.carball.induction.model.decision.DecisionSource;
import org.carball.induction.model.decision.DecisionSummary;
import org.carball.induction.model.decision.ManualOverride;
import org.carball.induction.model.decision.OptimizationOutcome;
import org.carball.induction.model.decision.SolveStatus;
import org.carball.induction.model.prediction.PredictionResult;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses which trains to induct by solving a 0/1 integer program over the
 * fleet, falling back to the predictor's labels when no optimal solution is found.
 */
@Slf4j
public class InductionOptimizer {

    static final double DEFAULT_PROBABILITY = 0.5;
    static final double DEFAULT_FITNESS = 70;
    static final double DEFAULT_BRANDING_HOURS = 50;
    static final double DEFAULT_ON_TIME_PERFORMANCE = 90;
    static final String UNKNOWN_DEPOT = "Unknown";

    private static final double EXCLUSION_FITNESS = 60;
    private static final double GOOD_ON_TIME_PERFORMANCE = 90;
    private static final double HIGH_MILEAGE_PERCENTILE = 0.8;
    private static final double HIGH_MILEAGE_SHARE = 0.4;
    private static final double GOOD_OTP_SHARE = 0.6;
    private static final int TARGET_SLACK = 10;
    private static final double SHUNTING_COST_PER_POSITION = 5;
    private static final double DEPOT_FILL_RATIO = 0.8;
    private static final double DEPOT_BONUS_PER_SLOT = 2;

    private final PlannerSettings settings;
    private final ReasoningGenerator reasoningGenerator;

    public InductionOptimizer(PlannerSettings settings) {
        this(settings, new ReasoningGenerator());
    }

    public InductionOptimizer(PlannerSettings settings, ReasoningGenerator reasoningGenerator) {
        this.settings = settings;
        this.reasoningGenerator = reasoningGenerator;
    }

    /**
     * Produces a decision for every train. Never fails on solver problems: a
     * non-optimal solve is reported through the outcome's status and source.
     *
     * @throws InputException if the dataset is empty
     */
    public OptimizationOutcome optimize(TrainDataset dataset, List<PredictionResult> predictions, int targetInductions) {
        if (dataset == null || dataset.isEmpty()) {
            throw new InputException("Cannot optimize an empty train dataset");
        }

        Map<String, PredictionResult> byTrain = new HashMap<>();
        if (predictions != null) {
            for (PredictionResult prediction : predictions) {
                byTrain.put(prediction.trainId(), prediction);
            }
        }

        FleetModel fleet = new FleetModel(dataset, byTrain, targetInductions, settings);
        if (fleet.eligibleCount() < targetInductions) {
            log.warn("Only {} trains are eligible for induction, below the target of {}",
                    fleet.eligibleCount(), targetInductions);
        }

        SolveStatus status;
        DecisionSource source;
        Double objectiveValue = null;
        Map<String, Integer> decisions;
        try {
            Solution solution = solve(fleet);
            status = SolveStatus.OPTIMAL;
            source = DecisionSource.OPTIMIZER;
            decisions = solution.decisions();
            objectiveValue = solution.objectiveValue();
            log.info("Optimal induction plan found: {} of {} trains inducted (objective {})",
                    count(decisions), dataset.size(), String.format("%.2f", objectiveValue));
        } catch (SolverNonOptimalException e) {
            log.warn("Optimization ended with status {}: {}. Falling back to predictor labels",
                    e.getStatus(), e.getMessage());
            status = e.getStatus();
            source = DecisionSource.PREDICTOR_FALLBACK;
            decisions = fallbackDecisions(dataset, byTrain);
        }

        Map<String, String> reasoning = new LinkedHashMap<>();
        for (TrainRecord train : dataset.getRecords()) {
            PredictionResult prediction = byTrain.get(train.getTrainId());
            reasoning.put(train.getTrainId(), reasoningGenerator.explain(train,
                    decisions.get(train.getTrainId()), prediction == null ? null : prediction.probability()));
        }

        return OptimizationOutcome.builder()
                .status(status)
                .source(source)
                .objectiveValue(objectiveValue)
                .targetInductions(targetInductions)
                .decisions(Collections.unmodifiableMap(decisions))
                .reasoning(Collections.unmodifiableMap(reasoning))
                .overriddenTrains(Set.of())
                .summary(DecisionSummary.from(dataset, decisions, 0))
                .build();
    }

    /**
     * Applies operator decisions on top of {@code outcome} and returns a new
     * outcome. Overrides for trains not in the decision map are ignored. A
     * train's reasoning is replaced only when its decision actually changes,
     * so applying the same overrides again is a no-op.
     */
    public OptimizationOutcome applyManualOverrides(OptimizationOutcome outcome, TrainDataset dataset,
                                                    Collection<ManualOverride> overrides) {
        Map<String, Integer> decisions = new LinkedHashMap<>(outcome.getDecisions());
        Map<String, String> reasoning = new LinkedHashMap<>(outcome.getReasoning());
        Set<String> overridden = new LinkedHashSet<>(outcome.getOverriddenTrains());

        for (ManualOverride override : overrides) {
            Integer prior = decisions.get(override.trainId());
            if (prior == null) {
                log.debug("Ignoring override for unknown train {}", override.trainId());
                continue;
            }
            decisions.put(override.trainId(), override.decision());
            overridden.add(override.trainId());
            if (prior != override.decision()) {
                reasoning.put(override.trainId(),
                        reasoningGenerator.explainOverride(override.decision(), override.reason()));
                log.info("Manual override for {}: {} -> {}", override.trainId(), prior, override.decision());
            }
        }

        return outcome.toBuilder()
                .decisions(Collections.unmodifiableMap(decisions))
                .reasoning(Collections.unmodifiableMap(reasoning))
                .overriddenTrains(Collections.unmodifiableSet(overridden))
                .summary(DecisionSummary.from(dataset, decisions, overridden.size()))
                .build();
    }

    private Solution solve(FleetModel fleet) {
        MPSolver solver;
        try {
            Loader.loadNativeLibraries();
            solver = MPSolver.createSolver(settings.getSolverId());
        } catch (RuntimeException | LinkageError e) {
            throw new SolverNonOptimalException(SolveStatus.ERROR,
                    "Could not initialize solver backend " + settings.getSolverId(), e);
        }
        if (solver == null) {
            throw new SolverNonOptimalException(SolveStatus.ERROR,
                    "Solver backend " + settings.getSolverId() + " is not available");
        }

        try {
            int n = fleet.size();
            int target = fleet.target;
            MPVariable[] x = new MPVariable[n];
            for (int i = 0; i < n; i++) {
                x[i] = solver.makeBoolVar("induct_" + fleet.ids[i]);
            }

            MPObjective objective = solver.objective();
            for (int i = 0; i < n; i++) {
                double coefficient = settings.getServicePriorityWeight() * fleet.servicePriority[i]
                        + settings.getMileageBalanceWeight() * fleet.mileageBalance[i]
                        - settings.getShuntingCostWeight() * fleet.shuntingCost[i]
                        + settings.getDepotEfficiencyWeight() * fleet.depotBonus[i];
                objective.setCoefficient(x[i], coefficient);
            }
            objective.setMaximization();

            MPConstraint total = solver.makeConstraint(
                    Math.max(1, target - TARGET_SLACK), target + TARGET_SLACK, "total_inductions");
            for (MPVariable variable : x) {
                total.setCoefficient(variable, 1);
            }

            for (int i = 0; i < n; i++) {
                if (!fleet.eligible[i]) {
                    MPConstraint excluded = solver.makeConstraint(0, 0, "excluded_" + fleet.ids[i]);
                    excluded.setCoefficient(x[i], 1);
                }
            }

            for (Map.Entry<String, List<Integer>> depot : fleet.depotGroups.entrySet()) {
                MPConstraint capacity = solver.makeConstraint(
                        0, settings.capacityOf(depot.getKey()), "capacity_" + depot.getKey());
                for (int i : depot.getValue()) {
                    capacity.setCoefficient(x[i], 1);
                }
            }

            int highMileageCap = (int) Math.floor(HIGH_MILEAGE_SHARE * target);
            MPConstraint highMileage = solver.makeConstraint(0, highMileageCap, "high_mileage_cap");
            for (int i = 0; i < n; i++) {
                if (fleet.highMileage[i]) {
                    highMileage.setCoefficient(x[i], 1);
                }
            }

            int goodOtpCount = 0;
            for (boolean good : fleet.goodOnTime) {
                goodOtpCount += good ? 1 : 0;
            }
            if (goodOtpCount >= GOOD_OTP_SHARE * target) {
                int floor = (int) Math.floor(GOOD_OTP_SHARE * target);
                MPConstraint goodOtp = solver.makeConstraint(floor, MPSolver.infinity(), "good_on_time_floor");
                for (int i = 0; i < n; i++) {
                    if (fleet.goodOnTime[i]) {
                        goodOtp.setCoefficient(x[i], 1);
                    }
                }
            }

            solver.setTimeLimit(settings.getSolverTimeoutSeconds() * 1000L);
            MPSolverParameters parameters = new MPSolverParameters();
            parameters.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, settings.getMipGap());

            log.debug("Solving induction program: {} variables, {} constraints, target {}",
                    solver.numVariables(), solver.numConstraints(), target);
            MPSolver.ResultStatus resultStatus = solver.solve(parameters);

            if (resultStatus != MPSolver.ResultStatus.OPTIMAL) {
                SolveStatus status = toSolveStatus(resultStatus);
                throw new SolverNonOptimalException(status, "Solver returned " + resultStatus);
            }

            Map<String, Integer> decisions = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                decisions.put(fleet.ids[i], x[i].solutionValue() > 0.5 ? 1 : 0);
            }
            return new Solution(decisions, objective.value());
        } finally {
            solver.delete();
        }
    }

    static SolveStatus toSolveStatus(MPSolver.ResultStatus resultStatus) {
        switch (resultStatus) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            case NOT_SOLVED:
                return SolveStatus.TIMEOUT;
            default:
                return SolveStatus.ERROR;
        }
    }

    private static Map<String, Integer> fallbackDecisions(TrainDataset dataset, Map<String, PredictionResult> predictions) {
        Map<String, Integer> decisions = new LinkedHashMap<>();
        for (TrainRecord train : dataset.getRecords()) {
            PredictionResult prediction = predictions.get(train.getTrainId());
            decisions.put(train.getTrainId(), prediction == null ? 0 : prediction.predictedLabel());
        }
        return decisions;
    }

    private static int count(Map<String, Integer> decisions) {
        return decisions.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Linear-interpolated percentile of {@code values}, {@code fraction} in [0, 1].
     */
    static double percentile(double[] values, double fraction) {
        if (values.length == 0) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Per-depot efficiency bonus for the train at 1-based position {@code k} in its depot group.
     */
    static double depotEfficiencyBonus(int capacity, int k) {
        return Math.max(0, Math.floor(DEPOT_FILL_RATIO * capacity) - k) * DEPOT_BONUS_PER_SLOT;
    }

    static double servicePriority(double probability, double fitness, double brandingHours, double onTimePerformance) {
        return 0.4 * (100 * probability)
                + 0.3 * fitness
                + 0.2 * Math.max(0, 100 - brandingHours)
                + 0.1 * onTimePerformance;
    }

    static boolean isExcluded(TrainRecord train) {
        double fitness = train.getFitnessScore() != null ? train.getFitnessScore() : DEFAULT_FITNESS;
        return train.hasOpenWorkOrders() || train.isCertificateInvalid() || fitness < EXCLUSION_FITNESS;
    }

    private record Solution(Map<String, Integer> decisions, double objectiveValue) {
    }

    /**
     * Per-train objective terms and constraint memberships with defaults applied.
     */
    private static final class FleetModel {
        final int target;
        final String[] ids;
        final double[] servicePriority;
        final double[] mileageBalance;
        final double[] shuntingCost;
        final double[] depotBonus;
        final boolean[] eligible;
        final boolean[] highMileage;
        final boolean[] goodOnTime;
        final Map<String, List<Integer>> depotGroups = new LinkedHashMap<>();

        FleetModel(TrainDataset dataset, Map<String, PredictionResult> predictions, int target,
                   PlannerSettings settings) {
            this.target = target;
            List<TrainRecord> records = dataset.getRecords();
            int n = records.size();
            ids = new String[n];
            servicePriority = new double[n];
            mileageBalance = new double[n];
            shuntingCost = new double[n];
            depotBonus = new double[n];
            eligible = new boolean[n];
            highMileage = new boolean[n];
            goodOnTime = new boolean[n];

            double fleetMean = dataset.fleetMeanMileage().orElse(0);
            double[] mileage = new double[n];
            for (int i = 0; i < n; i++) {
                TrainRecord train = records.get(i);
                mileage[i] = train.getMileage() != null ? train.getMileage() : fleetMean;
            }
            double highMileageThreshold = percentile(mileage, HIGH_MILEAGE_PERCENTILE);

            for (int i = 0; i < n; i++) {
                TrainRecord train = records.get(i);
                ids[i] = train.getTrainId();

                PredictionResult prediction = predictions.get(train.getTrainId());
                double probability = prediction != null ? prediction.probability() : DEFAULT_PROBABILITY;
                double fitness = train.getFitnessScore() != null ? train.getFitnessScore() : DEFAULT_FITNESS;
                double branding = train.getBrandingHours() != null ? train.getBrandingHours() : DEFAULT_BRANDING_HOURS;
                double onTime = train.getOnTimePerformance() != null
                        ? train.getOnTimePerformance() : DEFAULT_ON_TIME_PERFORMANCE;

                servicePriority[i] = servicePriority(probability, fitness, branding, onTime);
                mileageBalance[i] = Math.max(0, fleetMean - mileage[i]) / 1000;
                eligible[i] = !isExcluded(train);
                highMileage[i] = mileage[i] > highMileageThreshold;
                goodOnTime[i] = onTime >= GOOD_ON_TIME_PERFORMANCE;

                String depot = train.getDepot() != null ? train.getDepot() : UNKNOWN_DEPOT;
                depotGroups.computeIfAbsent(depot, d -> new ArrayList<>()).add(i);
            }

            // Positions follow input order within each depot
            depotGroups.forEach((depot, members) -> {
                int capacity = settings.capacityOf(depot);
                for (int position = 0; position < members.size(); position++) {
                    int i = members.get(position);
                    shuntingCost[i] = position * SHUNTING_COST_PER_POSITION;
                    depotBonus[i] = depotEfficiencyBonus(capacity, position + 1);
                }
            });
        }

        int size() {
            return ids.length;
        }

        int eligibleCount() {
            int count = 0;
            for (boolean e : eligible) {
                count += e ? 1 : 0;
            }
            return count;
        }
    }
}
