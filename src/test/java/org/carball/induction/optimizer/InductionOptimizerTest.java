package org.carball.induction.optimizer;

import com.google.ortools.linearsolver.MPSolver;
import org.carball.induction.TestFleet;
import org.carball.induction.config.PlannerSettings;
import org.carball.induction.exception.InputException;
import org.carball.induction.ml.RuleBasedScorer;
import org.carball.induction.model.decision.DecisionSource;
import org.carball.induction.model.decision.ManualOverride;
import org.carball.induction.model.decision.OptimizationOutcome;
import org.carball.induction.model.decision.SolveStatus;
import org.carball.induction.model.prediction.PredictionResult;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class InductionOptimizerTest {

    private PlannerSettings settings;
    private InductionOptimizer optimizer;
    private final RuleBasedScorer scorer = new RuleBasedScorer();

    @BeforeEach
    void setUp() {
        settings = PlannerSettings.defaults();
        optimizer = new InductionOptimizer(settings);
    }

    private OptimizationOutcome optimize(InductionOptimizer optimizer, TrainDataset dataset, int target) {
        return optimizer.optimize(dataset, scorer.predict(dataset), target);
    }

    private static TrainDataset fleetWithWorkOrders() {
        List<TrainRecord> records = new ArrayList<>(TestFleet.standardRecords());
        for (int i : new int[]{2, 13, 21}) {
            records.set(i, records.get(i).toBuilder().openWorkOrders(1).build());
        }
        return TrainDataset.of(records);
    }

    @ParameterizedTest
    @ValueSource(ints = {15, 20, 25, 30, 35})
    void shouldAlwaysHoldTrainsWithOpenWorkOrders(int target) {
        // Given
        TrainDataset dataset = fleetWithWorkOrders();

        // When
        OptimizationOutcome outcome = optimize(optimizer, dataset, target);

        // Then
        assertThat(outcome.decisionFor("KMRL-003")).isEqualTo(0);
        assertThat(outcome.decisionFor("KMRL-014")).isEqualTo(0);
        assertThat(outcome.decisionFor("KMRL-022")).isEqualTo(0);
    }

    @Test
    void shouldHoldTrainsWithInvalidCertificateOrLowFitness() {
        // Given
        List<TrainRecord> records = new ArrayList<>(TestFleet.standardRecords());
        records.set(0, records.get(0).toBuilder().certValid(false).build());
        records.set(1, records.get(1).toBuilder().fitnessScore(55.0).build());

        // When
        OptimizationOutcome outcome = optimize(optimizer, TrainDataset.of(records), 20);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(outcome.decisionFor("KMRL-001")).isEqualTo(0);
        assertThat(outcome.decisionFor("KMRL-002")).isEqualTo(0);
    }

    @Test
    void shouldKeepTotalWithinTargetBandWhenOptimal() {
        // When
        OptimizationOutcome outcome = optimize(optimizer, TestFleet.standard(), 25);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(outcome.getSource()).isEqualTo(DecisionSource.OPTIMIZER);
        assertThat(outcome.constraintsSatisfied()).isTrue();
        assertThat(outcome.getObjectiveValue()).isNotNull();
        assertThat(outcome.getSummary().trainsInducted()).isBetween(15, 35);
        assertThat(outcome.getDecisions()).hasSize(25);
        assertThat(outcome.getReasoning()).hasSize(25);
    }

    @Test
    void shouldRespectDepotCapacities() {
        // Given - 40 trains spread round robin over the three depots
        String[] depots = {"Aluva", "Palarivattom", "Kalamassery"};
        List<TrainRecord> records = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            records.add(TestFleet.train(i, depots[i % 3]));
        }
        TrainDataset dataset = TrainDataset.of(records);

        // When
        OptimizationOutcome outcome = optimize(optimizer, dataset, 25);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        Map<String, Long> perDepot = dataset.stream()
                .filter(t -> outcome.isInducted(t.getTrainId()))
                .collect(Collectors.groupingBy(TrainRecord::getDepot, Collectors.counting()));
        assertThat(perDepot.getOrDefault("Aluva", 0L)).isLessThanOrEqualTo(12);
        assertThat(perDepot.getOrDefault("Palarivattom", 0L)).isLessThanOrEqualTo(8);
        assertThat(perDepot.getOrDefault("Kalamassery", 0L)).isLessThanOrEqualTo(5);
    }

    @Test
    void shouldFallBackToPredictorLabelsWhenInfeasible() {
        // Given - no depot can take any train
        PlannerSettings noCapacity = settings.toBuilder()
                .depotCapacities(Map.of("Aluva", 0, "Palarivattom", 0, "Kalamassery", 0))
                .defaultDepotCapacity(0)
                .build();
        TrainDataset dataset = fleetWithWorkOrders();
        List<PredictionResult> predictions = scorer.predict(dataset);

        // When
        OptimizationOutcome outcome = new InductionOptimizer(noCapacity).optimize(dataset, predictions, 25);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(outcome.getSource()).isEqualTo(DecisionSource.PREDICTOR_FALLBACK);
        assertThat(outcome.isFallback()).isTrue();
        assertThat(outcome.constraintsSatisfied()).isFalse();
        assertThat(outcome.getObjectiveValue()).isNull();
        for (PredictionResult prediction : predictions) {
            assertThat(outcome.decisionFor(prediction.trainId())).isEqualTo(prediction.predictedLabel());
        }
        assertThat(outcome.getSummary().trainsInducted()).isEqualTo(22);
        assertThat(outcome.getReasoning().get("KMRL-003")).startsWith("Held:").contains("Open work orders (1)");
    }

    @Test
    void shouldFallBackWhenSolverBackendUnavailable() {
        // Given
        InductionOptimizer unavailable = new InductionOptimizer(settings.toBuilder().solverId("NO_SUCH_SOLVER").build());

        // When
        OptimizationOutcome outcome = optimize(unavailable, TestFleet.standard(), 25);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.ERROR);
        assertThat(outcome.getSource()).isEqualTo(DecisionSource.PREDICTOR_FALLBACK);
        assertThat(outcome.getDecisions()).hasSize(25);
    }

    @Test
    void shouldHoldEveryTrainWithoutPredictionsInFallback() {
        // Given
        PlannerSettings noCapacity = settings.toBuilder().depotCapacities(Map.of()).defaultDepotCapacity(0).build();

        // When
        OptimizationOutcome outcome = new InductionOptimizer(noCapacity).optimize(TestFleet.standard(), List.of(), 25);

        // Then
        assertThat(outcome.isFallback()).isTrue();
        assertThat(outcome.getSummary().trainsInducted()).isZero();
    }

    @Test
    void shouldOptimizeWithoutPredictions() {
        // When
        OptimizationOutcome outcome = optimizer.optimize(TestFleet.standard(), null, 25);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
    }

    @Test
    void shouldRejectEmptyDataset() {
        assertThatThrownBy(() -> optimizer.optimize(TrainDataset.empty(), List.of(), 25))
                .isInstanceOf(InputException.class);
    }

    @Test
    void shouldInterpolatePercentile() {
        assertThat(InductionOptimizer.percentile(new double[]{10, 20, 30, 40, 50}, 0.8)).isCloseTo(42.0, within(1e-9));
        assertThat(InductionOptimizer.percentile(new double[]{5}, 0.8)).isEqualTo(5.0);
        assertThat(InductionOptimizer.percentile(new double[0], 0.8)).isEqualTo(0.0);
    }

    @Test
    void shouldShrinkDepotBonusAsDepotFills() {
        // capacity 12 -> fill target floor(9.6) = 9
        assertThat(InductionOptimizer.depotEfficiencyBonus(12, 1)).isEqualTo(16.0);
        assertThat(InductionOptimizer.depotEfficiencyBonus(12, 9)).isEqualTo(0.0);
        assertThat(InductionOptimizer.depotEfficiencyBonus(12, 11)).isEqualTo(0.0);
        assertThat(InductionOptimizer.depotEfficiencyBonus(5, 2)).isEqualTo(4.0);
    }

    @Test
    void shouldWeightServicePriorityTerms() {
        // 0.4*90 + 0.3*80 + 0.2*60 + 0.1*95
        assertThat(InductionOptimizer.servicePriority(0.9, 80, 40, 95)).isCloseTo(81.5, within(1e-9));
        assertThat(InductionOptimizer.servicePriority(0.5, 70, 150, 90)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void shouldMapSolverStatuses() {
        assertThat(InductionOptimizer.toSolveStatus(MPSolver.ResultStatus.OPTIMAL)).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(InductionOptimizer.toSolveStatus(MPSolver.ResultStatus.FEASIBLE)).isEqualTo(SolveStatus.FEASIBLE);
        assertThat(InductionOptimizer.toSolveStatus(MPSolver.ResultStatus.INFEASIBLE)).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(InductionOptimizer.toSolveStatus(MPSolver.ResultStatus.NOT_SOLVED)).isEqualTo(SolveStatus.TIMEOUT);
        assertThat(InductionOptimizer.toSolveStatus(MPSolver.ResultStatus.ABNORMAL)).isEqualTo(SolveStatus.ERROR);
    }

    @Test
    void shouldTreatMissingFitnessAsEligible() {
        assertThat(InductionOptimizer.isExcluded(TrainRecord.builder().trainId("X").build())).isFalse();
        assertThat(InductionOptimizer.isExcluded(TrainRecord.builder().trainId("X").fitnessScore(59.9).build())).isTrue();
    }

    @Test
    void shouldIncreaseInductedCountByOneWhenOverridingHeldTrain() {
        // Given
        TrainDataset dataset = fleetWithWorkOrders();
        OptimizationOutcome outcome = optimize(optimizer, dataset, 25);
        int before = outcome.getSummary().trainsInducted();

        // When
        OptimizationOutcome overridden = optimizer.applyManualOverrides(outcome, dataset,
                List.of(new ManualOverride("KMRL-003", 1, null)));

        // Then
        assertThat(overridden.getSummary().trainsInducted()).isEqualTo(before + 1);
        assertThat(overridden.getSummary().manualOverridesApplied()).isEqualTo(1);
        assertThat(overridden.getReasoning().get("KMRL-003"))
                .isEqualTo("Inducted: Manual override by operator");
        assertThat(overridden.isOverridden("KMRL-003")).isTrue();
        assertThat(outcome.decisionFor("KMRL-003")).isEqualTo(0);
        assertThat(overridden.getStatus()).isEqualTo(outcome.getStatus());
    }

    @Test
    void shouldBeIdempotentWhenApplyingSameOverrideTwice() {
        // Given
        TrainDataset dataset = fleetWithWorkOrders();
        OptimizationOutcome outcome = optimize(optimizer, dataset, 25);
        List<ManualOverride> overrides = List.of(new ManualOverride("KMRL-003", 1, "Event service"));

        // When
        OptimizationOutcome once = optimizer.applyManualOverrides(outcome, dataset, overrides);
        OptimizationOutcome twice = optimizer.applyManualOverrides(once, dataset, overrides);

        // Then
        assertThat(twice.getDecisions()).isEqualTo(once.getDecisions());
        assertThat(twice.getReasoning()).isEqualTo(once.getReasoning());
        assertThat(twice.getSummary()).isEqualTo(once.getSummary());
        assertThat(once.getReasoning().get("KMRL-003")).isEqualTo("Inducted: Manual override (Event service)");
    }

    @Test
    void shouldKeepReasoningWhenOverrideMatchesDecision() {
        // Given
        TrainDataset dataset = fleetWithWorkOrders();
        OptimizationOutcome outcome = optimize(optimizer, dataset, 25);

        // When
        OptimizationOutcome overridden = optimizer.applyManualOverrides(outcome, dataset,
                List.of(new ManualOverride("KMRL-003", 0, "Confirm hold")));

        // Then
        assertThat(overridden.getReasoning().get("KMRL-003")).isEqualTo(outcome.getReasoning().get("KMRL-003"));
        assertThat(overridden.getSummary().trainsInducted()).isEqualTo(outcome.getSummary().trainsInducted());
    }

    @Test
    void shouldIgnoreOverridesForUnknownTrains() {
        // Given
        TrainDataset dataset = TestFleet.standard();
        OptimizationOutcome outcome = optimize(optimizer, dataset, 25);

        // When
        OptimizationOutcome overridden = optimizer.applyManualOverrides(outcome, dataset,
                List.of(new ManualOverride("KMRL-999", 1, null)));

        // Then
        assertThat(overridden.getDecisions()).isEqualTo(outcome.getDecisions());
        assertThat(overridden.getOverriddenTrains()).isEmpty();
        assertThat(overridden.getSummary().manualOverridesApplied()).isZero();
    }
}
