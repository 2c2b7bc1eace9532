package org.carball.induction.session;

import lombok.extern.slf4j.Slf4j;
import org.carball.induction.config.PlannerSettings;
import org.carball.induction.exception.InputException;
import org.carball.induction.exception.OverrideNotFoundException;
import org.carball.induction.ml.InductionPredictor;
import org.carball.induction.model.decision.ManualOverride;
import org.carball.induction.model.decision.OptimizationOutcome;
import org.carball.induction.model.decision.RankedDecision;
import org.carball.induction.model.prediction.PredictionResult;
import org.carball.induction.model.prediction.TrainingReport;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.optimizer.InductionOptimizer;
import org.carball.induction.output.DecisionAssembler;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one fleet's planning cycle: the loaded dataset, the latest
 * predictions, the optimizer's fresh outcome, active manual overrides and the
 * outcome with those overrides applied.
 * <p>
 * Not thread-safe. Concurrent cycles for different fleets need separate sessions.
 */
@Slf4j
public class PlanningSession {

    private final PlannerSettings settings;
    private final InductionPredictor predictor;
    private final InductionOptimizer optimizer;
    private final DecisionAssembler assembler;

    private TrainDataset dataset = TrainDataset.empty();
    private List<PredictionResult> predictions = List.of();
    private OptimizationOutcome freshOutcome;
    private OptimizationOutcome currentOutcome;
    private final Map<String, ManualOverride> overrides = new LinkedHashMap<>();
    private TrainingReport lastTrainingReport;
    private int targetInductions;

    public PlanningSession(PlannerSettings settings) {
        this(settings, new InductionPredictor(settings), new InductionOptimizer(settings), new DecisionAssembler());
    }

    public PlanningSession(PlannerSettings settings, InductionPredictor predictor,
                           InductionOptimizer optimizer, DecisionAssembler assembler) {
        this.settings = settings;
        this.predictor = predictor;
        this.optimizer = optimizer;
        this.assembler = assembler;
        this.targetInductions = settings.getTargetInductions();
    }

    /**
     * Replaces the fleet snapshot. Predictions, plans and overrides from the
     * previous snapshot are discarded.
     */
    public void loadDataset(TrainDataset dataset) {
        if (dataset == null) {
            throw new InputException("Train dataset must not be null");
        }
        this.dataset = dataset;
        this.predictions = List.of();
        this.freshOutcome = null;
        this.currentOutcome = null;
        this.overrides.clear();
        log.info("Loaded dataset with {} trains", dataset.size());
    }

    public TrainingReport trainModel() {
        lastTrainingReport = predictor.train(dataset);
        return lastTrainingReport;
    }

    public void saveModel(Path path) throws IOException {
        predictor.save(path);
    }

    /**
     * Loads a saved model if one exists at {@code path}.
     *
     * @return true if a model was loaded
     */
    public boolean restoreModel(Path path) {
        return predictor.restoreIfPresent(path);
    }

    public OptimizationOutcome plan() {
        return plan(targetInductions);
    }

    /**
     * Predicts and optimizes the loaded fleet for {@code target} inductions,
     * then reapplies any active overrides.
     */
    public OptimizationOutcome plan(int target) {
        this.targetInductions = target;
        predictions = predictor.predict(dataset);
        freshOutcome = optimizer.optimize(dataset, predictions, target);
        currentOutcome = overrides.isEmpty()
                ? freshOutcome
                : optimizer.applyManualOverrides(freshOutcome, dataset, overrides.values());
        return currentOutcome;
    }

    /**
     * Records an operator decision for {@code trainId} and applies it to the current plan.
     *
     * @throws OverrideNotFoundException if the train is not in the current plan; nothing changes
     * @throws IllegalStateException     if no plan has been produced yet
     */
    public OptimizationOutcome override(String trainId, int decision, String reason) {
        OptimizationOutcome outcome = requirePlan();
        if (!outcome.getDecisions().containsKey(trainId)) {
            throw new OverrideNotFoundException(trainId);
        }
        ManualOverride override = new ManualOverride(trainId, decision, reason);

        overrides.put(trainId, override);
        currentOutcome = optimizer.applyManualOverrides(outcome, dataset, List.of(override));
        return currentOutcome;
    }

    /**
     * Drops all overrides and reruns prediction and optimization from scratch.
     *
     * @return the number of overrides removed
     */
    public int clearOverrides() {
        int cleared = overrides.size();
        overrides.clear();
        if (currentOutcome != null) {
            plan(targetInductions);
        }
        log.info("Cleared {} manual overrides", cleared);
        return cleared;
    }

    public List<RankedDecision> ranking() {
        return assembler.assemble(requirePlan(), dataset);
    }

    public SessionStatus status() {
        return new SessionStatus(
                dataset.size(),
                predictor.getState(),
                predictor.getTrainedAt(),
                currentOutcome != null,
                currentOutcome != null ? currentOutcome.getStatus() : null,
                currentOutcome != null ? currentOutcome.getSource() : null,
                currentOutcome != null ? currentOutcome.getSummary().trainsInducted() : null,
                overrides.size());
    }

    public TrainDataset getDataset() {
        return dataset;
    }

    public List<PredictionResult> getPredictions() {
        return predictions;
    }

    public OptimizationOutcome getCurrentOutcome() {
        return currentOutcome;
    }

    /** Outcome of the last optimization before overrides were applied. */
    public OptimizationOutcome getFreshOutcome() {
        return freshOutcome;
    }

    public List<ManualOverride> getOverrides() {
        return Collections.unmodifiableList(new ArrayList<>(overrides.values()));
    }

    public TrainingReport getLastTrainingReport() {
        return lastTrainingReport;
    }

    public PlannerSettings getSettings() {
        return settings;
    }

    public InductionPredictor getPredictor() {
        return predictor;
    }

    private OptimizationOutcome requirePlan() {
        if (currentOutcome == null) {
            throw new IllegalStateException("No induction plan available; run plan() first");
        }
        return currentOutcome;
    }
}
