package org.carball.induction.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.induction.config.PlannerSettings;
import org.carball.induction.model.decision.DecisionSummary;
import org.carball.induction.model.decision.OptimizationOutcome;
import org.carball.induction.model.decision.RankedDecision;
import org.carball.induction.model.prediction.TrainingReport;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

@Slf4j
public class PlanningReport {

    private final OptimizationOutcome outcome;
    private final List<RankedDecision> ranking;
    private final TrainingReport trainingReport;
    private final PlannerSettings settings;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public PlanningReport(OptimizationOutcome outcome, List<RankedDecision> ranking,
                          TrainingReport trainingReport, PlannerSettings settings) {
        this(outcome, ranking, trainingReport, settings, LocalDateTime.now());
    }

    PlanningReport(OptimizationOutcome outcome, List<RankedDecision> ranking,
                   TrainingReport trainingReport, PlannerSettings settings, LocalDateTime timestamp) {
        this.outcome = outcome;
        this.ranking = ranking;
        this.trainingReport = trainingReport;
        this.settings = settings;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public String toJson() {
        try {
            ReportData reportData = buildReportData();
            return objectMapper.writeValueAsString(reportData);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        DecisionSummary summary = outcome.getSummary();

        // Header
        md.append("# Train Induction Plan\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Profile:** ").append(settings.getProfileName()).append("  \n");
        md.append("**Target Inductions:** ").append(outcome.getTargetInductions()).append("  \n\n");

        // Solver outcome
        md.append("## Optimization\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Solver Status | ").append(outcome.getStatus()).append(" |\n");
        md.append("| Decision Source | ").append(outcome.getSource()).append(" |\n");
        if (outcome.getObjectiveValue() != null) {
            md.append("| Objective Value | ").append(String.format("%.2f", outcome.getObjectiveValue())).append(" |\n");
        }
        md.append("| Constraints Satisfied | ").append(outcome.constraintsSatisfied() ? "Yes" : "No").append(" |\n\n");

        if (outcome.isFallback()) {
            md.append("> **Warning:** the solver did not reach an optimal plan. ")
                    .append("Decisions below follow the predictor's recommendations directly.\n\n");
        }

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Total Trains | ").append(summary.totalTrains()).append(" |\n");
        md.append("| Inducted | ").append(summary.trainsInducted()).append(" |\n");
        md.append("| Held | ").append(summary.trainsHeld()).append(" |\n");
        md.append("| Avg Fitness (Inducted) | ").append(String.format("%.1f", summary.avgFitnessInducted())).append(" |\n");
        md.append("| Avg Fitness (Held) | ").append(String.format("%.1f", summary.avgFitnessHeld())).append(" |\n");
        md.append("| Avg Mileage (Inducted) | ").append(String.format("%.0f", summary.avgMileageInducted())).append(" |\n");
        md.append("| Avg Mileage (Held) | ").append(String.format("%.0f", summary.avgMileageHeld())).append(" |\n");
        md.append("| Manual Overrides | ").append(summary.manualOverridesApplied()).append(" |\n\n");

        if (!summary.depotDistribution().isEmpty()) {
            md.append("### Inductions by Depot\n\n");
            md.append("| Depot | Inducted | Capacity |\n");
            md.append("|-------|----------|----------|\n");
            summary.depotDistribution().forEach((depot, count) ->
                    md.append("| ").append(depot).append(" | ").append(count)
                            .append(" | ").append(settings.capacityOf(depot)).append(" |\n"));
            md.append("\n");
        }

        // Ranking
        md.append("## Induction List\n\n");
        md.append("| Rank | Train | Decision | Fitness | Depot | Mileage | Reasoning |\n");
        md.append("|------|-------|----------|---------|-------|---------|-----------|\n");
        for (RankedDecision row : ranking) {
            md.append("| ").append(row.priorityRank())
                    .append(" | ").append(row.trainId())
                    .append(" | ").append(row.isInduct() ? "✅ " : "⏸️ ").append(row.finalDecision())
                    .append(row.manualOverride() ? " (override)" : "")
                    .append(" | ").append(String.format("%.1f", row.fitnessScore()))
                    .append(" | ").append(row.depot())
                    .append(" | ").append(row.mileage())
                    .append(" | ").append(row.reasoning().replace("|", "/"))
                    .append(" |\n");
        }
        md.append("\n");

        if (trainingReport != null) {
            appendTraining(md);
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by Train Induction Planner*\n");

        return md.toString();
    }

    private void appendTraining(StringBuilder md) {
        md.append("## Model Training\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Model | ").append(trainingReport.getModelType().getConfigName()).append(" |\n");
        md.append("| Labels | ").append(trainingReport.getLabelSource()).append(" |\n");
        md.append("| Accuracy | ").append(String.format("%.3f", trainingReport.getAccuracy())).append(" |\n");
        md.append("| Cross-validation (").append(trainingReport.getCvFolds()).append(" folds) | ")
                .append(String.format("%.3f ± %.3f", trainingReport.getCvMean(), trainingReport.getCvStd())).append(" |\n");
        md.append("| Precision | ").append(String.format("%.3f", trainingReport.getPrecision())).append(" |\n");
        md.append("| Recall | ").append(String.format("%.3f", trainingReport.getRecall())).append(" |\n");
        md.append("| F1 | ").append(String.format("%.3f", trainingReport.getF1())).append(" |\n");
        md.append("| Train / Test Rows | ").append(trainingReport.getTrainingSize())
                .append(" / ").append(trainingReport.getTestSize())
                .append(trainingReport.isStratified() ? "" : " (not stratified)").append(" |\n\n");

        md.append("### Top Features\n\n");
        md.append("| Feature | Importance |\n");
        md.append("|---------|------------|\n");
        trainingReport.getFeatureImportance().entrySet().stream()
                .limit(10)
                .forEach(entry -> md.append("| ").append(entry.getKey()).append(" | ")
                        .append(String.format("%.3f", entry.getValue())).append(" |\n"));
        md.append("\n");
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setMetadata(new PlanMetadata(
                timestamp,
                settings.getProfileName(),
                outcome.getTargetInductions(),
                outcome.getStatus().name(),
                outcome.getSource().name(),
                outcome.getObjectiveValue(),
                outcome.constraintsSatisfied()));
        report.setSummary(outcome.getSummary());
        report.setRanking(ranking);
        report.setTraining(trainingReport);
        report.setDepotCapacities(settings.getDepotCapacities());
        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private PlanMetadata metadata;
        private DecisionSummary summary;
        private List<RankedDecision> ranking;
        private TrainingReport training;
        private Map<String, Integer> depotCapacities;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class PlanMetadata {
        private LocalDateTime generatedAt;
        private String profile;
        private int targetInductions;
        private String solverStatus;
        private String decisionSource;
        private Double objectiveValue;
        private boolean constraintsSatisfied;
    }
}
