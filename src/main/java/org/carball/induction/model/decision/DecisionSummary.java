package org.carball.induction.model.decision;

import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Aggregate view of a decision map. Always derived from the full map through
 * {@link #from}; never patched incrementally.
 */
public record DecisionSummary(
        int totalTrains,
        int trainsInducted,
        int trainsHeld,
        List<String> inductedTrains,
        List<String> heldTrains,
        double avgFitnessInducted,
        double avgFitnessHeld,
        double avgMileageInducted,
        double avgMileageHeld,
        Map<String, Integer> depotDistribution,
        int manualOverridesApplied
) {

    static final String UNKNOWN_DEPOT = "Unknown";

    public DecisionSummary {
        inductedTrains = List.copyOf(inductedTrains);
        heldTrains = List.copyOf(heldTrains);
        depotDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(depotDistribution));
    }

    public static DecisionSummary from(TrainDataset dataset, Map<String, Integer> decisions, int manualOverridesApplied) {
        List<TrainRecord> inducted = new ArrayList<>();
        List<TrainRecord> held = new ArrayList<>();
        for (TrainRecord record : dataset.getRecords()) {
            Integer decision = decisions.get(record.getTrainId());
            if (decision == null) {
                continue;
            }
            if (decision == 1) {
                inducted.add(record);
            } else {
                held.add(record);
            }
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TrainRecord record : inducted) {
            String depot = record.getDepot() != null ? record.getDepot() : UNKNOWN_DEPOT;
            counts.merge(depot, 1, Integer::sum);
        }
        Map<String, Integer> distribution = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEachOrdered(e -> distribution.put(e.getKey(), e.getValue()));

        return new DecisionSummary(
                inducted.size() + held.size(),
                inducted.size(),
                held.size(),
                inducted.stream().map(TrainRecord::getTrainId).toList(),
                held.stream().map(TrainRecord::getTrainId).toList(),
                average(inducted, r -> r.getFitnessScore()),
                average(held, r -> r.getFitnessScore()),
                average(inducted, r -> r.getMileage() == null ? null : r.getMileage().doubleValue()),
                average(held, r -> r.getMileage() == null ? null : r.getMileage().doubleValue()),
                distribution,
                manualOverridesApplied
        );
    }

    private static double average(List<TrainRecord> records, Function<TrainRecord, Double> field) {
        return records.stream()
                .map(field)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }
}
