package org.carball.induction.model.train;

import org.carball.induction.exception.InputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable, ordered collection of train records for one planning cycle.
 * Input order is significant: shunting positions and ranking tie-breaks
 * follow it.
 */
public final class TrainDataset {

    private final List<TrainRecord> records;
    private final Map<String, TrainRecord> byId;

    private TrainDataset(List<TrainRecord> records) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        Map<String, TrainRecord> index = new LinkedHashMap<>();
        for (TrainRecord record : records) {
            index.put(record.getTrainId(), record);
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    /**
     * Validates identifiers and builds the dataset.
     *
     * @throws InputException if the list is null, contains null rows, or has
     *                        blank or duplicate train identifiers
     */
    public static TrainDataset of(List<TrainRecord> records) {
        if (records == null) {
            throw new InputException("Train dataset must not be null");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            TrainRecord record = records.get(i);
            if (record == null) {
                throw new InputException("Train dataset row " + i + " is null");
            }
            String id = record.getTrainId();
            if (id == null || id.isBlank()) {
                throw new InputException("Train dataset row " + i + " has no train identifier");
            }
            if (!seen.add(id)) {
                throw new InputException("Duplicate train identifier: " + id);
            }
        }
        return new TrainDataset(records);
    }

    public static TrainDataset empty() {
        return new TrainDataset(List.of());
    }

    public List<TrainRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Stream<TrainRecord> stream() {
        return records.stream();
    }

    public List<String> trainIds() {
        return records.stream().map(TrainRecord::getTrainId).collect(Collectors.toList());
    }

    public boolean contains(String trainId) {
        return byId.containsKey(trainId);
    }

    public Optional<TrainRecord> find(String trainId) {
        return Optional.ofNullable(byId.get(trainId));
    }

    /**
     * Mean mileage over trains that report one.
     */
    public OptionalDouble fleetMeanMileage() {
        return records.stream()
                .map(TrainRecord::getMileage)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();
    }

    public boolean allLabelled() {
        return !records.isEmpty() && records.stream().allMatch(TrainRecord::hasLabel);
    }

    public boolean anyLabelled() {
        return records.stream().anyMatch(TrainRecord::hasLabel);
    }
}
