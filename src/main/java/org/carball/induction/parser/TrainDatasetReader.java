package org.carball.induction.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.induction.exception.InputException;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a fleet snapshot exported as JSON: either a top-level array of train
 * objects or an object with a {@code trains} array. Keys are snake_case.
 * Values that are missing or not numeric become {@code null} so the planner
 * applies its defaults.
 */
@Slf4j
public class TrainDatasetReader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public TrainDataset read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Train dataset file not found: " + path);
        }
        TrainDataset dataset = parse(Files.readString(path));
        log.info("Loaded {} trains from {}", dataset.size(), path);
        return dataset;
    }

    /**
     * @throws InputException if the content is not valid JSON or not a table of train objects
     */
    public TrainDataset parse(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InputException("Invalid JSON in train dataset: " + e.getOriginalMessage(), e);
        }

        JsonNode trains = root != null && root.isObject() ? root.get("trains") : root;
        if (trains == null || !trains.isArray()) {
            throw new InputException("Train dataset must be a JSON array or an object with a 'trains' array");
        }

        List<TrainRecord> records = new ArrayList<>();
        int row = 0;
        for (JsonNode node : trains) {
            if (!node.isObject()) {
                throw new InputException("Train dataset row " + row + " is not an object");
            }
            records.add(parseTrain(node));
            row++;
        }
        return TrainDataset.of(records);
    }

    private TrainRecord parseTrain(JsonNode node) {
        return TrainRecord.builder()
                .trainId(text(node, "train_id"))
                .fitnessScore(decimal(node, "fitness_score"))
                .depot(text(node, "depot"))
                .mileage(integer(node, "mileage"))
                .daysSinceMaintenance(integer(node, "days_since_maintenance"))
                .openWorkOrders(integer(node, "open_work_orders"))
                .certValid(bool(node, "cert_valid"))
                .daysToCertExpiry(integer(node, "days_to_cert_expiry"))
                .brandingHours(integer(node, "branding_hours"))
                .recentDelays(integer(node, "recent_delays"))
                .totalDelayMinutes(integer(node, "total_delay_minutes"))
                .mechanicalIssues(integer(node, "mechanical_issues"))
                .doorFaults(integer(node, "door_faults"))
                .onTimePerformance(decimal(node, "on_time_performance"))
                .targetInduct(label(node, "target_induct"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    static Double decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                double parsed = Double.parseDouble(value.asText().trim());
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                log.debug("Non-numeric {} value '{}', treating as missing", field, value.asText());
                return null;
            }
        }
        return null;
    }

    static Integer integer(JsonNode node, String field) {
        Double value = decimal(node, field);
        if (value == null) {
            return null;
        }
        long rounded = Math.round(value);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
            log.debug("Out-of-range {} value {}, treating as missing", field, value);
            return null;
        }
        return (int) rounded;
    }

    static Integer label(JsonNode node, String field) {
        Integer value = integer(node, field);
        if (value != null && value != 0 && value != 1) {
            log.debug("Label {} must be 0 or 1, got {}; treating as unlabelled", field, value);
            return null;
        }
        return value;
    }

    static Boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0;
        }
        String text = value.asText().trim().toLowerCase();
        switch (text) {
            case "true":
            case "yes":
            case "1":
                return true;
            case "false":
            case "no":
            case "0":
                return false;
            default:
                log.debug("Unrecognized {} value '{}', treating as missing", field, value.asText());
                return null;
        }
    }
}
