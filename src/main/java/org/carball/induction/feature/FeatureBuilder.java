package org.carball.induction.feature;

import lombok.extern.slf4j.Slf4j;
import org.carball.induction.model.feature.FeatureColumns;
import org.carball.induction.model.feature.FeatureTable;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.carball.induction.model.feature.FeatureColumns.*;

/**
 * Turns train records into a fixed, named feature matrix.
 * <p>
 * The builder is pure apart from two pieces of instance state: the category
 * registries, which grow during {@link FeatureMode#TRAINING} builds, and the
 * column order recorded by the last training build. Prediction builds are
 * aligned to that recorded order so a fitted model always sees the columns it
 * was trained on, whatever the input looks like.
 */
@Slf4j
public class FeatureBuilder {

    static final double DEFAULT_FITNESS = 50;
    static final double DEFAULT_DAYS_SINCE_MAINTENANCE = 30;
    static final double DEFAULT_MILEAGE = 100_000;
    static final double DEFAULT_DAYS_TO_CERT_EXPIRY = 30;

    private static final double URGENCY_CAP = 10;
    private static final double RISK_CAP = 10;

    private final Clock clock;
    private final boolean timeFeatures;
    private final Map<String, CategoryRegistry> encoders = new LinkedHashMap<>();
    private List<String> recordedColumns = List.of();

    public FeatureBuilder() {
        this(Clock.systemDefaultZone(), true);
    }

    public FeatureBuilder(Clock clock, boolean timeFeatures) {
        this.clock = clock;
        this.timeFeatures = timeFeatures;
    }

    /**
     * Builds the feature table for {@code dataset}.
     */
    public FeatureTable build(TrainDataset dataset, FeatureMode mode) {
        List<TrainRecord> records = dataset.getRecords();
        int n = records.size();
        double fleetMileage = dataset.fleetMeanMileage().orElse(DEFAULT_MILEAGE);

        double[] fitness = numeric(records, TrainRecord::getFitnessScore, DEFAULT_FITNESS);
        double[] daysSince = numeric(records, r -> asDouble(r.getDaysSinceMaintenance()), DEFAULT_DAYS_SINCE_MAINTENANCE);
        double[] mileage = numeric(records, r -> asDouble(r.getMileage()), fleetMileage);
        double[] branding = numeric(records, r -> asDouble(r.getBrandingHours()), 0);
        double[] delays = numeric(records, r -> asDouble(r.getRecentDelays()), 0);
        double[] delayMinutes = numeric(records, r -> asDouble(r.getTotalDelayMinutes()), 0);
        double[] workOrders = numeric(records, r -> asDouble(r.getOpenWorkOrders()), 0);
        double[] doorFaults = numeric(records, r -> asDouble(r.getDoorFaults()), 0);
        double[] mechanical = numeric(records, r -> asDouble(r.getMechanicalIssues()), 0);
        double[] certValid = numeric(records, r -> r.getCertValid() == null ? null : (r.getCertValid() ? 1.0 : 0.0), 1);
        double[] daysToExpiry = numeric(records, r -> asDouble(r.getDaysToCertExpiry()), DEFAULT_DAYS_TO_CERT_EXPIRY);

        double[] trend = new double[n];
        double[] urgency = new double[n];
        double[] risk = new double[n];
        for (int i = 0; i < n; i++) {
            trend[i] = fitnessTrend(fitness[i], daysSince[i]);
            urgency[i] = maintenanceUrgency(daysSince[i], workOrders[i], mechanical[i]);
            risk[i] = operationalRisk(delays[i], doorFaults[i], fitness[i], certValid[i] >= 0.5);
        }

        double[] depot = encode(records, "depot", TrainRecord::getDepot, mode);

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(FITNESS_SCORE, fitness);
        columns.put(DAYS_SINCE_MAINTENANCE, daysSince);
        columns.put(MILEAGE, mileage);
        columns.put(BRANDING_HOURS, branding);
        columns.put(RECENT_DELAYS, delays);
        columns.put(TOTAL_DELAY_MINUTES, delayMinutes);
        columns.put(OPEN_WORK_ORDERS, workOrders);
        columns.put(DOOR_FAULTS, doorFaults);
        columns.put(MECHANICAL_ISSUES, mechanical);
        columns.put(CERT_VALID, certValid);
        columns.put(DAYS_TO_CERT_EXPIRY, daysToExpiry);
        columns.put(FITNESS_TREND, trend);
        columns.put(MAINTENANCE_URGENCY, urgency);
        columns.put(OPERATIONAL_RISK, risk);
        columns.put(DEPOT_ENCODED, depot);

        if (timeFeatures) {
            DayOfWeek today = LocalDate.now(clock).getDayOfWeek();
            columns.put(DAY_OF_WEEK, constant(n, today.getValue() - 1));
            columns.put(IS_WEEKEND, constant(n, today.getValue() >= DayOfWeek.SATURDAY.getValue() ? 1 : 0));
        }

        FeatureTable table = assemble(columns, dataset.trainIds());

        if (mode == FeatureMode.TRAINING) {
            recordedColumns = table.columns();
            log.info("Prepared {} features for {} trains", table.columnCount(), n);
            return table;
        }

        if (recordedColumns.isEmpty()) {
            return table;
        }
        if (!recordedColumns.equals(table.columns())) {
            log.debug("Aligning {} built columns to {} recorded columns", table.columnCount(), recordedColumns.size());
        }
        return table.alignTo(recordedColumns);
    }

    /**
     * {@code clamp(fitness - 0.5 * daysSinceMaintenance, 0, 100)}
     */
    public static double fitnessTrend(double fitness, double daysSinceMaintenance) {
        return Math.max(0, Math.min(100, fitness - daysSinceMaintenance * 0.5));
    }

    /**
     * Maintenance age bucket plus open work orders and mechanical issues, capped at 10.
     */
    public static double maintenanceUrgency(double daysSinceMaintenance, double openWorkOrders, double mechanicalIssues) {
        double urgency = 0;
        if (daysSinceMaintenance > 21) {
            urgency += 3;
        } else if (daysSinceMaintenance > 14) {
            urgency += 2;
        } else if (daysSinceMaintenance > 7) {
            urgency += 1;
        }
        urgency += openWorkOrders * 2;
        urgency += mechanicalIssues * 1.5;
        return Math.min(URGENCY_CAP, urgency);
    }

    /**
     * Delays, door faults, low fitness and an invalid certificate, capped at 10.
     */
    public static double operationalRisk(double recentDelays, double doorFaults, double fitness, boolean certValid) {
        double risk = recentDelays * 0.5 + doorFaults;
        if (fitness < 70) {
            risk += 2;
        } else if (fitness < 80) {
            risk += 1;
        }
        if (!certValid) {
            risk += 3;
        }
        return Math.min(RISK_CAP, risk);
    }

    public List<String> getRecordedColumns() {
        return recordedColumns;
    }

    public boolean isTimeFeatures() {
        return timeFeatures;
    }

    public CategoryRegistry registry(String field) {
        return encoders.get(field);
    }

    /**
     * Deep copy of the category registries, for persistence.
     */
    public Map<String, CategoryRegistry> snapshotEncoders() {
        Map<String, CategoryRegistry> copy = new LinkedHashMap<>();
        encoders.forEach((field, registry) -> copy.put(field, registry.copy()));
        return copy;
    }

    /**
     * Replaces recorded columns and registries with a persisted snapshot.
     */
    public void restore(List<String> columns, Map<String, CategoryRegistry> registries) {
        encoders.clear();
        registries.forEach((field, registry) -> encoders.put(field, registry.copy()));
        recordedColumns = List.copyOf(columns);
    }

    public void reset() {
        encoders.clear();
        recordedColumns = List.of();
    }

    /**
     * Column order this builder currently emits before alignment.
     */
    public List<String> canonicalColumns() {
        List<String> columns = new ArrayList<>(FeatureColumns.BASE);
        if (timeFeatures) {
            columns.addAll(FeatureColumns.TIME);
        }
        return Collections.unmodifiableList(columns);
    }

    private double[] encode(List<TrainRecord> records, String field,
                            Function<TrainRecord, String> accessor, FeatureMode mode) {
        CategoryRegistry registry = mode == FeatureMode.TRAINING
                ? encoders.computeIfAbsent(field, CategoryRegistry::new)
                : encoders.get(field);

        double[] out = new double[records.size()];
        for (int i = 0; i < records.size(); i++) {
            String value = accessor.apply(records.get(i));
            if (registry == null) {
                out[i] = CategoryRegistry.UNKNOWN_CODE;
            } else if (mode == FeatureMode.TRAINING) {
                out[i] = registry.register(value);
            } else {
                if (value != null && !registry.isKnown(value)) {
                    log.warn("Unseen {} '{}' for train {}, encoding as {}", field, value,
                            records.get(i).getTrainId(), CategoryRegistry.UNKNOWN);
                }
                out[i] = registry.lookup(value);
            }
        }
        return out;
    }

    private static double[] numeric(List<TrainRecord> records, Function<TrainRecord, Double> accessor, double fallback) {
        double[] out = new double[records.size()];
        for (int i = 0; i < records.size(); i++) {
            Double value = accessor.apply(records.get(i));
            out[i] = value == null || value.isNaN() || value.isInfinite() ? fallback : value;
        }
        return out;
    }

    private static Double asDouble(Integer value) {
        return value == null ? null : value.doubleValue();
    }

    private static double[] constant(int n, double value) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    private static FeatureTable assemble(Map<String, double[]> columns, List<String> trainIds) {
        List<String> names = new ArrayList<>(columns.keySet());
        double[][] values = new double[trainIds.size()][names.size()];
        for (int c = 0; c < names.size(); c++) {
            double[] column = columns.get(names.get(c));
            for (int r = 0; r < trainIds.size(); r++) {
                values[r][c] = column[r];
            }
        }
        return new FeatureTable(names, trainIds, values);
    }
}
