package org.carball.induction.model.feature;

import java.util.List;

/**
 * Canonical feature column names, in the order the feature builder emits them.
 */
public final class FeatureColumns {

    public static final String FITNESS_SCORE = "fitness_score";
    public static final String DAYS_SINCE_MAINTENANCE = "days_since_maintenance";
    public static final String MILEAGE = "mileage";
    public static final String BRANDING_HOURS = "branding_hours";
    public static final String RECENT_DELAYS = "recent_delays";
    public static final String TOTAL_DELAY_MINUTES = "total_delay_minutes";
    public static final String OPEN_WORK_ORDERS = "open_work_orders";
    public static final String DOOR_FAULTS = "door_faults";
    public static final String MECHANICAL_ISSUES = "mechanical_issues";
    public static final String CERT_VALID = "cert_valid";
    public static final String DAYS_TO_CERT_EXPIRY = "days_to_cert_expiry";
    public static final String FITNESS_TREND = "fitness_trend";
    public static final String MAINTENANCE_URGENCY = "maintenance_urgency";
    public static final String OPERATIONAL_RISK = "operational_risk";
    public static final String DEPOT_ENCODED = "depot_encoded";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String IS_WEEKEND = "is_weekend";

    public static final List<String> BASE = List.of(
            FITNESS_SCORE, DAYS_SINCE_MAINTENANCE, MILEAGE, BRANDING_HOURS,
            RECENT_DELAYS, TOTAL_DELAY_MINUTES, OPEN_WORK_ORDERS, DOOR_FAULTS,
            MECHANICAL_ISSUES, CERT_VALID, DAYS_TO_CERT_EXPIRY,
            FITNESS_TREND, MAINTENANCE_URGENCY, OPERATIONAL_RISK, DEPOT_ENCODED);

    public static final List<String> TIME = List.of(DAY_OF_WEEK, IS_WEEKEND);

    private FeatureColumns() {
    }
}
