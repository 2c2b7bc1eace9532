package org.carball.induction.model.train;

import lombok.Builder;
import lombok.Value;

/**
 * One train's attributes for a single planning cycle. Numeric and boolean
 * fields are boxed: {@code null} means the source did not supply a usable value
 * and downstream components substitute their documented defaults.
 */
@Value
@Builder(toBuilder = true)
public class TrainRecord {
    String trainId;
    Double fitnessScore;
    String depot;
    Integer mileage;
    Integer daysSinceMaintenance;
    Integer openWorkOrders;
    Boolean certValid;
    Integer daysToCertExpiry;
    Integer brandingHours;
    Integer recentDelays;
    Integer totalDelayMinutes;
    Integer mechanicalIssues;
    Integer doorFaults;
    Double onTimePerformance;

    /** Ground-truth label for training (1 = induct, 0 = hold), usually absent. */
    Integer targetInduct;

    public boolean hasOpenWorkOrders() {
        return openWorkOrders != null && openWorkOrders > 0;
    }

    /** Only an explicit {@code false} counts as invalid. */
    public boolean isCertificateInvalid() {
        return Boolean.FALSE.equals(certValid);
    }

    public boolean hasLabel() {
        return targetInduct != null;
    }
}
