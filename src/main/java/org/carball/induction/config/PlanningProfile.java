package org.carball.induction.config;

import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Preset objective weightings for common planning priorities.
 */
@Getter
public enum PlanningProfile {

    BALANCED("balanced", "Balanced approach - default weights for everyday planning",
            0.30, 0.25, 0.30, 0.15),

    SERVICE_FIRST("service-first", "Favour the fittest, most punctual trains over yard convenience",
            0.50, 0.15, 0.20, 0.15),

    FLEET_WEAR("fleet-wear", "Equalise accumulated mileage across the fleet",
            0.25, 0.45, 0.20, 0.10),

    DEPOT_FRIENDLY("depot-friendly", "Minimise shunting moves and keep depots within their comfortable load",
            0.25, 0.15, 0.40, 0.20) {
        @Override
        public PlannerSettings buildSettings() {
            PlannerSettings base = super.buildSettings();
            return base.toBuilder()
                    .defaultDepotCapacity(8) // Unknown depots are treated as small yards
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double servicePriorityWeight;
    private final double mileageBalanceWeight;
    private final double shuntingCostWeight;
    private final double depotEfficiencyWeight;

    PlanningProfile(String name, String description,
                    double servicePriorityWeight, double mileageBalanceWeight,
                    double shuntingCostWeight, double depotEfficiencyWeight) {
        this.name = name;
        this.description = description;
        this.servicePriorityWeight = servicePriorityWeight;
        this.mileageBalanceWeight = mileageBalanceWeight;
        this.shuntingCostWeight = shuntingCostWeight;
        this.depotEfficiencyWeight = depotEfficiencyWeight;
    }

    public PlannerSettings buildSettings() {
        return PlannerSettings.builder()
                .servicePriorityWeight(servicePriorityWeight)
                .mileageBalanceWeight(mileageBalanceWeight)
                .shuntingCostWeight(shuntingCostWeight)
                .depotEfficiencyWeight(depotEfficiencyWeight)
                .profileName(name)
                .profileDescription(description)
                .build();
    }

    public static PlanningProfile fromName(String name) {
        return Arrays.stream(values())
                .filter(profile -> profile.name.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown planning profile: " + name +
                        ". Available profiles: " + availableProfiles()));
    }

    public static String availableProfiles() {
        return Arrays.stream(values())
                .map(PlanningProfile::getName)
                .collect(Collectors.joining(", "));
    }
}
