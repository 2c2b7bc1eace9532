package org.carball.induction.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class PlanningProfileTest {

    @Test
    void shouldBuildBalancedProfileWithDefaultWeights() {
        // When
        PlannerSettings settings = PlanningProfile.BALANCED.buildSettings();

        // Then
        assertThat(settings.getServicePriorityWeight()).isEqualTo(0.30);
        assertThat(settings.getMileageBalanceWeight()).isEqualTo(0.25);
        assertThat(settings.getShuntingCostWeight()).isEqualTo(0.30);
        assertThat(settings.getDepotEfficiencyWeight()).isEqualTo(0.15);
        assertThat(settings.getProfileName()).isEqualTo("balanced");
    }

    @Test
    void shouldKeepWeightsSummingToOneForEveryProfile() {
        for (PlanningProfile profile : PlanningProfile.values()) {
            PlannerSettings settings = profile.buildSettings();
            double sum = settings.getServicePriorityWeight() + settings.getMileageBalanceWeight()
                    + settings.getShuntingCostWeight() + settings.getDepotEfficiencyWeight();
            assertThat(sum).as(profile.getName()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void shouldOverrideDefaultCapacityForDepotFriendlyProfile() {
        // When
        PlannerSettings settings = PlanningProfile.DEPOT_FRIENDLY.buildSettings();

        // Then
        assertThat(settings.getDefaultDepotCapacity()).isEqualTo(8);
        assertThat(settings.getShuntingCostWeight()).isEqualTo(0.40);
    }

    @Test
    void shouldResolveProfilesByNameIgnoringCase() {
        assertThat(PlanningProfile.fromName("service-first")).isEqualTo(PlanningProfile.SERVICE_FIRST);
        assertThat(PlanningProfile.fromName("FLEET-WEAR")).isEqualTo(PlanningProfile.FLEET_WEAR);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> PlanningProfile.fromName("weekend"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown planning profile: weekend")
                .hasMessageContaining("depot-friendly");
    }
}
