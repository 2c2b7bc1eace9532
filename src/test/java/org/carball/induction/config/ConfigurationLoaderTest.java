package org.carball.induction.config;

import org.carball.induction.model.prediction.ModelType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigurationLoader loader = new ConfigurationLoader(Map.of());

    @Test
    void shouldUseDefaultsWithoutConfigFile() {
        // When
        PlannerSettings settings = loader.loadConfiguration(null, new String[0]);

        // Then
        assertThat(settings.getTargetInductions()).isEqualTo(25);
        assertThat(settings.getServicePriorityWeight()).isEqualTo(0.30);
        assertThat(settings.getSolverId()).isEqualTo("SCIP");
    }

    @Test
    void shouldUseDefaultsWhenConfigFileIsMissing() {
        // When
        PlannerSettings settings = loader.loadConfiguration(
                tempDir.resolve("missing.yml").toString(), new String[0]);

        // Then
        assertThat(settings.getTargetInductions()).isEqualTo(25);
    }

    @Test
    void shouldUseDefaultsWhenConfigFileIsMalformed() throws IOException {
        // Given
        Path config = tempDir.resolve("broken.yml");
        Files.writeString(config, "optimization: [not, a, mapping\n");

        // When
        PlannerSettings settings = loader.loadConfiguration(config.toString(), new String[0]);

        // Then
        assertThat(settings.getTargetInductions()).isEqualTo(25);
    }

    @Test
    void shouldLoadValuesFromYamlFile() throws IOException {
        // Given
        Path config = writeConfig("""
                optimization:
                  target_inductions: 20
                  optimization_weights:
                    service_priority: 0.4
                    mileage_balance: 0.2
                  depot_capacities:
                    Aluva: 15
                    Muttom: 6
                  solver: CBC
                  solver_timeout: 30
                ml_model:
                  model_type: decision_tree
                  cross_validation_folds: 3
                  random_state: 7
                """);

        // When
        PlannerSettings settings = loader.loadConfiguration(config.toString(), new String[0]);

        // Then
        assertThat(settings.getTargetInductions()).isEqualTo(20);
        assertThat(settings.getServicePriorityWeight()).isEqualTo(0.4);
        assertThat(settings.getMileageBalanceWeight()).isEqualTo(0.2);
        assertThat(settings.getShuntingCostWeight()).isEqualTo(0.30);
        assertThat(settings.getDepotCapacities()).containsOnly(Map.entry("Aluva", 15), Map.entry("Muttom", 6));
        assertThat(settings.getSolverId()).isEqualTo("CBC");
        assertThat(settings.getSolverTimeoutSeconds()).isEqualTo(30);
        assertThat(settings.getModelType()).isEqualTo(ModelType.DECISION_TREE);
        assertThat(settings.getCvFolds()).isEqualTo(3);
        assertThat(settings.getRandomSeed()).isEqualTo(7L);
    }

    @Test
    void shouldUseProfileNamedInYamlAsBase() throws IOException {
        // Given
        Path config = writeConfig("""
                profile: fleet-wear
                optimization:
                  target_inductions: 18
                """);

        // When
        PlannerSettings settings = loader.loadConfiguration(config.toString(), new String[0]);

        // Then
        assertThat(settings.getProfileName()).isEqualTo("fleet-wear");
        assertThat(settings.getMileageBalanceWeight()).isEqualTo(0.45);
        assertThat(settings.getTargetInductions()).isEqualTo(18);
    }

    @Test
    void shouldApplyPriorityCliOverEnvironmentOverYaml() throws IOException {
        // Given
        Path config = writeConfig("""
                optimization:
                  target_inductions: 20
                  solver: CBC
                  solver_timeout: 30
                """);
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "INDUCTION_TARGET", "22",
                "INDUCTION_SOLVER_TIMEOUT", "45"));
        String[] args = {"--target", "24"};

        // When
        PlannerSettings settings = envLoader.loadConfiguration(config.toString(), args);

        // Then
        assertThat(settings.getTargetInductions()).isEqualTo(24);
        assertThat(settings.getSolverTimeoutSeconds()).isEqualTo(45);
        assertThat(settings.getSolverId()).isEqualTo("CBC");
    }

    @Test
    void shouldReadEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "INDUCTION_SOLVER", "CBC",
                "INDUCTION_MIP_GAP", "0.05",
                "INDUCTION_MODEL_TYPE", "decision_tree",
                "INDUCTION_MODEL_PATH", "/tmp/model.ser",
                "INDUCTION_RANDOM_SEED", "99"));

        // When
        PlannerSettings settings = envLoader.loadConfiguration(null, new String[0]);

        // Then
        assertThat(settings.getSolverId()).isEqualTo("CBC");
        assertThat(settings.getMipGap()).isEqualTo(0.05);
        assertThat(settings.getModelType()).isEqualTo(ModelType.DECISION_TREE);
        assertThat(settings.getModelPath()).isEqualTo("/tmp/model.ser");
        assertThat(settings.getRandomSeed()).isEqualTo(99L);
    }

    @Test
    void shouldIgnoreInvalidEnvironmentValue() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("INDUCTION_TARGET", "lots"));

        // When
        PlannerSettings settings = envLoader.loadConfiguration(null, new String[0]);

        // Then
        assertThat(settings.getTargetInductions()).isEqualTo(25);
    }

    @Test
    void shouldApplyCliWeightsAndIgnoreBadNumbers() {
        // Given
        String[] args = {
                "--weights.service", "0.5",
                "--weights.mileage", "0.1",
                "--weights.shunting", "0.25",
                "--weights.depot", "0.15",
                "--seed", "abc"
        };

        // When
        PlannerSettings settings = loader.loadConfiguration(null, args);

        // Then
        assertThat(settings.getServicePriorityWeight()).isEqualTo(0.5);
        assertThat(settings.getMileageBalanceWeight()).isEqualTo(0.1);
        assertThat(settings.getShuntingCostWeight()).isEqualTo(0.25);
        assertThat(settings.getDepotEfficiencyWeight()).isEqualTo(0.15);
        assertThat(settings.getRandomSeed()).isEqualTo(42L);
    }

    @Test
    void shouldMergeCliDepotCapacities() {
        // Given
        String[] args = {"--depot-capacity", "Muttom=4", "--depot-capacity", "Aluva=14"};

        // When
        PlannerSettings settings = loader.loadConfiguration(null, args);

        // Then
        assertThat(settings.getDepotCapacities()).containsOnly(
                Map.entry("Aluva", 14),
                Map.entry("Palarivattom", 8),
                Map.entry("Kalamassery", 5),
                Map.entry("Muttom", 4));
    }

    @Test
    void shouldLoadNamedProfileThenOverlayCli() {
        // When
        PlannerSettings settings = loader.loadConfigurationWithProfile(
                "service-first", null, new String[]{"--target", "30"});

        // Then
        assertThat(settings.getProfileName()).isEqualTo("service-first");
        assertThat(settings.getServicePriorityWeight()).isEqualTo(0.50);
        assertThat(settings.getTargetInductions()).isEqualTo(30);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown planning profile");
    }

    @Test
    void shouldDescribeConfigurationOptions() {
        assertThat(ConfigurationLoader.getConfigurationHelp())
                .contains("--target")
                .contains("INDUCTION_SOLVER")
                .contains("Priority Order");
    }

    private Path writeConfig(String yaml) throws IOException {
        Path config = tempDir.resolve("induction-planner.yml");
        Files.writeString(config, yaml);
        return config;
    }
}
