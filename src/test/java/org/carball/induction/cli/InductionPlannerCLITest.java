package org.carball.induction.cli;

import org.carball.induction.model.decision.ManualOverride;
import org.carball.induction.output.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InductionPlannerCLITest {

    @TempDir
    Path tempDir;

    private String datasetFile;

    @BeforeEach
    void setUp() throws IOException {
        Path dataset = tempDir.resolve("fleet.json");
        Files.writeString(dataset, "[]");
        datasetFile = dataset.toString();
    }

    @Test
    void shouldParseMinimalArguments() {
        // When
        PlannerCommand command = InductionPlannerCLI.parseArgs(new String[]{datasetFile});

        // Then
        assertThat(command.getDatasetFile()).isEqualTo(Path.of(datasetFile));
        assertThat(command.getOutputFile()).isEqualTo("induction-plan.json");
        assertThat(command.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(command.isTrain()).isFalse();
        assertThat(command.getOverrides()).isEmpty();
    }

    @Test
    void shouldParseAllCommandOptions() {
        // Given
        String output = tempDir.resolve("plan").toString();
        String[] args = {
                datasetFile,
                "--output", output,
                "--format", "markdown",
                "--train",
                "--config", "planner.yml",
                "--profile", "fleet-wear",
                "--override", "KMRL-004=0:Bogie check",
                "--override", "KMRL-010=1",
                "-v"
        };

        // When
        PlannerCommand command = InductionPlannerCLI.parseArgs(args);

        // Then
        assertThat(command.getOutputFile()).isEqualTo(output + ".md");
        assertThat(command.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(command.isTrain()).isTrue();
        assertThat(command.getConfigFile()).isEqualTo("planner.yml");
        assertThat(command.getProfile()).isEqualTo("fleet-wear");
        assertThat(command.isVerbose()).isTrue();
        assertThat(command.getOverrides()).containsExactly(
                new ManualOverride("KMRL-004", 0, "Bogie check"),
                new ManualOverride("KMRL-010", 1, null));
    }

    @Test
    void shouldSkipPlannerTuningOptions() {
        // Given
        String[] args = {datasetFile, "--target", "20", "--depot-capacity", "Aluva=14", "--seed", "3"};

        // When
        PlannerCommand command = InductionPlannerCLI.parseArgs(args);

        // Then
        assertThat(command.getOutputFile()).isEqualTo("induction-plan.json");
    }

    @Test
    void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> InductionPlannerCLI.parseArgs(new String[]{datasetFile, "--fast"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --fast");
    }

    @Test
    void shouldRejectOptionWithoutValue() {
        assertThatThrownBy(() -> InductionPlannerCLI.parseArgs(new String[]{datasetFile, "--target"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--target");
    }

    @Test
    void shouldRejectMissingDatasetFile() {
        String missing = tempDir.resolve("missing.json").toString();

        assertThatThrownBy(() -> InductionPlannerCLI.parseArgs(new String[]{missing}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Dataset file not found");
    }

    @Test
    void shouldRejectUnknownFormat() {
        assertThatThrownBy(() -> InductionPlannerCLI.parseArgs(new String[]{datasetFile, "--format", "csv"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown output format");
    }

    @Test
    void shouldParseOverrideWithReasonContainingColon() {
        // When
        ManualOverride override = InductionPlannerCLI.parseOverride("KMRL-007=0:Hold: wheel profile");

        // Then
        assertThat(override.trainId()).isEqualTo("KMRL-007");
        assertThat(override.decision()).isZero();
        assertThat(override.reason()).isEqualTo("Hold: wheel profile");
    }

    @Test
    void shouldRejectMalformedOverrides() {
        assertThatThrownBy(() -> InductionPlannerCLI.parseOverride("KMRL-007"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InductionPlannerCLI.parseOverride("=1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InductionPlannerCLI.parseOverride("KMRL-007=2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be 0 or 1");
    }
}
