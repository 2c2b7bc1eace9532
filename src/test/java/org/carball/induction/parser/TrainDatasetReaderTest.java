package org.carball.induction.parser;

import org.carball.induction.exception.InputException;
import org.carball.induction.model.train.TrainDataset;
import org.carball.induction.model.train.TrainRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TrainDatasetReaderTest {

    @TempDir
    Path tempDir;

    private final TrainDatasetReader reader = new TrainDatasetReader();

    @Test
    void shouldReadTopLevelArray() throws IOException {
        // Given
        Path file = tempDir.resolve("fleet.json");
        Files.writeString(file, """
                [
                  {"train_id": "KMRL-001", "fitness_score": 88.5, "depot": "Aluva", "mileage": 91000,
                   "days_since_maintenance": 4, "open_work_orders": 0, "cert_valid": true,
                   "days_to_cert_expiry": 30, "branding_hours": 40, "recent_delays": 1,
                   "total_delay_minutes": 12, "mechanical_issues": 0, "door_faults": 1,
                   "on_time_performance": 96.0, "target_induct": 1},
                  {"train_id": "KMRL-002", "depot": "Muttom"}
                ]
                """);

        // When
        TrainDataset dataset = reader.read(file);

        // Then
        assertThat(dataset.trainIds()).containsExactly("KMRL-001", "KMRL-002");
        TrainRecord first = dataset.find("KMRL-001").orElseThrow();
        assertThat(first.getFitnessScore()).isEqualTo(88.5);
        assertThat(first.getMileage()).isEqualTo(91000);
        assertThat(first.getCertValid()).isTrue();
        assertThat(first.getDoorFaults()).isEqualTo(1);
        assertThat(first.getOnTimePerformance()).isEqualTo(96.0);
        assertThat(first.getTargetInduct()).isEqualTo(1);

        TrainRecord second = dataset.find("KMRL-002").orElseThrow();
        assertThat(second.getFitnessScore()).isNull();
        assertThat(second.getCertValid()).isNull();
        assertThat(second.hasLabel()).isFalse();
    }

    @Test
    void shouldReadTrainsWrapperObject() {
        // When
        TrainDataset dataset = reader.parse("{\"trains\": [{\"train_id\": \"KMRL-010\", \"mileage\": 1000}]}");

        // Then
        assertThat(dataset.size()).isEqualTo(1);
        assertThat(dataset.find("KMRL-010").orElseThrow().getMileage()).isEqualTo(1000);
    }

    @Test
    void shouldTreatNonNumericValuesAsMissing() {
        // When
        TrainDataset dataset = reader.parse("""
                [{"train_id": "KMRL-003", "fitness_score": "n/a", "mileage": "84500.6",
                  "cert_valid": "yes", "open_work_orders": "", "on_time_performance": "NaN"}]
                """);

        // Then
        TrainRecord train = dataset.getRecords().get(0);
        assertThat(train.getFitnessScore()).isNull();
        assertThat(train.getMileage()).isEqualTo(84501);
        assertThat(train.getCertValid()).isTrue();
        assertThat(train.getOpenWorkOrders()).isNull();
        assertThat(train.getOnTimePerformance()).isNull();
    }

    @Test
    void shouldTreatOutOfRangeIntegersAsMissing() {
        // When
        TrainDataset dataset = reader.parse("""
                [{"train_id": "A", "mileage": 3000000000, "branding_hours": -3000000000},
                 {"train_id": "B", "mileage": "1e12", "door_faults": 2147483647}]
                """);

        // Then
        TrainRecord first = dataset.find("A").orElseThrow();
        assertThat(first.getMileage()).isNull();
        assertThat(first.getBrandingHours()).isNull();
        TrainRecord second = dataset.find("B").orElseThrow();
        assertThat(second.getMileage()).isNull();
        assertThat(second.getDoorFaults()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void shouldDropLabelsOtherThanZeroOrOne() {
        // When
        TrainDataset dataset = reader.parse("""
                [{"train_id": "A", "target_induct": 2},
                 {"train_id": "B", "target_induct": -1},
                 {"train_id": "C", "target_induct": "1"},
                 {"train_id": "D", "target_induct": 0}]
                """);

        // Then
        assertThat(dataset.getRecords()).extracting(TrainRecord::getTargetInduct)
                .containsExactly(null, null, 1, 0);
        assertThat(dataset.find("A").orElseThrow().hasLabel()).isFalse();
    }

    @Test
    void shouldAcceptNumericCertificateFlags() {
        TrainDataset dataset = reader.parse("[{\"train_id\": \"A\", \"cert_valid\": 0}, {\"train_id\": \"B\", \"cert_valid\": \"no\"}]");

        assertThat(dataset.getRecords()).extracting(TrainRecord::getCertValid).containsExactly(false, false);
    }

    @Test
    void shouldReadEmptyArray() {
        assertThat(reader.parse("[]").isEmpty()).isTrue();
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> reader.parse("[{\"train_id\": "))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void shouldRejectNonTabularContent() {
        assertThatThrownBy(() -> reader.parse("{\"fleet\": 3}"))
                .isInstanceOf(InputException.class);
        assertThatThrownBy(() -> reader.parse("[1, 2]"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("row 0");
    }

    @Test
    void shouldRejectDuplicateTrainIds() {
        assertThatThrownBy(() -> reader.parse("[{\"train_id\": \"X\"}, {\"train_id\": \"X\"}]"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("Duplicate train identifier: X");
    }

    @Test
    void shouldRejectRowWithoutIdentifier() {
        assertThatThrownBy(() -> reader.parse("[{\"depot\": \"Aluva\"}]"))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("no train identifier");
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
