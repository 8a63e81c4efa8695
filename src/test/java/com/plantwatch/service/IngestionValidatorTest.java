package com.plantwatch.service;

import com.plantwatch.dto.IngestRequest;
import com.plantwatch.dto.ReadingInput;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class IngestionValidatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final IngestionValidator validator =
            new IngestionValidator(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofHours(24));

    @Test
    void acceptsWellFormedBatchAndCanonicalizesAddress() {
        IngestRequest request = new IngestRequest("aa:bb:cc:dd:ee:ff",
                List.of(new ReadingInput("soil_moisture", 612.0), new ReadingInput("temperature", 21.4)),
                NOW.getEpochSecond(), "esp32-soil", 12);

        ValidatedBatch batch = validator.validate(request);

        assertThat(batch.getMacAddress()).isEqualTo("AABBCCDDEEFF");
        assertThat(batch.getEntries()).extracting(ValidatedBatch.Entry::getKind)
                .containsExactly(MeasurementKind.SOIL_MOISTURE, MeasurementKind.TEMPERATURE);
        assertThat(batch.getRecordedAt()).isEqualTo(NOW);
    }

    @Test
    void unknownKindInTheMiddleIsReportedWithItsPosition() {
        IngestRequest request = new IngestRequest("AABBCCDDEEFF",
                List.of(new ReadingInput("temperature", 20.0),
                        new ReadingInput("radiation", 1.0),
                        new ReadingInput("humidity", 40.0)),
                NOW.getEpochSecond(), null, null);

        ValidationException ex = catchThrowableOfType(() -> validator.validate(request), ValidationException.class);

        assertThat(ex.getViolations()).hasSize(1);
        Violation violation = ex.getViolations().get(0);
        assertThat(violation.getLoc()).containsExactly("body", "readings", 1, "kind");
        assertThat(violation.getType()).isEqualTo("value_error.kind");
    }

    @Test
    void everyProblemIsReportedTogether() {
        IngestRequest request = new IngestRequest("not-a-mac",
                List.of(new ReadingInput(null, 1.0), new ReadingInput("humidity", Double.NaN)),
                NOW.minus(Duration.ofDays(3)).getEpochSecond(), null, 8);

        ValidationException ex = catchThrowableOfType(() -> validator.validate(request), ValidationException.class);

        assertThat(ex.getViolations()).extracting(Violation::getType).containsExactlyInAnyOrder(
                "value_error.address",
                "value_error.recorded_at",
                "value_error.resolution",
                "value_error.missing",
                "value_error.finite");
    }

    @Test
    void emptyBatchIsRejected() {
        IngestRequest request = new IngestRequest("AABBCCDDEEFF", List.of(), NOW.getEpochSecond(), null, null);

        assertThatThrownBy(() -> validator.validate(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void clockSkewWithinToleranceIsAccepted() {
        IngestRequest request = new IngestRequest("AABBCCDDEEFF", List.of(new ReadingInput("light_lux", 300.0)),
                NOW.plus(Duration.ofHours(23)).getEpochSecond(), null, null);

        assertThat(validator.validate(request).getEntries()).hasSize(1);
    }
}
