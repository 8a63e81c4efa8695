package com.plantwatch.service;

import com.plantwatch.dto.IngestRequest;
import com.plantwatch.dto.ReadingInput;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Resolution;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks a whole batch and reports every problem at once. Nothing reaches the
 * store unless this passes.
 */
@Component
public class IngestionValidator {

    private static final String KIND_CODES = Arrays.stream(MeasurementKind.values())
            .map(MeasurementKind::getCode)
            .collect(Collectors.joining(", "));

    private final Clock clock;
    private final Duration clockSkewTolerance;

    public IngestionValidator(Clock clock,
                              @Value("${garden.ingestion.clock-skew-tolerance:24h}") Duration clockSkewTolerance) {
        this.clock = clock;
        this.clockSkewTolerance = clockSkewTolerance;
    }

    public ValidatedBatch validate(IngestRequest request) {
        List<Violation> violations = new ArrayList<>();

        String mac = null;
        if (request.getDeviceAddress() == null || request.getDeviceAddress().isBlank()) {
            violations.add(missing("deviceAddress"));
        } else {
            Optional<String> canonical = DeviceIdentityResolver.canonicalize(request.getDeviceAddress());
            if (canonical.isPresent()) {
                mac = canonical.get();
            } else {
                violations.add(new Violation(List.of("body", "deviceAddress"),
                        "deviceAddress must be 12 hex digits, optionally separated by ':', '-' or '.'",
                        "value_error.address"));
            }
        }

        Instant recordedAt = null;
        if (request.getRecordedAt() == null) {
            violations.add(missing("recordedAt"));
        } else {
            recordedAt = Instant.ofEpochSecond(request.getRecordedAt());
            Instant now = clock.instant();
            if (recordedAt.isBefore(now.minus(clockSkewTolerance)) || recordedAt.isAfter(now.plus(clockSkewTolerance))) {
                violations.add(new Violation(List.of("body", "recordedAt"),
                        "recordedAt must be within " + clockSkewTolerance.toHours() + "h of server time",
                        "value_error.recorded_at"));
            }
        }

        if (request.getResolutionBits() != null && Resolution.fromBits(request.getResolutionBits()).isEmpty()) {
            violations.add(new Violation(List.of("body", "resolutionBits"),
                    "resolutionBits must be 10 or 12", "value_error.resolution"));
        }

        List<ValidatedBatch.Entry> entries = new ArrayList<>();
        List<ReadingInput> readings = request.getReadings();
        if (readings == null || readings.isEmpty()) {
            violations.add(new Violation(List.of("body", "readings"),
                    "ensure this value has at least 1 items", "value_error.list.min_items"));
        } else {
            for (int i = 0; i < readings.size(); i++) {
                ReadingInput input = readings.get(i);
                if (input == null) {
                    violations.add(new Violation(List.of("body", "readings", i),
                            "reading must be an object", "type_error.dict"));
                    continue;
                }
                MeasurementKind kind = null;
                if (input.getKind() == null || input.getKind().isBlank()) {
                    violations.add(new Violation(List.of("body", "readings", i, "kind"),
                            "field required", "value_error.missing"));
                } else {
                    kind = MeasurementKind.fromCode(input.getKind()).orElse(null);
                    if (kind == null) {
                        violations.add(new Violation(List.of("body", "readings", i, "kind"),
                                "unknown kind '" + input.getKind() + "', expected one of: " + KIND_CODES,
                                "value_error.kind"));
                    }
                }
                if (input.getValue() == null) {
                    violations.add(new Violation(List.of("body", "readings", i, "value"),
                            "field required", "value_error.missing"));
                } else if (!Double.isFinite(input.getValue())) {
                    violations.add(new Violation(List.of("body", "readings", i, "value"),
                            "value must be a finite number", "value_error.finite"));
                }
                if (kind != null && input.getValue() != null && Double.isFinite(input.getValue())) {
                    entries.add(new ValidatedBatch.Entry(kind, input.getValue()));
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return new ValidatedBatch(mac, entries, recordedAt, request.getDeviceClass(), request.getResolutionBits());
    }

    private static Violation missing(String field) {
        return new Violation(List.of("body", field), "field required", "value_error.missing");
    }
}
