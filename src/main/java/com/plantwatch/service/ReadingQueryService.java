package com.plantwatch.service;

import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.ReadingDto;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import com.plantwatch.repository.DeviceRepository;
import com.plantwatch.repository.ReadingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ReadingQueryService {

    static final int MAX_LIMIT = 1000;

    private final DeviceRepository deviceRepository;
    private final ReadingRepository readingRepository;

    /**
     * Newest first. {@code from} and {@code to} take an ISO date or date-time;
     * a date-only {@code to} covers that whole day.
     */
    @Transactional(readOnly = true)
    public ListResponse<ReadingDto> search(UUID deviceId, String kind, String from, String to, int limit, int offset) {
        List<Violation> violations = new ArrayList<>();
        MeasurementKind parsedKind = null;
        if (kind != null && !kind.isBlank()) {
            parsedKind = MeasurementKind.fromCode(kind).orElse(null);
            if (parsedKind == null) {
                violations.add(new Violation(List.of("query", "kind"), "unknown kind '" + kind + "'", "value_error.kind"));
            }
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            violations.add(new Violation(List.of("query", "limit"),
                    "limit must be between 1 and " + MAX_LIMIT, "value_error.number.range"));
        }
        if (offset < 0) {
            violations.add(new Violation(List.of("query", "offset"),
                    "offset must be zero or positive", "value_error.number.range"));
        }
        Instant fromInstant = parseBound(from, false, "from", violations);
        Instant toInstant = parseBound(to, true, "to", violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        if (!deviceRepository.existsById(deviceId)) {
            throw NotFoundException.of("Device", deviceId);
        }

        List<ReadingDto> data = readingRepository.search(deviceId, parsedKind, fromInstant, toInstant, limit, offset)
                .stream()
                .map(ReadingDto::from)
                .collect(Collectors.toList());
        return ListResponse.of(data);
    }

    static Instant parseBound(String value, boolean endOfDay, String name, List<Violation> violations) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (text.length() == 10) {
                LocalDate date = LocalDate.parse(text);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusNanos(1)
                        : date.atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            // No offset given: UTC
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            violations.add(new Violation(List.of("query", name),
                    name + " must be an ISO date or date-time", "value_error.datetime"));
            return null;
        }
    }
}
