package com.plantwatch.service;

import com.plantwatch.entity.MeasurementKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * An ingestion request that passed every check, with the address already in
 * canonical form.
 */
@Getter
@AllArgsConstructor
public class ValidatedBatch {
    private final String macAddress;
    private final List<Entry> entries;
    private final Instant recordedAt;
    private final String deviceClass;
    private final Integer resolutionBits;

    @Getter
    @AllArgsConstructor
    public static class Entry {
        private final MeasurementKind kind;
        private final double value;
    }
}
