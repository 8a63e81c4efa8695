package com.plantwatch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of quantities a device can report. The wire code is what devices
 * and API clients send; the enum name is what gets stored.
 */
public enum MeasurementKind {
    SOIL_MOISTURE("soil_moisture", "%", true),
    TEMPERATURE("temperature", "°C", false),
    HUMIDITY("humidity", "%", false),
    LIGHT("light_lux", "lx", false),
    CO2("co2_ppm", "ppm", false),
    VOC("voc_index", "index", false),
    PRESSURE("pressure_hpa", "hPa", false);

    private final String code;
    private final String unit;
    private final boolean normalized;

    MeasurementKind(String code, String unit, boolean normalized) {
        this.code = code;
        this.unit = unit;
        this.normalized = normalized;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * True when stored values are raw analog magnitudes that must go through
     * calibration before being compared or aggregated.
     */
    public boolean isNormalized() {
        return normalized;
    }

    public static Optional<MeasurementKind> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(k -> k.code.equalsIgnoreCase(trimmed) || k.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
