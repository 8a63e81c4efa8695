package com.plantwatch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Comparison {
    ABOVE("above"),
    BELOW("below");

    private final String code;

    Comparison(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isBreached(double value, double threshold) {
        return this == ABOVE ? value > threshold : value < threshold;
    }

    public static Optional<Comparison> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.code.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
