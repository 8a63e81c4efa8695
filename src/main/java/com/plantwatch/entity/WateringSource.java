package com.plantwatch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WateringSource {
    AUTO("auto"),
    MANUAL("manual");

    private final String code;

    WateringSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
