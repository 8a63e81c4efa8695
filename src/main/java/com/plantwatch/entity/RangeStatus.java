package com.plantwatch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RangeStatus {
    CRITICAL_LOW("critical_low"),
    LOW("low"),
    OPTIMAL("optimal"),
    HIGH("high"),
    CRITICAL_HIGH("critical_high");

    private final String code;

    RangeStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
