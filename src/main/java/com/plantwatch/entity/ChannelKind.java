package com.plantwatch.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ChannelKind {
    EMAIL("email"),
    TELEGRAM("telegram"),
    DISCORD("discord"),
    WEBHOOK("webhook");

    private final String code;

    ChannelKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<ChannelKind> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.code.equalsIgnoreCase(value.trim()) || k.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
