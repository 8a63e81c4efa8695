package com.plantwatch.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.exception.DispatchException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Channel configuration is stored as JSON text and only ever read back
 * through the typed config class of the channel's kind.
 */
@Component
@RequiredArgsConstructor
public class ChannelConfigCodec {

    private final ObjectMapper objectMapper;
    private final ChannelAdapterRegistry registry;

    /**
     * Binds {@code config} to the kind's config type, checks it and returns the
     * normalized JSON to store.
     */
    public String validateAndEncode(ChannelKind kind, JsonNode config) {
        if (config == null || !config.isObject()) {
            throw new ValidationException(List.of("body", "config"), "config must be an object", "type_error.dict");
        }
        Class<? extends ChannelConfig> type = registry.forKind(kind).configType();
        ChannelConfig typed;
        try {
            typed = objectMapper.treeToValue(config, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException(List.of("body", "config"),
                    "config does not match the " + kind.getCode() + " channel: " + e.getOriginalMessage(),
                    "value_error.config");
        }
        List<Violation> violations = new ArrayList<>();
        for (String problem : typed.problems()) {
            violations.add(new Violation(List.of("body", "config"), problem, "value_error.config"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        try {
            return objectMapper.writeValueAsString(typed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode " + kind + " config", e);
        }
    }

    public <C extends ChannelConfig> C decode(String json, Class<C> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Stored channel config is unreadable", e);
        }
    }

    public JsonNode toTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored channel config is unreadable", e);
        }
    }
}
