package com.plantwatch.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.plantwatch.entity.ChannelKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelDto {
    private UUID id;
    private String name;
    private ChannelKind kind;
    private String destination;
    private JsonNode config;
    private boolean enabled;
    private Instant createdAt;
}
