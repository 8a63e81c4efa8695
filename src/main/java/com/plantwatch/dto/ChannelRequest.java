package com.plantwatch.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelRequest {
    private String name;
    private String kind;
    private String destination;
    private JsonNode config;
    private Boolean enabled;
}
