package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertRuleRequest {
    private UUID deviceId;
    private String kind;
    // "above" or "below"
    private String comparison;
    private Double threshold;
    private String destination;
}
