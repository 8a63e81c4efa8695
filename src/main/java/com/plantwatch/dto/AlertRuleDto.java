package com.plantwatch.dto;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.Comparison;
import com.plantwatch.entity.MeasurementKind;
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
public class AlertRuleDto {
    private UUID id;
    private UUID deviceId;
    private MeasurementKind kind;
    private Comparison comparison;
    private double threshold;
    private String destination;
    private boolean active;
    private Instant createdAt;

    public static AlertRuleDto from(AlertRule rule) {
        return AlertRuleDto.builder()
                .id(rule.getId())
                .deviceId(rule.getDevice().getId())
                .kind(rule.getKind())
                .comparison(rule.getComparison())
                .threshold(rule.getThreshold())
                .destination(rule.getDestination())
                .active(rule.isActive())
                .createdAt(rule.getCreatedAt())
                .build();
    }
}
