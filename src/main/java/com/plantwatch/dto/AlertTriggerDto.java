package com.plantwatch.dto;

import com.plantwatch.entity.AlertTrigger;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertTriggerDto {
    private UUID id;
    private UUID ruleId;
    private Instant triggeredAt;
    private double valueAtTrigger;

    public static AlertTriggerDto from(AlertTrigger trigger) {
        return new AlertTriggerDto(trigger.getId(), trigger.getRule().getId(),
                trigger.getTriggeredAt(), trigger.getValueAtTrigger());
    }
}
