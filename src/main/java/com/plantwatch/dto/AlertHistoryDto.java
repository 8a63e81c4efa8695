package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * History of one rule. Deactivated rules still resolve here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistoryDto {
    private AlertRuleDto rule;
    private List<AlertTriggerDto> data;
    private int count;
}
