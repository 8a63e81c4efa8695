package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WateringScheduleRequest {
    private Integer intervalDays;
    private Instant lastWateredAt;
    private String notes;
    private Boolean enabled;
}
