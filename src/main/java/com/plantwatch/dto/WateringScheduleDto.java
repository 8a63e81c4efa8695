package com.plantwatch.dto;

import com.plantwatch.entity.WateringSchedule;
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
public class WateringScheduleDto {
    private UUID id;
    private UUID subjectId;
    private int intervalDays;
    private Instant lastWateredAt;
    private String notes;
    private boolean enabled;
    private Instant createdAt;
    private Instant nextDueAt;
    private boolean overdue;

    public static WateringScheduleDto from(WateringSchedule schedule, Instant now) {
        return WateringScheduleDto.builder()
                .id(schedule.getId())
                .subjectId(schedule.getSubject().getId())
                .intervalDays(schedule.getIntervalDays())
                .lastWateredAt(schedule.getLastWateredAt())
                .notes(schedule.getNotes())
                .enabled(schedule.isEnabled())
                .createdAt(schedule.getCreatedAt())
                .nextDueAt(schedule.nextDueAt())
                .overdue(schedule.isOverdue(now))
                .build();
    }
}
