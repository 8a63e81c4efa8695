package com.plantwatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.plantwatch.entity.WateringEvent;
import com.plantwatch.entity.WateringSource;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WateringEventDto {
    private UUID id;
    private UUID subjectId;
    private UUID deviceId;
    private Instant detectedAt;
    private Double moistureBefore;
    private Double moistureAfter;
    private WateringSource source;
    private String notes;

    public static WateringEventDto from(WateringEvent event) {
        return WateringEventDto.builder()
                .id(event.getId())
                .subjectId(event.getSubject().getId())
                .deviceId(event.getDevice() != null ? event.getDevice().getId() : null)
                .detectedAt(event.getDetectedAt())
                .moistureBefore(event.getMoistureBefore())
                .moistureAfter(event.getMoistureAfter())
                .source(event.getSource())
                .notes(event.getNotes())
                .build();
    }
}
