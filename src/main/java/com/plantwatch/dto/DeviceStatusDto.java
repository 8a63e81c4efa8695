package com.plantwatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.RangeStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatusDto {
    private UUID deviceId;
    private String rangeProfile;
    private List<KindStatus> kinds;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class KindStatus {
        private MeasurementKind kind;
        private double value;
        private String unit;
        private Instant recordedAt;
        // Absent when the device has no range for this kind
        private RangeStatus status;
    }
}
