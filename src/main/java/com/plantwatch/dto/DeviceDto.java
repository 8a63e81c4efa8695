package com.plantwatch.dto;

import com.plantwatch.entity.Device;
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
public class DeviceDto {
    private UUID id;
    private String macAddress;
    private String label;
    private String location;
    private String deviceClass;
    private int resolutionBits;
    private UUID calibrationProfileId;
    private UUID rangeProfileId;
    private Instant createdAt;
    private Instant lastSeenAt;

    public static DeviceDto from(Device device) {
        return DeviceDto.builder()
                .id(device.getId())
                .macAddress(device.getMacAddress())
                .label(device.getLabel())
                .location(device.getLocation())
                .deviceClass(device.getDeviceClass() != null ? device.getDeviceClass().getSlug() : null)
                .resolutionBits(device.getResolutionBits())
                .calibrationProfileId(device.getCalibrationProfile() != null ? device.getCalibrationProfile().getId() : null)
                .rangeProfileId(device.getRangeProfile() != null ? device.getRangeProfile().getId() : null)
                .createdAt(device.getCreatedAt())
                .lastSeenAt(device.getLastSeenAt())
                .build();
    }
}
