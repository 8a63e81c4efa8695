package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Null fields are left untouched. Profile references are cleared with the
 * explicit {@code clear*} flags.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceUpdateRequest {
    private String label;
    private String location;
    private UUID calibrationProfileId;
    private UUID rangeProfileId;
    private boolean clearCalibrationProfile;
    private boolean clearRangeProfile;
}
