package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceClassRequest {
    private String slug;
    private String name;
    private Integer resolutionBits;
}
