package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationProfileRequest {
    private String name;
    private Integer rawDry10;
    private Integer rawWet10;
    private Integer rawDry12;
    private Integer rawWet12;
}
