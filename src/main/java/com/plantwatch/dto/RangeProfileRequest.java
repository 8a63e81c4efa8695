package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RangeProfileRequest {
    private String name;
    private String description;
    private List<Bounds> ranges;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bounds {
        private String kind;
        private Double absoluteMin;
        private Double optimalMin;
        private Double optimalMax;
        private Double absoluteMax;
    }
}
