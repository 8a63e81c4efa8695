package com.plantwatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.plantwatch.entity.MeasurementKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendResponse {
    private MeasurementKind kind;
    private int periodDays;
    private List<TrendPoint> points;
    private double currentAvg;
    private Double previousAvg;
    private String direction;
    private Double changePct;
}
