package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrendPoint {
    // Start of the day-sized bucket
    private Instant day;
    private double avg;
    private double min;
    private double max;
    private int count;
}
