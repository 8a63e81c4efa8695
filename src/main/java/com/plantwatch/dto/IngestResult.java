package com.plantwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestResult {
    private String status = "ok";
    private int inserted;
    private int alertsTriggered;

    public IngestResult(int inserted, int alertsTriggered) {
        this.inserted = inserted;
        this.alertsTriggered = alertsTriggered;
    }
}
