package com.plantwatch.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One wake-cycle batch, as posted over HTTP or published over MQTT.
 * Everything is loosely typed here; IngestionValidator does the checking so
 * that every problem can be reported at once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {
    @JsonAlias({"device", "macAddress", "mac"})
    private String deviceAddress;

    private List<ReadingInput> readings;

    // Epoch seconds, device clock
    private Long recordedAt;

    private String deviceClass;

    private Integer resolutionBits;
}
