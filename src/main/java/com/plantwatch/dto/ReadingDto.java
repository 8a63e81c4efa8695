package com.plantwatch.dto;

import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReadingDto {
    private UUID id;
    private UUID deviceId;
    private MeasurementKind kind;
    private double value;
    private Instant recordedAt;

    public static ReadingDto from(Reading reading) {
        return new ReadingDto(reading.getId(), reading.getDevice().getId(), reading.getKind(),
                reading.getValue(), reading.getRecordedAt());
    }
}
