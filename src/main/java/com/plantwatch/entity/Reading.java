package com.plantwatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable measurement. Moisture values are raw ADC magnitudes; the
 * percentage is derived on read.
 */
@Entity
@Table(name = "readings", indexes = {
        @Index(name = "readings_device_kind_time", columnList = "device_id, kind, recorded_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reading {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "device_id", nullable = false, updatable = false)
    private Device device;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private MeasurementKind kind;

    @Column(name = "reading_value", nullable = false, updatable = false)
    private double value;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
