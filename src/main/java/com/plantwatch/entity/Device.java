package com.plantwatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "devices")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Canonical form: 12 upper-case hex digits, no separators
    @Column(name = "mac_address", length = 12, nullable = false, unique = true, updatable = false)
    private String macAddress;

    private String label;

    @Column(nullable = false)
    @Builder.Default
    private String location = "";

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "device_class_id")
    private DeviceClass deviceClass;

    @Column(name = "resolution_bits", nullable = false)
    @Builder.Default
    private int resolutionBits = Resolution.BITS_10.getBits();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "calibration_profile_id")
    private CalibrationProfile calibrationProfile;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "range_profile_id")
    private RangeProfile rangeProfile;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant lastSeenAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public Resolution getResolution() {
        return Resolution.fromBitsOrDefault(resolutionBits);
    }
}
