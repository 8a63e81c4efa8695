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
 * Dry/wet raw readings of one growing medium. Both resolutions are kept side
 * by side because 10-bit and 12-bit boards can share the same medium.
 */
@Entity
@Table(name = "calibration_profiles")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(name = "raw_dry_10bit", nullable = false)
    @Builder.Default
    private int rawDry10 = Resolution.BITS_10.getDefaultDry();

    @Column(name = "raw_wet_10bit", nullable = false)
    @Builder.Default
    private int rawWet10 = Resolution.BITS_10.getDefaultWet();

    @Column(name = "raw_dry_12bit", nullable = false)
    @Builder.Default
    private int rawDry12 = Resolution.BITS_12.getDefaultDry();

    @Column(name = "raw_wet_12bit", nullable = false)
    @Builder.Default
    private int rawWet12 = Resolution.BITS_12.getDefaultWet();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
