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
 * Threshold condition on one device and kind. Rules are only ever
 * deactivated so that trigger history keeps resolving.
 */
@Entity
@Table(name = "alert_rules", indexes = {
        @Index(name = "alert_rules_device_active", columnList = "device_id, active")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "device_id", nullable = false, updatable = false)
    private Device device;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MeasurementKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "comparison", nullable = false, length = 8)
    private Comparison comparison;

    @Column(nullable = false)
    private double threshold;

    // Group key matched against NotificationChannel.destination
    @Column(nullable = false)
    private String destination;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
