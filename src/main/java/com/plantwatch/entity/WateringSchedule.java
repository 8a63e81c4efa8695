package com.plantwatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Only the authoritative fields are persisted; the due date is always derived.
 */
@Entity
@Table(name = "watering_schedules")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WateringSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "subject_id", nullable = false, unique = true, updatable = false)
    private Subject subject;

    @Column(nullable = false)
    private int intervalDays;

    private Instant lastWateredAt;

    @Column(length = 500)
    private String notes;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public Instant nextDueAt() {
        Instant anchor = lastWateredAt != null ? lastWateredAt : createdAt;
        return anchor.plus(Duration.ofDays(intervalDays));
    }

    public boolean isOverdue(Instant now) {
        return now.isAfter(nextDueAt());
    }
}
