package com.plantwatch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Four ordered bounds for one kind: absoluteMin <= optimalMin <= optimalMax <= absoluteMax.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KindRange {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MeasurementKind kind;

    @Column(nullable = false)
    private double absoluteMin;

    @Column(nullable = false)
    private double optimalMin;

    @Column(nullable = false)
    private double optimalMax;

    @Column(nullable = false)
    private double absoluteMax;

    public boolean isOrdered() {
        return absoluteMin <= optimalMin && optimalMin <= optimalMax && optimalMax <= absoluteMax;
    }
}
