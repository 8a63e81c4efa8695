package com.plantwatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * A board model (e.g. "esp8266-soil"). Devices report its slug on every wake
 * cycle; the class supplies the ADC resolution when the payload does not.
 */
@Entity
@Table(name = "device_classes")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceClass {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(nullable = false)
    private String name;

    @Column(name = "resolution_bits", nullable = false)
    private int resolutionBits;
}
