package com.plantwatch.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * ADC bit depths the fleet ships with, each with its fallback dry/wet pair for
 * devices that have no calibration profile.
 */
public enum Resolution {
    BITS_10(10, 800, 400),
    BITS_12(12, 3200, 600);

    private final int bits;
    private final int defaultDry;
    private final int defaultWet;

    Resolution(int bits, int defaultDry, int defaultWet) {
        this.bits = bits;
        this.defaultDry = defaultDry;
        this.defaultWet = defaultWet;
    }

    public int getBits() {
        return bits;
    }

    public int getDefaultDry() {
        return defaultDry;
    }

    public int getDefaultWet() {
        return defaultWet;
    }

    public static Optional<Resolution> fromBits(Integer bits) {
        if (bits == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(r -> r.bits == bits).findFirst();
    }

    /** Unknown or missing bit depths read as the 10-bit default. */
    public static Resolution fromBitsOrDefault(Integer bits) {
        return fromBits(bits).orElse(BITS_10);
    }
}
