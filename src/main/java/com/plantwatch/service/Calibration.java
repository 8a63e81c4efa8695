package com.plantwatch.service;

import com.plantwatch.entity.CalibrationProfile;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Resolution;
import lombok.Value;

/**
 * Raw soil-moisture magnitude to percent. Capacitive probes read high when
 * dry and low when wet, so the dry value is the 0% end of the scale.
 */
public final class Calibration {

    private Calibration() {
    }

    public static double normalize(double raw, double dry, double wet) {
        if (dry == wet) {
            return 0.0;
        }
        double pct = ((dry - raw) / (dry - wet)) * 100.0;
        return Math.max(0.0, Math.min(100.0, pct));
    }

    public static Pair selectPair(CalibrationProfile profile, Resolution resolution) {
        if (profile == null) {
            return new Pair(resolution.getDefaultDry(), resolution.getDefaultWet());
        }
        return resolution == Resolution.BITS_12
                ? new Pair(profile.getRawDry12(), profile.getRawWet12())
                : new Pair(profile.getRawDry10(), profile.getRawWet10());
    }

    /**
     * Value as it should be compared and aggregated: percent for kinds that
     * need calibration, untouched otherwise.
     */
    public static double percentFor(Device device, MeasurementKind kind, double value) {
        if (!kind.isNormalized()) {
            return value;
        }
        Pair pair = selectPair(device.getCalibrationProfile(), device.getResolution());
        return normalize(value, pair.getDry(), pair.getWet());
    }

    @Value
    public static class Pair {
        int dry;
        int wet;
    }
}
