package com.plantwatch.service;

import com.plantwatch.entity.KindRange;
import com.plantwatch.entity.RangeStatus;

public final class RangeClassifier {

    private RangeClassifier() {
    }

    public static RangeStatus classify(double value, KindRange range) {
        if (value < range.getAbsoluteMin()) {
            return RangeStatus.CRITICAL_LOW;
        }
        if (value > range.getAbsoluteMax()) {
            return RangeStatus.CRITICAL_HIGH;
        }
        if (value < range.getOptimalMin()) {
            return RangeStatus.LOW;
        }
        if (value > range.getOptimalMax()) {
            return RangeStatus.HIGH;
        }
        return RangeStatus.OPTIMAL;
    }
}
