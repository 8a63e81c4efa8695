package com.plantwatch.service.notification;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.Comparison;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Everything a channel needs to describe a fired rule, captured before the
 * hand-off to the notification executor so no entity crosses threads.
 */
@Value
@Builder
public class TriggerContext {
    UUID ruleId;
    UUID deviceId;
    String macAddress;
    String deviceLabel;
    MeasurementKind kind;
    Comparison comparison;
    double threshold;
    double value;
    Instant triggeredAt;

    public static TriggerContext of(Device device, AlertRule rule, double value, Instant triggeredAt) {
        return TriggerContext.builder()
                .ruleId(rule.getId())
                .deviceId(device.getId())
                .macAddress(device.getMacAddress())
                .deviceLabel(device.getLabel())
                .kind(rule.getKind())
                .comparison(rule.getComparison())
                .threshold(rule.getThreshold())
                .value(value)
                .triggeredAt(triggeredAt)
                .build();
    }

    public String deviceName() {
        return deviceLabel != null && !deviceLabel.isBlank() ? deviceLabel : macAddress;
    }

    public String formattedValue() {
        return kind.isNormalized()
                ? String.format(Locale.ROOT, "%.1f%%", value)
                : String.format(Locale.ROOT, "%s %s", value, kind.getUnit());
    }
}
