package com.plantwatch.service;

import com.plantwatch.entity.Device;
import com.plantwatch.entity.Reading;
import com.plantwatch.service.notification.TriggerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Live updates for dashboards. Best effort: nothing here may fail ingestion.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelemetryBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;

    public void publishReadings(Device device, List<Reading> readings) {
        if (readings.isEmpty()) {
            return;
        }
        Map<String, Object> update = new HashMap<>();
        update.put("deviceId", device.getId());
        update.put("address", device.getMacAddress());
        update.put("recordedAt", readings.get(0).getRecordedAt().toString());
        update.put("readings", readings.stream()
                .map(r -> Map.of(
                        "kind", r.getKind().getCode(),
                        "value", r.getValue(),
                        "normalized", Calibration.percentFor(device, r.getKind(), r.getValue())))
                .collect(Collectors.toList()));
        send("/topic/device/" + device.getMacAddress() + "/readings", update);
    }

    public void publishAlert(TriggerContext context) {
        Map<String, Object> alert = new HashMap<>();
        alert.put("ruleId", context.getRuleId());
        alert.put("deviceId", context.getDeviceId());
        alert.put("address", context.getMacAddress());
        alert.put("kind", context.getKind().getCode());
        alert.put("comparison", context.getComparison().getCode());
        alert.put("threshold", context.getThreshold());
        alert.put("value", context.getValue());
        alert.put("triggeredAt", context.getTriggeredAt().toString());
        send("/topic/device/" + context.getMacAddress() + "/alerts", alert);
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("Broadcast to {} failed: {}", destination, e.getMessage());
        }
    }
}
