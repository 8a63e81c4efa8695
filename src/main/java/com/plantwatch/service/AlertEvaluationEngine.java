package com.plantwatch.service;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.AlertTrigger;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.repository.AlertRuleRepository;
import com.plantwatch.service.notification.DispatchReport;
import com.plantwatch.service.notification.NotificationDispatcher;
import com.plantwatch.service.notification.TriggerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs after the readings of a batch are committed, once per kind present in
 * the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluationEngine {

    private final AlertRuleRepository ruleRepository;
    private final AlertTriggerRecorder triggerRecorder;
    private final NotificationDispatcher dispatcher;
    private final TelemetryBroadcaster broadcaster;
    private final Clock clock;

    /**
     * @param rawValue the stored value; moisture is normalized here before comparing
     * @return number of rules that fired
     */
    public int evaluate(Device device, MeasurementKind kind, double rawValue) {
        double value = Calibration.percentFor(device, kind, rawValue);
        List<AlertRule> rules = ruleRepository.findByDevice_IdAndKindAndActiveTrue(device.getId(), kind);

        int fired = 0;
        for (AlertRule rule : rules) {
            if (!rule.getComparison().isBreached(value, rule.getThreshold())) {
                continue;
            }
            try {
                Optional<AlertTrigger> trigger = triggerRecorder.recordIfOutsideCooldown(rule.getId(), value, clock.instant());
                if (trigger.isEmpty()) {
                    continue;
                }
                fired++;
                TriggerContext context = TriggerContext.of(device, rule, value, trigger.get().getTriggeredAt());
                log.info("Rule {} fired for device {}: {} {} {} (value {})", rule.getId(), device.getMacAddress(),
                        kind.getCode(), rule.getComparison().getCode(), rule.getThreshold(), value);
                broadcaster.publishAlert(context);
                CompletableFuture<DispatchReport> delivery = dispatcher.dispatch(rule.getDestination(), context);
                if (delivery != null) {
                    delivery.whenComplete((report, error) -> logDelivery(rule, report, error));
                }
            } catch (RuntimeException e) {
                log.warn("Trigger attempt for rule {} failed", rule.getId(), e);
            }
        }
        return fired;
    }

    private void logDelivery(AlertRule rule, DispatchReport report, Throwable error) {
        if (error != null) {
            log.warn("Notification for rule {} to '{}' failed", rule.getId(), rule.getDestination(), error);
        } else if (report != null && report.getFailed() > 0) {
            log.warn("Notification for rule {} to '{}': {} delivered, {} failed", rule.getId(),
                    rule.getDestination(), report.getDelivered(), report.getFailed());
        } else if (report != null) {
            log.debug("Notification for rule {} delivered to {} channel(s)", rule.getId(), report.getDelivered());
        }
    }
}
