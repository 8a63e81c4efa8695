package com.plantwatch.service;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.AlertTrigger;
import com.plantwatch.repository.AlertRuleRepository;
import com.plantwatch.repository.AlertTriggerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes trigger records under the rule's row lock, so two evaluations of
 * the same rule can never both pass the cooldown check.
 */
@Service
@Slf4j
public class AlertTriggerRecorder {

    private final AlertRuleRepository ruleRepository;
    private final AlertTriggerRepository triggerRepository;
    private final Duration cooldown;

    public AlertTriggerRecorder(AlertRuleRepository ruleRepository,
                                AlertTriggerRepository triggerRepository,
                                @Value("${garden.alerts.cooldown:60m}") Duration cooldown) {
        this.ruleRepository = ruleRepository;
        this.triggerRepository = triggerRepository;
        this.cooldown = cooldown;
    }

    /**
     * @return the new trigger, or empty when the rule fired within the
     * cooldown window or was deactivated meanwhile
     */
    @Transactional
    public Optional<AlertTrigger> recordIfOutsideCooldown(UUID ruleId, double value, Instant now) {
        Optional<AlertRule> locked = ruleRepository.findByIdForUpdate(ruleId);
        if (locked.isEmpty() || !locked.get().isActive()) {
            return Optional.empty();
        }
        if (triggerRepository.existsByRule_IdAndTriggeredAtAfter(ruleId, now.minus(cooldown))) {
            log.debug("Rule {} breached at {} but is cooling down", ruleId, value);
            return Optional.empty();
        }
        AlertTrigger trigger = AlertTrigger.builder()
                .rule(locked.get())
                .triggeredAt(now)
                .valueAtTrigger(value)
                .build();
        return Optional.of(triggerRepository.save(trigger));
    }
}
