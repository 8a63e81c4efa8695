package com.plantwatch.service;

import com.plantwatch.dto.AlertHistoryDto;
import com.plantwatch.dto.AlertRuleDto;
import com.plantwatch.dto.AlertRuleRequest;
import com.plantwatch.dto.AlertTriggerDto;
import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.Comparison;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import com.plantwatch.repository.AlertRuleRepository;
import com.plantwatch.repository.AlertTriggerRepository;
import com.plantwatch.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AlertRuleService {

    private final AlertRuleRepository ruleRepository;
    private final AlertTriggerRepository triggerRepository;
    private final DeviceRepository deviceRepository;

    @Transactional
    public AlertRuleDto create(AlertRuleRequest request) {
        List<Violation> violations = new ArrayList<>();
        if (request.getDeviceId() == null) {
            violations.add(new Violation(List.of("body", "deviceId"), "field required", "value_error.missing"));
        }
        MeasurementKind kind = MeasurementKind.fromCode(request.getKind()).orElse(null);
        if (kind == null) {
            violations.add(new Violation(List.of("body", "kind"), "unknown kind '" + request.getKind() + "'",
                    "value_error.kind"));
        }
        Comparison comparison = Comparison.fromCode(request.getComparison()).orElse(null);
        if (comparison == null) {
            violations.add(new Violation(List.of("body", "comparison"), "comparison must be 'above' or 'below'",
                    "value_error.comparison"));
        }
        if (request.getThreshold() == null || !Double.isFinite(request.getThreshold())) {
            violations.add(new Violation(List.of("body", "threshold"), "threshold must be a finite number",
                    "value_error.finite"));
        }
        if (request.getDestination() == null || request.getDestination().isBlank()) {
            violations.add(new Violation(List.of("body", "destination"), "field required", "value_error.missing"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        Device device = deviceRepository.findById(request.getDeviceId())
                .orElseThrow(() -> NotFoundException.of("Device", request.getDeviceId()));
        AlertRule rule = ruleRepository.save(AlertRule.builder()
                .device(device)
                .kind(kind)
                .comparison(comparison)
                .threshold(request.getThreshold())
                .destination(request.getDestination().trim())
                .build());
        log.info("Created rule {} on {}: {} {} {}", rule.getId(), device.getMacAddress(), kind.getCode(),
                comparison.getCode(), rule.getThreshold());
        return AlertRuleDto.from(rule);
    }

    @Transactional(readOnly = true)
    public List<AlertRuleDto> list(UUID deviceId, Boolean active) {
        List<AlertRule> rules;
        if (deviceId != null && active != null) {
            rules = ruleRepository.findByDevice_IdAndActiveOrderByCreatedAtDesc(deviceId, active);
        } else if (deviceId != null) {
            rules = ruleRepository.findByDevice_IdOrderByCreatedAtDesc(deviceId);
        } else if (active != null) {
            rules = ruleRepository.findByActiveOrderByCreatedAtDesc(active);
        } else {
            rules = ruleRepository.findAllByOrderByCreatedAtDesc();
        }
        return rules.stream().map(AlertRuleDto::from).collect(Collectors.toList());
    }

    /**
     * Soft delete: the rule stops being evaluated but its history stays
     * readable.
     */
    @Transactional
    public void deactivate(UUID id) {
        AlertRule rule = ruleRepository.findById(id).orElseThrow(() -> NotFoundException.of("Alert rule", id));
        if (rule.isActive()) {
            rule.setActive(false);
            ruleRepository.save(rule);
            log.info("Deactivated rule {}", id);
        }
    }

    @Transactional(readOnly = true)
    public AlertHistoryDto history(UUID id) {
        AlertRule rule = ruleRepository.findById(id).orElseThrow(() -> NotFoundException.of("Alert rule", id));
        List<AlertTriggerDto> triggers = triggerRepository.findByRule_IdOrderByTriggeredAtDesc(id).stream()
                .map(AlertTriggerDto::from)
                .collect(Collectors.toList());
        return new AlertHistoryDto(AlertRuleDto.from(rule), triggers, triggers.size());
    }
}
