package com.plantwatch.service;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.Comparison;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.repository.AlertTriggerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(AlertTriggerRecorder.class)
class AlertTriggerRecorderTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    private AlertTriggerRecorder recorder;

    @Autowired
    private AlertTriggerRepository triggerRepository;

    @Autowired
    private TestEntityManager entityManager;

    private AlertRule rule;

    @BeforeEach
    void setUp() {
        Device device = entityManager.persist(Device.builder().macAddress("AABBCCDDEEFF").build());
        rule = entityManager.persist(AlertRule.builder()
                .device(device)
                .kind(MeasurementKind.TEMPERATURE)
                .comparison(Comparison.ABOVE)
                .threshold(30.0)
                .destination("garden")
                .build());
        entityManager.flush();
    }

    @Test
    void cooldownSuppressesRepeatsWithinTheWindow() {
        assertThat(recorder.recordIfOutsideCooldown(rule.getId(), 35.0, T0)).isPresent();
        assertThat(recorder.recordIfOutsideCooldown(rule.getId(), 36.0, T0.plus(Duration.ofMinutes(30)))).isEmpty();
        assertThat(recorder.recordIfOutsideCooldown(rule.getId(), 37.0, T0.plus(Duration.ofMinutes(61)))).isPresent();

        assertThat(triggerRepository.countByRule_Id(rule.getId())).isEqualTo(2);
    }

    @Test
    void inactiveRuleNeverRecords() {
        rule.setActive(false);
        entityManager.flush();

        assertThat(recorder.recordIfOutsideCooldown(rule.getId(), 35.0, T0)).isEmpty();
        assertThat(triggerRepository.countByRule_Id(rule.getId())).isZero();
    }
}
