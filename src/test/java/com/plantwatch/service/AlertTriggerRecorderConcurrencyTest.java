package com.plantwatch.service;

import com.plantwatch.entity.AlertRule;
import com.plantwatch.entity.AlertTrigger;
import com.plantwatch.entity.Comparison;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.repository.AlertRuleRepository;
import com.plantwatch.repository.AlertTriggerRepository;
import com.plantwatch.repository.DeviceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureTestDatabase
class AlertTriggerRecorderConcurrencyTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    private AlertTriggerRecorder recorder;

    @Autowired
    private DeviceRepository deviceRepository;

    @Autowired
    private AlertRuleRepository ruleRepository;

    @Autowired
    private AlertTriggerRepository triggerRepository;

    @Test
    void simultaneousBreachesOfOneRuleRecordOneTrigger() throws Exception {
        Device device = deviceRepository.save(Device.builder().macAddress("600000000001").build());
        AlertRule rule = ruleRepository.save(AlertRule.builder()
                .device(device)
                .kind(MeasurementKind.TEMPERATURE)
                .comparison(Comparison.ABOVE)
                .threshold(30.0)
                .destination("garden")
                .build());

        int threads = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Optional<AlertTrigger>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return recorder.recordIfOutsideCooldown(rule.getId(), 35.0, T0);
                }));
            }
            start.countDown();

            int recorded = 0;
            for (Future<Optional<AlertTrigger>> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                    recorded++;
                }
            }
            assertThat(recorded).isEqualTo(1);
            assertThat(triggerRepository.countByRule_Id(rule.getId())).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
