package com.plantwatch.service;

import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import com.plantwatch.entity.Subject;
import com.plantwatch.entity.WateringEvent;
import com.plantwatch.entity.WateringSchedule;
import com.plantwatch.entity.WateringSource;
import com.plantwatch.repository.WateringEventRepository;
import com.plantwatch.repository.WateringScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import(WateringEventDetector.class)
class WateringEventDetectorTest {

    private static final Instant T0 = Instant.parse("2024-06-01T08:00:00Z");

    @Autowired
    private WateringEventDetector detector;

    @Autowired
    private WateringEventRepository eventRepository;

    @Autowired
    private WateringScheduleRepository scheduleRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Device device;

    @BeforeEach
    void setUp() {
        device = entityManager.persist(Device.builder().macAddress("AABBCCDDEEFF").resolutionBits(10).build());
    }

    @Test
    void sharpRiseWithinLookbackCreatesAutoEvent() {
        Subject basil = linkedSubject("Basil");
        WateringSchedule schedule = entityManager.persist(WateringSchedule.builder()
                .subject(basil)
                .intervalDays(3)
                .build());

        moisture(720, T0);
        Reading after = moisture(620, T0.plus(Duration.ofMinutes(10)));

        assertThat(detector.onMoistureReading(device, after)).isEqualTo(1);

        List<WateringEvent> events = eventRepository.findBySubject_IdOrderByDetectedAtDesc(basil.getId());
        assertThat(events).hasSize(1);
        WateringEvent event = events.get(0);
        assertThat(event.getSource()).isEqualTo(WateringSource.AUTO);
        assertThat(event.getMoistureBefore()).isCloseTo(20.0, within(0.001));
        assertThat(event.getMoistureAfter()).isCloseTo(45.0, within(0.001));
        assertThat(event.getDetectedAt()).isEqualTo(after.getRecordedAt());
        assertThat(scheduleRepository.findById(schedule.getId()).orElseThrow().getLastWateredAt())
                .isEqualTo(after.getRecordedAt());
    }

    @Test
    void riseOutsideLookbackIsIgnored() {
        Subject basil = linkedSubject("Basil");

        moisture(720, T0);
        Reading after = moisture(620, T0.plus(Duration.ofHours(2)));

        assertThat(detector.onMoistureReading(device, after)).isZero();
        assertThat(eventRepository.findBySubject_IdOrderByDetectedAtDesc(basil.getId())).isEmpty();
    }

    @Test
    void smallRiseIsIgnored() {
        linkedSubject("Basil");

        moisture(720, T0);
        Reading after = moisture(680, T0.plus(Duration.ofMinutes(10)));

        assertThat(detector.onMoistureReading(device, after)).isZero();
    }

    @Test
    void deviceWithoutSubjectRecordsNothing() {
        moisture(720, T0);
        Reading after = moisture(620, T0.plus(Duration.ofMinutes(10)));

        assertThat(detector.onMoistureReading(device, after)).isZero();
        assertThat(eventRepository.count()).isZero();
    }

    private Subject linkedSubject(String name) {
        Subject subject = Subject.builder().name(name).build();
        subject.getDevices().add(device);
        return entityManager.persist(subject);
    }

    private Reading moisture(double raw, Instant at) {
        Reading reading = entityManager.persist(Reading.builder()
                .device(device)
                .kind(MeasurementKind.SOIL_MOISTURE)
                .value(raw)
                .recordedAt(at)
                .build());
        entityManager.flush();
        return reading;
    }
}
