package com.plantwatch.service;

import com.plantwatch.entity.Device;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.Reading;
import com.plantwatch.entity.Subject;
import com.plantwatch.entity.WateringEvent;
import com.plantwatch.entity.WateringSource;
import com.plantwatch.repository.ReadingRepository;
import com.plantwatch.repository.SubjectRepository;
import com.plantwatch.repository.WateringEventRepository;
import com.plantwatch.repository.WateringScheduleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Infers a watering from a sharp moisture rise between two consecutive
 * readings of the same device.
 */
@Service
@Slf4j
public class WateringEventDetector {

    private final ReadingRepository readingRepository;
    private final SubjectRepository subjectRepository;
    private final WateringEventRepository eventRepository;
    private final WateringScheduleRepository scheduleRepository;
    private final Duration lookback;
    private final double minJumpPct;

    public WateringEventDetector(ReadingRepository readingRepository,
                                 SubjectRepository subjectRepository,
                                 WateringEventRepository eventRepository,
                                 WateringScheduleRepository scheduleRepository,
                                 @Value("${garden.watering.lookback:30m}") Duration lookback,
                                 @Value("${garden.watering.min-jump-pct:15}") double minJumpPct) {
        this.readingRepository = readingRepository;
        this.subjectRepository = subjectRepository;
        this.eventRepository = eventRepository;
        this.scheduleRepository = scheduleRepository;
        this.lookback = lookback;
        this.minJumpPct = minJumpPct;
    }

    /**
     * @return number of auto events written (one per subject the device watches)
     */
    @Transactional
    public int onMoistureReading(Device device, Reading reading) {
        if (reading.getKind() != MeasurementKind.SOIL_MOISTURE) {
            return 0;
        }
        Optional<Reading> previous = readingRepository.findFirstByDevice_IdAndKindAndRecordedAtBeforeOrderByRecordedAtDesc(
                device.getId(), MeasurementKind.SOIL_MOISTURE, reading.getRecordedAt());
        if (previous.isEmpty()) {
            return 0;
        }
        Duration gap = Duration.between(previous.get().getRecordedAt(), reading.getRecordedAt());
        if (gap.compareTo(lookback) > 0) {
            return 0;
        }

        double before = Calibration.percentFor(device, MeasurementKind.SOIL_MOISTURE, previous.get().getValue());
        double after = Calibration.percentFor(device, MeasurementKind.SOIL_MOISTURE, reading.getValue());
        if (after - before <= minJumpPct) {
            return 0;
        }

        List<Subject> subjects = subjectRepository.findByDevices_Id(device.getId());
        if (subjects.isEmpty()) {
            log.debug("Moisture jump on {} ({} -> {}) but no subject is linked", device.getMacAddress(), before, after);
            return 0;
        }
        for (Subject subject : subjects) {
            eventRepository.save(WateringEvent.builder()
                    .subject(subject)
                    .device(device)
                    .detectedAt(reading.getRecordedAt())
                    .moistureBefore(before)
                    .moistureAfter(after)
                    .source(WateringSource.AUTO)
                    .build());
            scheduleRepository.findBySubject_Id(subject.getId())
                    .ifPresent(schedule -> schedule.setLastWateredAt(reading.getRecordedAt()));
            log.info("Detected watering of '{}' via {} ({}% -> {}%)", subject.getName(), device.getMacAddress(),
                    Math.round(before), Math.round(after));
        }
        return subjects.size();
    }
}
