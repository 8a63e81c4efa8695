package com.plantwatch.service;

import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.WateringEventDto;
import com.plantwatch.dto.WateringEventRequest;
import com.plantwatch.dto.WateringScheduleDto;
import com.plantwatch.dto.WateringScheduleRequest;
import com.plantwatch.entity.Subject;
import com.plantwatch.entity.WateringEvent;
import com.plantwatch.entity.WateringSchedule;
import com.plantwatch.entity.WateringSource;
import com.plantwatch.exception.ConflictException;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.repository.SubjectRepository;
import com.plantwatch.repository.WateringEventRepository;
import com.plantwatch.repository.WateringScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Manual watering log and per-subject watering schedules. Automatic events
 * come from {@link WateringEventDetector}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WateringService {

    private final SubjectRepository subjectRepository;
    private final WateringEventRepository eventRepository;
    private final WateringScheduleRepository scheduleRepository;
    private final Clock clock;

    @Transactional
    public WateringEventDto logManual(UUID subjectId, WateringEventRequest request) {
        Subject subject = getSubjectOrThrow(subjectId);
        Instant detectedAt = request != null && request.getDetectedAt() != null ? request.getDetectedAt() : clock.instant();
        WateringEvent event = eventRepository.save(WateringEvent.builder()
                .subject(subject)
                .detectedAt(detectedAt)
                .source(WateringSource.MANUAL)
                .notes(request != null ? request.getNotes() : null)
                .build());
        scheduleRepository.findBySubject_Id(subjectId).ifPresent(schedule -> {
            if (schedule.getLastWateredAt() == null || detectedAt.isAfter(schedule.getLastWateredAt())) {
                schedule.setLastWateredAt(detectedAt);
            }
        });
        log.info("Logged manual watering of '{}' at {}", subject.getName(), detectedAt);
        return WateringEventDto.from(event);
    }

    @Transactional(readOnly = true)
    public ListResponse<WateringEventDto> listEvents(UUID subjectId) {
        getSubjectOrThrow(subjectId);
        return ListResponse.of(eventRepository.findBySubject_IdOrderByDetectedAtDesc(subjectId).stream()
                .map(WateringEventDto::from)
                .collect(Collectors.toList()));
    }

    @Transactional
    public void deleteEvent(UUID eventId) {
        WateringEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> NotFoundException.of("Watering event", eventId));
        if (event.getSource() == WateringSource.AUTO) {
            throw new ConflictException("Automatically detected watering events cannot be deleted");
        }
        eventRepository.delete(event);
    }

    /**
     * Create-or-replace; a subject has at most one schedule.
     */
    @Transactional
    public WateringScheduleDto upsertSchedule(UUID subjectId, WateringScheduleRequest request) {
        Subject subject = getSubjectOrThrow(subjectId);
        if (request.getIntervalDays() == null || request.getIntervalDays() < 1 || request.getIntervalDays() > 365) {
            throw new ValidationException(List.of("body", "intervalDays"),
                    "intervalDays must be between 1 and 365", "value_error.number.range");
        }
        WateringSchedule schedule = scheduleRepository.findBySubject_Id(subjectId)
                .orElseGet(() -> WateringSchedule.builder().subject(subject).build());
        schedule.setIntervalDays(request.getIntervalDays());
        schedule.setNotes(request.getNotes());
        schedule.setEnabled(request.getEnabled() == null || request.getEnabled());
        if (request.getLastWateredAt() != null) {
            schedule.setLastWateredAt(request.getLastWateredAt());
        }
        WateringSchedule saved = scheduleRepository.save(schedule);
        return WateringScheduleDto.from(saved, clock.instant());
    }

    @Transactional(readOnly = true)
    public WateringScheduleDto getSchedule(UUID subjectId) {
        getSubjectOrThrow(subjectId);
        return scheduleRepository.findBySubject_Id(subjectId)
                .map(schedule -> WateringScheduleDto.from(schedule, clock.instant()))
                .orElseThrow(() -> new NotFoundException("Subject " + subjectId + " has no watering schedule"));
    }

    @Transactional
    public void deleteSchedule(UUID subjectId) {
        WateringSchedule schedule = scheduleRepository.findBySubject_Id(subjectId)
                .orElseThrow(() -> new NotFoundException("Subject " + subjectId + " has no watering schedule"));
        scheduleRepository.delete(schedule);
    }

    private Subject getSubjectOrThrow(UUID id) {
        return subjectRepository.findById(id).orElseThrow(() -> NotFoundException.of("Subject", id));
    }
}
