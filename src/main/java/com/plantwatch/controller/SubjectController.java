package com.plantwatch.controller;

import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.StatusResponse;
import com.plantwatch.dto.SubjectDto;
import com.plantwatch.dto.SubjectRequest;
import com.plantwatch.dto.WateringEventDto;
import com.plantwatch.dto.WateringEventRequest;
import com.plantwatch.dto.WateringScheduleDto;
import com.plantwatch.dto.WateringScheduleRequest;
import com.plantwatch.service.SubjectService;
import com.plantwatch.service.WateringService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SubjectController {

    private final SubjectService subjectService;
    private final WateringService wateringService;

    @GetMapping("/subjects")
    public ListResponse<SubjectDto> getSubjects() {
        return ListResponse.of(subjectService.list());
    }

    @PostMapping("/subjects")
    @ResponseStatus(HttpStatus.CREATED)
    public SubjectDto createSubject(@RequestBody SubjectRequest request) {
        return subjectService.create(request);
    }

    @PostMapping("/subjects/{id}/devices")
    @ResponseStatus(HttpStatus.CREATED)
    public SubjectDto attachDevice(@PathVariable UUID id, @RequestBody SubjectRequest request) {
        return subjectService.attachDevice(id, request.getDeviceId());
    }

    @DeleteMapping("/subjects/{id}/devices/{deviceId}")
    public StatusResponse detachDevice(@PathVariable UUID id, @PathVariable UUID deviceId) {
        subjectService.detachDevice(id, deviceId);
        return StatusResponse.ok();
    }

    @PostMapping("/subjects/{id}/watering-events")
    @ResponseStatus(HttpStatus.CREATED)
    public WateringEventDto logWatering(@PathVariable UUID id,
                                        @RequestBody(required = false) WateringEventRequest request) {
        return wateringService.logManual(id, request);
    }

    @GetMapping("/subjects/{id}/watering-events")
    public ListResponse<WateringEventDto> getWateringEvents(@PathVariable UUID id) {
        return wateringService.listEvents(id);
    }

    @DeleteMapping("/watering-events/{eventId}")
    public StatusResponse deleteWateringEvent(@PathVariable UUID eventId) {
        wateringService.deleteEvent(eventId);
        return StatusResponse.ok();
    }

    @PostMapping("/subjects/{id}/watering-schedule")
    @ResponseStatus(HttpStatus.CREATED)
    public WateringScheduleDto upsertSchedule(@PathVariable UUID id, @RequestBody WateringScheduleRequest request) {
        return wateringService.upsertSchedule(id, request);
    }

    @GetMapping("/subjects/{id}/watering-schedule")
    public WateringScheduleDto getSchedule(@PathVariable UUID id) {
        return wateringService.getSchedule(id);
    }

    @DeleteMapping("/subjects/{id}/watering-schedule")
    public StatusResponse deleteSchedule(@PathVariable UUID id) {
        wateringService.deleteSchedule(id);
        return StatusResponse.ok();
    }
}
