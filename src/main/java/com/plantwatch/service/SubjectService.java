package com.plantwatch.service;

import com.plantwatch.dto.SubjectDto;
import com.plantwatch.dto.SubjectRequest;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.Subject;
import com.plantwatch.exception.ConflictException;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.repository.DeviceRepository;
import com.plantwatch.repository.SubjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectService {

    private final SubjectRepository subjectRepository;
    private final DeviceRepository deviceRepository;

    @Transactional(readOnly = true)
    public List<SubjectDto> list() {
        return subjectRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(SubjectDto::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public SubjectDto create(SubjectRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException(List.of("body", "name"), "field required", "value_error.missing");
        }
        Subject subject = subjectRepository.save(Subject.builder()
                .name(request.getName().trim())
                .notes(request.getNotes())
                .build());
        log.info("Created subject '{}'", subject.getName());
        return SubjectDto.from(subject);
    }

    @Transactional
    public SubjectDto attachDevice(UUID subjectId, UUID deviceId) {
        if (deviceId == null) {
            throw new ValidationException(List.of("body", "deviceId"), "field required", "value_error.missing");
        }
        Subject subject = getSubjectOrThrow(subjectId);
        Device device = deviceRepository.findById(deviceId)
                .orElseThrow(() -> NotFoundException.of("Device", deviceId));
        boolean linked = subject.getDevices().stream().anyMatch(d -> d.getId().equals(deviceId));
        if (linked) {
            throw new ConflictException("Device " + device.getMacAddress() + " is already linked to this subject");
        }
        subject.getDevices().add(device);
        log.info("Linked device {} to '{}'", device.getMacAddress(), subject.getName());
        return SubjectDto.from(subjectRepository.save(subject));
    }

    @Transactional
    public void detachDevice(UUID subjectId, UUID deviceId) {
        Subject subject = getSubjectOrThrow(subjectId);
        boolean removed = subject.getDevices().removeIf(d -> d.getId().equals(deviceId));
        if (!removed) {
            throw new NotFoundException("Device " + deviceId + " is not linked to subject " + subjectId);
        }
        subjectRepository.save(subject);
    }

    private Subject getSubjectOrThrow(UUID id) {
        return subjectRepository.findById(id).orElseThrow(() -> NotFoundException.of("Subject", id));
    }
}
