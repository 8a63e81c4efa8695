package com.plantwatch.service;

import com.plantwatch.dto.DeviceDto;
import com.plantwatch.dto.DeviceStatusDto;
import com.plantwatch.dto.DeviceUpdateRequest;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.KindRange;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.RangeStatus;
import com.plantwatch.entity.Reading;
import com.plantwatch.entity.Subject;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.repository.AlertRuleRepository;
import com.plantwatch.repository.AlertTriggerRepository;
import com.plantwatch.repository.CalibrationProfileRepository;
import com.plantwatch.repository.DeviceRepository;
import com.plantwatch.repository.RangeProfileRepository;
import com.plantwatch.repository.ReadingRepository;
import com.plantwatch.repository.SubjectRepository;
import com.plantwatch.repository.WateringEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceService {

    private final DeviceRepository deviceRepository;
    private final ReadingRepository readingRepository;
    private final AlertRuleRepository alertRuleRepository;
    private final AlertTriggerRepository alertTriggerRepository;
    private final SubjectRepository subjectRepository;
    private final WateringEventRepository wateringEventRepository;
    private final CalibrationProfileRepository calibrationProfileRepository;
    private final RangeProfileRepository rangeProfileRepository;

    @Transactional(readOnly = true)
    public List<DeviceDto> list() {
        return deviceRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(DeviceDto::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DeviceDto get(UUID id) {
        return DeviceDto.from(getDeviceOrThrow(id));
    }

    @Transactional
    public DeviceDto update(UUID id, DeviceUpdateRequest request) {
        Device device = getDeviceOrThrow(id);
        if (request.getLabel() != null) {
            device.setLabel(request.getLabel().isBlank() ? null : request.getLabel().trim());
        }
        if (request.getLocation() != null) {
            device.setLocation(request.getLocation().trim());
        }
        if (request.isClearCalibrationProfile()) {
            device.setCalibrationProfile(null);
        } else if (request.getCalibrationProfileId() != null) {
            device.setCalibrationProfile(calibrationProfileRepository.findById(request.getCalibrationProfileId())
                    .orElseThrow(() -> NotFoundException.of("Calibration profile", request.getCalibrationProfileId())));
        }
        if (request.isClearRangeProfile()) {
            device.setRangeProfile(null);
        } else if (request.getRangeProfileId() != null) {
            device.setRangeProfile(rangeProfileRepository.findById(request.getRangeProfileId())
                    .orElseThrow(() -> NotFoundException.of("Range profile", request.getRangeProfileId())));
        }
        log.info("Updated device {}", device.getMacAddress());
        return DeviceDto.from(deviceRepository.save(device));
    }

    /**
     * Removes the device with its readings, rules and their trigger history.
     * Watering events stay with their subject and lose the device link.
     */
    @Transactional
    public void delete(UUID id) {
        Device device = getDeviceOrThrow(id);
        for (Subject subject : subjectRepository.findByDevices_Id(id)) {
            subject.getDevices().removeIf(d -> d.getId().equals(id));
        }
        wateringEventRepository.detachDevice(id);
        int triggers = alertTriggerRepository.deleteByDeviceId(id);
        int rules = alertRuleRepository.deleteByDeviceId(id);
        int readings = readingRepository.deleteByDeviceId(id);
        deviceRepository.delete(device);
        log.info("Deleted device {} ({} readings, {} rules, {} triggers)",
                device.getMacAddress(), readings, rules, triggers);
    }

    /**
     * Latest value per kind, normalized where needed, with its range status
     * when the device's range profile covers the kind.
     */
    @Transactional(readOnly = true)
    public DeviceStatusDto status(UUID id) {
        Device device = getDeviceOrThrow(id);
        List<DeviceStatusDto.KindStatus> kinds = new ArrayList<>();
        List<MeasurementKind> reported = new ArrayList<>(readingRepository.findDistinctKindsByDeviceId(id));
        reported.sort(Comparator.naturalOrder());
        for (MeasurementKind kind : reported) {
            Optional<Reading> latest = readingRepository.findFirstByDevice_IdAndKindOrderByRecordedAtDesc(id, kind);
            if (latest.isEmpty()) {
                continue;
            }
            double value = Calibration.percentFor(device, kind, latest.get().getValue());
            RangeStatus status = null;
            if (device.getRangeProfile() != null) {
                Optional<KindRange> range = device.getRangeProfile().rangeFor(kind);
                if (range.isPresent()) {
                    status = RangeClassifier.classify(value, range.get());
                }
            }
            kinds.add(new DeviceStatusDto.KindStatus(kind, TrendAggregator.round(value, 2), kind.getUnit(),
                    latest.get().getRecordedAt(), status));
        }
        String profileName = device.getRangeProfile() != null ? device.getRangeProfile().getName() : null;
        return new DeviceStatusDto(device.getId(), profileName, kinds);
    }

    private Device getDeviceOrThrow(UUID id) {
        return deviceRepository.findWithProfilesById(id)
                .orElseThrow(() -> NotFoundException.of("Device", id));
    }
}
