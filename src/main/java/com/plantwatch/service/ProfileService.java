package com.plantwatch.service;

import com.plantwatch.dto.CalibrationProfileRequest;
import com.plantwatch.dto.DeviceClassRequest;
import com.plantwatch.dto.RangeProfileRequest;
import com.plantwatch.entity.CalibrationProfile;
import com.plantwatch.entity.Device;
import com.plantwatch.entity.DeviceClass;
import com.plantwatch.entity.KindRange;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.RangeProfile;
import com.plantwatch.entity.Resolution;
import com.plantwatch.exception.ConflictException;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import com.plantwatch.repository.CalibrationProfileRepository;
import com.plantwatch.repository.DeviceClassRepository;
import com.plantwatch.repository.DeviceRepository;
import com.plantwatch.repository.RangeProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Device classes, calibration profiles and range profiles. Deleting one of
 * them unlinks the devices that reference it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileService {

    private final DeviceClassRepository deviceClassRepository;
    private final CalibrationProfileRepository calibrationProfileRepository;
    private final RangeProfileRepository rangeProfileRepository;
    private final DeviceRepository deviceRepository;

    // --- Device classes ---

    @Transactional(readOnly = true)
    public List<DeviceClass> listDeviceClasses() {
        return deviceClassRepository.findAll(Sort.by("slug"));
    }

    @Transactional
    public DeviceClass createDeviceClass(DeviceClassRequest request) {
        List<Violation> violations = new ArrayList<>();
        requireText(request.getSlug(), "slug", violations);
        requireText(request.getName(), "name", violations);
        if (request.getResolutionBits() != null && Resolution.fromBits(request.getResolutionBits()).isEmpty()) {
            violations.add(new Violation(List.of("body", "resolutionBits"), "resolutionBits must be 10 or 12",
                    "value_error.resolution"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        String slug = request.getSlug().trim();
        if (deviceClassRepository.existsBySlug(slug)) {
            throw new ConflictException("Device class '" + slug + "' already exists");
        }
        DeviceClass deviceClass = DeviceClass.builder()
                .slug(slug)
                .name(request.getName().trim())
                .resolutionBits(Resolution.fromBitsOrDefault(request.getResolutionBits()).getBits())
                .build();
        log.info("Created device class {}", slug);
        return deviceClassRepository.save(deviceClass);
    }

    @Transactional
    public void deleteDeviceClass(UUID id) {
        DeviceClass deviceClass = deviceClassRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Device class", id));
        for (Device device : deviceRepository.findByDeviceClass_Id(id)) {
            device.setDeviceClass(null);
        }
        deviceClassRepository.delete(deviceClass);
    }

    // --- Calibration profiles ---

    @Transactional(readOnly = true)
    public List<CalibrationProfile> listCalibrationProfiles() {
        return calibrationProfileRepository.findAll(Sort.by("name"));
    }

    @Transactional
    public CalibrationProfile createCalibrationProfile(CalibrationProfileRequest request) {
        List<Violation> violations = new ArrayList<>();
        requireText(request.getName(), "name", violations);
        checkRaw(request, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        String name = request.getName().trim();
        if (calibrationProfileRepository.existsByName(name)) {
            throw new ConflictException("Calibration profile '" + name + "' already exists");
        }
        CalibrationProfile profile = CalibrationProfile.builder().name(name).build();
        applyRaw(profile, request);
        log.info("Created calibration profile {}", name);
        return calibrationProfileRepository.save(profile);
    }

    @Transactional
    public CalibrationProfile updateCalibrationProfile(UUID id, CalibrationProfileRequest request) {
        CalibrationProfile profile = calibrationProfileRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Calibration profile", id));
        List<Violation> violations = new ArrayList<>();
        if (request.getName() != null && request.getName().isBlank()) {
            violations.add(new Violation(List.of("body", "name"), "name must not be blank", "value_error.missing"));
        }
        checkRaw(request, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        if (request.getName() != null) {
            String name = request.getName().trim();
            if (calibrationProfileRepository.existsByNameAndIdNot(name, id)) {
                throw new ConflictException("Calibration profile '" + name + "' already exists");
            }
            profile.setName(name);
        }
        applyRaw(profile, request);
        return calibrationProfileRepository.save(profile);
    }

    @Transactional
    public void deleteCalibrationProfile(UUID id) {
        CalibrationProfile profile = calibrationProfileRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Calibration profile", id));
        for (Device device : deviceRepository.findByCalibrationProfile_Id(id)) {
            device.setCalibrationProfile(null);
        }
        calibrationProfileRepository.delete(profile);
    }

    // --- Range profiles ---

    @Transactional(readOnly = true)
    public List<RangeProfile> listRangeProfiles() {
        return rangeProfileRepository.findAll(Sort.by("name"));
    }

    @Transactional
    public RangeProfile createRangeProfile(RangeProfileRequest request) {
        List<Violation> violations = new ArrayList<>();
        requireText(request.getName(), "name", violations);
        List<KindRange> ranges = new ArrayList<>();
        Set<MeasurementKind> seen = EnumSet.noneOf(MeasurementKind.class);
        List<RangeProfileRequest.Bounds> bounds = request.getRanges() != null ? request.getRanges() : List.of();
        for (int i = 0; i < bounds.size(); i++) {
            RangeProfileRequest.Bounds b = bounds.get(i);
            MeasurementKind kind = b == null ? null : MeasurementKind.fromCode(b.getKind()).orElse(null);
            if (kind == null) {
                violations.add(new Violation(List.of("body", "ranges", i, "kind"), "unknown kind", "value_error.kind"));
                continue;
            }
            if (!seen.add(kind)) {
                violations.add(new Violation(List.of("body", "ranges", i, "kind"),
                        "kind " + kind.getCode() + " listed twice", "value_error.duplicate"));
                continue;
            }
            if (b.getAbsoluteMin() == null || b.getOptimalMin() == null
                    || b.getOptimalMax() == null || b.getAbsoluteMax() == null) {
                violations.add(new Violation(List.of("body", "ranges", i),
                        "absoluteMin, optimalMin, optimalMax and absoluteMax are required", "value_error.missing"));
                continue;
            }
            KindRange range = new KindRange(kind, b.getAbsoluteMin(), b.getOptimalMin(), b.getOptimalMax(), b.getAbsoluteMax());
            if (!range.isOrdered()) {
                violations.add(new Violation(List.of("body", "ranges", i),
                        "bounds must satisfy absoluteMin <= optimalMin <= optimalMax <= absoluteMax",
                        "value_error.range_order"));
                continue;
            }
            ranges.add(range);
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        String name = request.getName().trim();
        if (rangeProfileRepository.existsByName(name)) {
            throw new ConflictException("Range profile '" + name + "' already exists");
        }
        RangeProfile profile = RangeProfile.builder()
                .name(name)
                .description(request.getDescription())
                .ranges(ranges)
                .build();
        log.info("Created range profile {} covering {} kinds", name, ranges.size());
        return rangeProfileRepository.save(profile);
    }

    @Transactional
    public void deleteRangeProfile(UUID id) {
        RangeProfile profile = rangeProfileRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Range profile", id));
        for (Device device : deviceRepository.findByRangeProfile_Id(id)) {
            device.setRangeProfile(null);
        }
        rangeProfileRepository.delete(profile);
    }

    private static void requireText(String value, String field, List<Violation> violations) {
        if (value == null || value.isBlank()) {
            violations.add(new Violation(List.of("body", field), "field required", "value_error.missing"));
        }
    }

    private static void checkRaw(CalibrationProfileRequest request, List<Violation> violations) {
        checkRaw(request.getRawDry10(), "rawDry10", 1023, violations);
        checkRaw(request.getRawWet10(), "rawWet10", 1023, violations);
        checkRaw(request.getRawDry12(), "rawDry12", 4095, violations);
        checkRaw(request.getRawWet12(), "rawWet12", 4095, violations);
    }

    private static void checkRaw(Integer value, String field, int max, List<Violation> violations) {
        if (value != null && (value < 0 || value > max)) {
            violations.add(new Violation(List.of("body", field),
                    field + " must be between 0 and " + max, "value_error.number.range"));
        }
    }

    private static void applyRaw(CalibrationProfile profile, CalibrationProfileRequest request) {
        if (request.getRawDry10() != null) {
            profile.setRawDry10(request.getRawDry10());
        }
        if (request.getRawWet10() != null) {
            profile.setRawWet10(request.getRawWet10());
        }
        if (request.getRawDry12() != null) {
            profile.setRawDry12(request.getRawDry12());
        }
        if (request.getRawWet12() != null) {
            profile.setRawWet12(request.getRawWet12());
        }
    }
}
