package com.plantwatch.controller;

import com.plantwatch.dto.CalibrationProfileRequest;
import com.plantwatch.dto.DeviceClassRequest;
import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.RangeProfileRequest;
import com.plantwatch.dto.StatusResponse;
import com.plantwatch.entity.CalibrationProfile;
import com.plantwatch.entity.DeviceClass;
import com.plantwatch.entity.RangeProfile;
import com.plantwatch.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ProfileController {

    private final ProfileService profileService;

    @GetMapping("/device-classes")
    public ListResponse<DeviceClass> getDeviceClasses() {
        return ListResponse.of(profileService.listDeviceClasses());
    }

    @PostMapping("/device-classes")
    @ResponseStatus(HttpStatus.CREATED)
    public DeviceClass createDeviceClass(@RequestBody DeviceClassRequest request) {
        return profileService.createDeviceClass(request);
    }

    @DeleteMapping("/device-classes/{id}")
    public StatusResponse deleteDeviceClass(@PathVariable UUID id) {
        profileService.deleteDeviceClass(id);
        return StatusResponse.ok();
    }

    @GetMapping("/calibration-profiles")
    public ListResponse<CalibrationProfile> getCalibrationProfiles() {
        return ListResponse.of(profileService.listCalibrationProfiles());
    }

    @PostMapping("/calibration-profiles")
    @ResponseStatus(HttpStatus.CREATED)
    public CalibrationProfile createCalibrationProfile(@RequestBody CalibrationProfileRequest request) {
        return profileService.createCalibrationProfile(request);
    }

    @PutMapping("/calibration-profiles/{id}")
    public CalibrationProfile updateCalibrationProfile(@PathVariable UUID id,
                                                       @RequestBody CalibrationProfileRequest request) {
        return profileService.updateCalibrationProfile(id, request);
    }

    @DeleteMapping("/calibration-profiles/{id}")
    public StatusResponse deleteCalibrationProfile(@PathVariable UUID id) {
        profileService.deleteCalibrationProfile(id);
        return StatusResponse.ok();
    }

    @GetMapping("/range-profiles")
    public ListResponse<RangeProfile> getRangeProfiles() {
        return ListResponse.of(profileService.listRangeProfiles());
    }

    @PostMapping("/range-profiles")
    @ResponseStatus(HttpStatus.CREATED)
    public RangeProfile createRangeProfile(@RequestBody RangeProfileRequest request) {
        return profileService.createRangeProfile(request);
    }

    @DeleteMapping("/range-profiles/{id}")
    public StatusResponse deleteRangeProfile(@PathVariable UUID id) {
        profileService.deleteRangeProfile(id);
        return StatusResponse.ok();
    }
}
