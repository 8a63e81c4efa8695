package com.plantwatch.controller;

import com.plantwatch.dto.DeviceDto;
import com.plantwatch.dto.DeviceStatusDto;
import com.plantwatch.dto.DeviceUpdateRequest;
import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.StatusResponse;
import com.plantwatch.service.DeviceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
@CrossOrigin(origins = "*") // Allow frontend access
public class DeviceController {

    private final DeviceService deviceService;

    @GetMapping
    public ListResponse<DeviceDto> getAllDevices() {
        return ListResponse.of(deviceService.list());
    }

    @GetMapping("/{id}")
    public DeviceDto getDevice(@PathVariable UUID id) {
        return deviceService.get(id);
    }

    @PutMapping("/{id}")
    public DeviceDto updateDevice(@PathVariable UUID id, @RequestBody DeviceUpdateRequest request) {
        return deviceService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public StatusResponse deleteDevice(@PathVariable UUID id) {
        deviceService.delete(id);
        return StatusResponse.ok();
    }

    @GetMapping("/{id}/status")
    public DeviceStatusDto getStatus(@PathVariable UUID id) {
        return deviceService.status(id);
    }
}
