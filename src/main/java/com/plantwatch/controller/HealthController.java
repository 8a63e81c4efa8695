package com.plantwatch.controller;

import com.plantwatch.dto.StatusResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping({"/health", "/api/health"})
    public StatusResponse health() {
        return StatusResponse.ok();
    }
}
