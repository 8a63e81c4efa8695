package com.plantwatch.controller;

import com.plantwatch.dto.AlertHistoryDto;
import com.plantwatch.dto.AlertRuleDto;
import com.plantwatch.dto.AlertRuleRequest;
import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.StatusResponse;
import com.plantwatch.service.AlertRuleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AlertController {

    private final AlertRuleService alertRuleService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AlertRuleDto createRule(@RequestBody AlertRuleRequest request) {
        return alertRuleService.create(request);
    }

    @GetMapping
    public ListResponse<AlertRuleDto> getRules(@RequestParam(required = false) UUID deviceId,
                                               @RequestParam(required = false) Boolean active) {
        return ListResponse.of(alertRuleService.list(deviceId, active));
    }

    // Soft delete, history stays available
    @DeleteMapping("/{id}")
    public StatusResponse deleteRule(@PathVariable UUID id) {
        alertRuleService.deactivate(id);
        return StatusResponse.ok();
    }

    @GetMapping("/{id}/history")
    public AlertHistoryDto getHistory(@PathVariable UUID id) {
        return alertRuleService.history(id);
    }
}
