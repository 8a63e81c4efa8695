package com.plantwatch.controller;

import com.plantwatch.dto.ChannelDto;
import com.plantwatch.dto.ChannelRequest;
import com.plantwatch.dto.ListResponse;
import com.plantwatch.dto.StatusResponse;
import com.plantwatch.service.notification.NotificationChannelService;
import com.plantwatch.service.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/notification-channels")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class NotificationChannelController {

    private final NotificationChannelService channelService;
    private final NotificationDispatcher dispatcher;

    @GetMapping
    public ListResponse<ChannelDto> getChannels() {
        return ListResponse.of(channelService.list());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ChannelDto createChannel(@RequestBody ChannelRequest request) {
        return channelService.create(request);
    }

    @PutMapping("/{id}")
    public ChannelDto updateChannel(@PathVariable UUID id, @RequestBody ChannelRequest request) {
        return channelService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public StatusResponse deleteChannel(@PathVariable UUID id) {
        channelService.delete(id);
        return StatusResponse.ok();
    }

    @PostMapping("/{id}/test")
    public StatusResponse testChannel(@PathVariable UUID id) {
        dispatcher.test(id);
        return StatusResponse.ok();
    }
}
