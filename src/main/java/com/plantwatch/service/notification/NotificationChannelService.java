package com.plantwatch.service.notification;

import com.plantwatch.dto.ChannelDto;
import com.plantwatch.dto.ChannelRequest;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.entity.NotificationChannel;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.exception.ValidationException;
import com.plantwatch.exception.Violation;
import com.plantwatch.repository.NotificationChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationChannelService {

    private final NotificationChannelRepository channelRepository;
    private final ChannelConfigCodec codec;

    @Transactional(readOnly = true)
    public List<ChannelDto> list() {
        return channelRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional
    public ChannelDto create(ChannelRequest request) {
        List<Violation> violations = new ArrayList<>();
        if (request.getName() == null || request.getName().isBlank()) {
            violations.add(new Violation(List.of("body", "name"), "field required", "value_error.missing"));
        }
        if (request.getDestination() == null || request.getDestination().isBlank()) {
            violations.add(new Violation(List.of("body", "destination"), "field required", "value_error.missing"));
        }
        ChannelKind kind = ChannelKind.fromCode(request.getKind()).orElse(null);
        if (kind == null) {
            violations.add(new Violation(List.of("body", "kind"),
                    "kind must be one of: email, telegram, discord, webhook", "value_error.kind"));
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        NotificationChannel channel = NotificationChannel.builder()
                .name(request.getName().trim())
                .kind(kind)
                .destination(request.getDestination().trim())
                .configJson(codec.validateAndEncode(kind, request.getConfig()))
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();
        NotificationChannel saved = channelRepository.save(channel);
        log.info("Created {} channel '{}' for destination '{}'", kind.getCode(), saved.getName(), saved.getDestination());
        return toDto(saved);
    }

    /**
     * Partial update; the kind of a channel is fixed once created.
     */
    @Transactional
    public ChannelDto update(UUID id, ChannelRequest request) {
        NotificationChannel channel = channelRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Notification channel", id));
        if (request.getKind() != null && ChannelKind.fromCode(request.getKind()).orElse(null) != channel.getKind()) {
            throw new ValidationException(List.of("body", "kind"),
                    "kind cannot be changed, delete and recreate the channel", "value_error.kind");
        }
        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new ValidationException(List.of("body", "name"), "name must not be blank", "value_error.missing");
            }
            channel.setName(request.getName().trim());
        }
        if (request.getDestination() != null) {
            if (request.getDestination().isBlank()) {
                throw new ValidationException(List.of("body", "destination"), "destination must not be blank",
                        "value_error.missing");
            }
            channel.setDestination(request.getDestination().trim());
        }
        if (request.getConfig() != null) {
            channel.setConfigJson(codec.validateAndEncode(channel.getKind(), request.getConfig()));
        }
        if (request.getEnabled() != null) {
            channel.setEnabled(request.getEnabled());
        }
        return toDto(channelRepository.save(channel));
    }

    @Transactional
    public void delete(UUID id) {
        NotificationChannel channel = channelRepository.findById(id)
                .orElseThrow(() -> NotFoundException.of("Notification channel", id));
        channelRepository.delete(channel);
        log.info("Deleted channel '{}'", channel.getName());
    }

    private ChannelDto toDto(NotificationChannel channel) {
        return ChannelDto.builder()
                .id(channel.getId())
                .name(channel.getName())
                .kind(channel.getKind())
                .destination(channel.getDestination())
                .config(codec.toTree(channel.getConfigJson()))
                .enabled(channel.isEnabled())
                .createdAt(channel.getCreatedAt())
                .build();
    }
}
