package com.plantwatch.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.exception.DispatchException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class DiscordChannelAdapter implements ChannelAdapter<DiscordChannelConfig> {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public ChannelKind kind() {
        return ChannelKind.DISCORD;
    }

    @Override
    public Class<DiscordChannelConfig> configType() {
        return DiscordChannelConfig.class;
    }

    @Override
    public void send(OutboundMessage message, DiscordChannelConfig config) {
        Map<String, String> payload = Map.of("content", "**" + message.getSubject() + "**\n" + message.getBody());
        try {
            HttpDelivery.postJson(restTemplate, config.getWebhookUrl(), objectMapper.writeValueAsString(payload), null, "Discord");
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not encode Discord message", e);
        }
    }
}
