package com.plantwatch.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.exception.DispatchException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class TelegramChannelAdapter implements ChannelAdapter<TelegramChannelConfig> {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;

    public TelegramChannelAdapter(RestTemplate restTemplate, ObjectMapper objectMapper,
                                  @Value("${garden.notifications.telegram.base-url:https://api.telegram.org}") String apiBaseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = apiBaseUrl;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.TELEGRAM;
    }

    @Override
    public Class<TelegramChannelConfig> configType() {
        return TelegramChannelConfig.class;
    }

    @Override
    public void send(OutboundMessage message, TelegramChannelConfig config) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", config.getChatId());
        payload.put("text", "*" + message.getSubject() + "*\n" + message.getBody());
        payload.put("parse_mode", "Markdown");
        String url = apiBaseUrl + "/bot" + config.getBotToken() + "/sendMessage";
        try {
            HttpDelivery.postJson(restTemplate, url, objectMapper.writeValueAsString(payload), null, "Telegram");
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not encode Telegram message", e);
        }
    }
}
