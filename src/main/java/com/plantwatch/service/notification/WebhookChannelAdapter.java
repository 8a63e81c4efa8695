package com.plantwatch.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.exception.DispatchException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic JSON webhook. With a secret configured the exact request body is
 * signed and the signature sent as {@code X-Signature-256: sha256=<hex>}.
 */
@Component
@RequiredArgsConstructor
public class WebhookChannelAdapter implements ChannelAdapter<WebhookChannelConfig> {

    static final String SIGNATURE_HEADER = "X-Signature-256";
    static final String SOURCE = "smart-garden";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public ChannelKind kind() {
        return ChannelKind.WEBHOOK;
    }

    @Override
    public Class<WebhookChannelConfig> configType() {
        return WebhookChannelConfig.class;
    }

    @Override
    public void send(OutboundMessage message, WebhookChannelConfig config) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("subject", message.getSubject());
        payload.put("body", message.getBody());
        payload.put("source", SOURCE);

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not encode webhook payload", e);
        }

        HttpHeaders headers = new HttpHeaders();
        if (config.getSecret() != null && !config.getSecret().isEmpty()) {
            headers.set(SIGNATURE_HEADER, "sha256=" + sign(config.getSecret(), json));
        }
        HttpDelivery.postJson(restTemplate, config.getUrl(), json, headers, "Webhook");
    }

    static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new DispatchException("Could not sign webhook payload", e);
        }
    }
}
