package com.plantwatch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.dto.IngestRequest;
import com.plantwatch.dto.IngestResult;
import com.plantwatch.exception.PlantWatchException;
import com.plantwatch.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.integration.annotation.ServiceActivator;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHandler;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

@Service
@ConditionalOnProperty(name = "mqtt.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class MqttInputHandler {

    static final String TOPIC_HEADER = "mqtt_receivedTopic";

    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;

    @Bean
    @ServiceActivator(inputChannel = "mqttInputChannel")
    public MessageHandler handler() {
        return new MessageHandler() {
            @Override
            public void handleMessage(Message<?> message) {
                String topic = (String) message.getHeaders().get(TOPIC_HEADER);
                Object raw = message.getPayload();
                String payload = raw instanceof byte[] ? new String((byte[]) raw, StandardCharsets.UTF_8) : String.valueOf(raw);

                log.debug("MQTT Rx [{}]: {}", topic, payload);

                // Topic format: garden/{address}/readings
                if (topic == null || !topic.endsWith("/readings")) {
                    log.debug("Ignored message on topic: {}", topic);
                    return;
                }
                String[] parts = topic.split("/");
                String topicAddress = parts.length >= 3 ? parts[1] : null;

                IngestRequest request;
                try {
                    request = objectMapper.readValue(payload, IngestRequest.class);
                } catch (JsonProcessingException e) {
                    log.warn("Dropped unparseable batch on {}: {}", topic, e.getOriginalMessage());
                    return;
                }
                if (request.getDeviceAddress() == null) {
                    request.setDeviceAddress(topicAddress);
                }

                try {
                    IngestResult result = ingestionService.ingest(request);
                    log.info("Stored {} readings from {} via MQTT ({} alerts)", result.getInserted(),
                            request.getDeviceAddress(), result.getAlertsTriggered());
                } catch (ValidationException e) {
                    log.warn("Rejected batch on {}: {}", topic, e.getMessage());
                } catch (PlantWatchException e) {
                    // Nobody to report back to over MQTT; the device resends next wake cycle
                    log.error("Failed to ingest batch on {}", topic, e);
                }
            }
        };
    }
}
