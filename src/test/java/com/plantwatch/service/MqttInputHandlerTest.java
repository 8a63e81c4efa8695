package com.plantwatch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.dto.IngestRequest;
import com.plantwatch.dto.IngestResult;
import com.plantwatch.exception.TransientStoreException;
import com.plantwatch.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.support.GenericMessage;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MqttInputHandlerTest {

    @Mock
    private IngestionService ingestionService;

    private MessageHandler handler;

    @BeforeEach
    void setUp() {
        handler = new MqttInputHandler(ingestionService, new ObjectMapper()).handler();
    }

    @Test
    void topicAddressIsUsedWhenPayloadHasNone() {
        when(ingestionService.ingest(any())).thenReturn(new IngestResult(2, 0));

        handler.handleMessage(message("garden/aa:bb:cc:dd:ee:ff/readings",
                "{\"readings\":[{\"kind\":\"temperature\",\"value\":21.5},{\"kind\":\"humidity\",\"value\":40}]}"));

        ArgumentCaptor<IngestRequest> captor = ArgumentCaptor.forClass(IngestRequest.class);
        verify(ingestionService).ingest(captor.capture());
        assertThat(captor.getValue().getDeviceAddress()).isEqualTo("aa:bb:cc:dd:ee:ff");
        assertThat(captor.getValue().getReadings()).hasSize(2);
    }

    @Test
    void payloadAddressWins() {
        when(ingestionService.ingest(any())).thenReturn(new IngestResult(1, 0));

        handler.handleMessage(message("garden/ignored/readings",
                "{\"mac\":\"112233445566\",\"readings\":[{\"kind\":\"temperature\",\"value\":21.5}]}"));

        ArgumentCaptor<IngestRequest> captor = ArgumentCaptor.forClass(IngestRequest.class);
        verify(ingestionService).ingest(captor.capture());
        assertThat(captor.getValue().getDeviceAddress()).isEqualTo("112233445566");
    }

    @Test
    void otherTopicsAndGarbageAreDropped() {
        handler.handleMessage(message("garden/aabbccddeeff/status", "{}"));
        handler.handleMessage(message("garden/aabbccddeeff/readings", "not json"));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestionFailuresDoNotEscapeTheHandler() {
        when(ingestionService.ingest(any()))
                .thenThrow(new ValidationException(List.of("body", "readings"), "empty", "value_error.list.min_items"))
                .thenThrow(new TransientStoreException("down", new IllegalStateException()));

        String payload = "{\"readings\":[]}";
        assertThatCode(() -> handler.handleMessage(message("garden/aabbccddeeff/readings", payload)))
                .doesNotThrowAnyException();
        assertThatCode(() -> handler.handleMessage(message("garden/aabbccddeeff/readings", payload)))
                .doesNotThrowAnyException();
        verify(ingestionService, times(2)).ingest(any());
    }

    private GenericMessage<byte[]> message(String topic, String payload) {
        return new GenericMessage<>(payload.getBytes(StandardCharsets.UTF_8),
                Map.of(MqttInputHandler.TOPIC_HEADER, topic));
    }
}
