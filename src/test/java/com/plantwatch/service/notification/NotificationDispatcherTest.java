package com.plantwatch.service.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.entity.ChannelKind;
import com.plantwatch.entity.Comparison;
import com.plantwatch.entity.MeasurementKind;
import com.plantwatch.entity.NotificationChannel;
import com.plantwatch.exception.DispatchException;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.repository.NotificationChannelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private NotificationChannelRepository channelRepository;

    private RecordingAdapter webhook;
    private FailingAdapter discord;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        webhook = new RecordingAdapter();
        discord = new FailingAdapter();
        ChannelAdapterRegistry registry = new ChannelAdapterRegistry(List.of(webhook, discord));
        dispatcher = new NotificationDispatcher(channelRepository, registry, new ChannelConfigCodec(new ObjectMapper(), registry));
    }

    @Test
    void failingChannelDoesNotStopTheOthers() {
        when(channelRepository.findByDestinationAndEnabledTrue("garden")).thenReturn(List.of(
                channel("broken", ChannelKind.DISCORD, "{\"webhookUrl\":\"https://discord.test/hook\"}"),
                channel("ops", ChannelKind.WEBHOOK, "{\"url\":\"https://hooks.test/a\"}")));

        DispatchReport report = dispatcher.dispatch("garden", context()).join();

        assertThat(report.getDelivered()).isEqualTo(1);
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(webhook.sent).hasSize(1);
        assertThat(webhook.sent.get(0).getSubject()).isEqualTo("Smart Garden Alert: soil_moisture below 25.0");
        assertThat(webhook.sent.get(0).getBody()).contains("Basil bed").contains("18.0%");
    }

    @Test
    void destinationWithoutChannelsIsANoOp() {
        when(channelRepository.findByDestinationAndEnabledTrue("nobody")).thenReturn(List.of());

        DispatchReport report = dispatcher.dispatch("nobody", context()).join();

        assertThat(report.getDelivered()).isZero();
        assertThat(report.getFailed()).isZero();
    }

    @Test
    void testSendsTheFixedMessage() {
        NotificationChannel ops = channel("ops", ChannelKind.WEBHOOK, "{\"url\":\"https://hooks.test/a\"}");
        when(channelRepository.findById(ops.getId())).thenReturn(Optional.of(ops));

        dispatcher.test(ops.getId());

        assertThat(webhook.sent).containsExactly(NotificationDispatcher.TEST_MESSAGE);
    }

    @Test
    void testSurfacesDeliveryFailure() {
        NotificationChannel broken = channel("broken", ChannelKind.DISCORD, "{\"webhookUrl\":\"https://discord.test/hook\"}");
        when(channelRepository.findById(broken.getId())).thenReturn(Optional.of(broken));

        assertThatThrownBy(() -> dispatcher.test(broken.getId())).isInstanceOf(DispatchException.class);
    }

    @Test
    void testOfUnknownChannelIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(channelRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> dispatcher.test(missing)).isInstanceOf(NotFoundException.class);
    }

    private static NotificationChannel channel(String name, ChannelKind kind, String config) {
        return NotificationChannel.builder()
                .id(UUID.randomUUID())
                .name(name)
                .kind(kind)
                .destination("garden")
                .configJson(config)
                .build();
    }

    private static TriggerContext context() {
        return TriggerContext.builder()
                .ruleId(UUID.randomUUID())
                .deviceId(UUID.randomUUID())
                .macAddress("AABBCCDDEEFF")
                .deviceLabel("Basil bed")
                .kind(MeasurementKind.SOIL_MOISTURE)
                .comparison(Comparison.BELOW)
                .threshold(25.0)
                .value(18.0)
                .triggeredAt(Instant.parse("2024-06-01T12:00:00Z"))
                .build();
    }

    private static class RecordingAdapter implements ChannelAdapter<WebhookChannelConfig> {
        final List<OutboundMessage> sent = new ArrayList<>();

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
            sent.add(message);
        }
    }

    private static class FailingAdapter implements ChannelAdapter<DiscordChannelConfig> {
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
            throw new DispatchException("Discord answered 500");
        }
    }
}
