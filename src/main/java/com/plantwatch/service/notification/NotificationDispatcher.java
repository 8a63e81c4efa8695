package com.plantwatch.service.notification;

import com.plantwatch.entity.NotificationChannel;
import com.plantwatch.exception.DispatchException;
import com.plantwatch.exception.NotFoundException;
import com.plantwatch.repository.NotificationChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    static final OutboundMessage TEST_MESSAGE = new OutboundMessage(
            "Smart Garden Test",
            "This is a test notification from your Smart Garden system.");

    private final NotificationChannelRepository channelRepository;
    private final ChannelAdapterRegistry registry;
    private final ChannelConfigCodec codec;

    /**
     * Sends a fired rule to every enabled channel bound to {@code destination}.
     * Channels are independent: a failure is logged and counted, and the next
     * channel is still tried.
     */
    @Async("notificationExecutor")
    public CompletableFuture<DispatchReport> dispatch(String destination, TriggerContext context) {
        List<NotificationChannel> channels = channelRepository.findByDestinationAndEnabledTrue(destination);
        if (channels.isEmpty()) {
            log.info("Rule {} fired but destination '{}' has no enabled channels", context.getRuleId(), destination);
            return CompletableFuture.completedFuture(DispatchReport.empty());
        }

        int delivered = 0;
        int failed = 0;
        for (NotificationChannel channel : channels) {
            try {
                ChannelAdapter<?> adapter = registry.forKind(channel.getKind());
                deliver(adapter, channel, adapter.render(context));
                delivered++;
                log.info("Rule {} delivered via {} channel '{}'", context.getRuleId(), channel.getKind().getCode(), channel.getName());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Rule {} delivery via {} channel '{}' failed: {}",
                        context.getRuleId(), channel.getKind().getCode(), channel.getName(), e.getMessage());
            }
        }
        return CompletableFuture.completedFuture(new DispatchReport(delivered, failed));
    }

    /**
     * Synchronous send of a fixed message, for checking a channel's settings.
     */
    public void test(UUID channelId) {
        NotificationChannel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> NotFoundException.of("Notification channel", channelId));
        try {
            deliver(registry.forKind(channel.getKind()), channel, TEST_MESSAGE);
        } catch (DispatchException e) {
            log.warn("Test message via channel '{}' failed: {}", channel.getName(), e.getMessage());
            throw e;
        }
        log.info("Test message delivered via {} channel '{}'", channel.getKind().getCode(), channel.getName());
    }

    private <C extends ChannelConfig> void deliver(ChannelAdapter<C> adapter, NotificationChannel channel,
                                                   OutboundMessage message) {
        C config = codec.decode(channel.getConfigJson(), adapter.configType());
        adapter.send(message, config);
    }
}
