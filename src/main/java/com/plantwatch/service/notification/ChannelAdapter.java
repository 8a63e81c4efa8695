package com.plantwatch.service.notification;

import com.plantwatch.entity.ChannelKind;
import com.plantwatch.exception.DispatchException;

/**
 * Delivery through one kind of channel. Implementations are stateless Spring
 * beans; the dispatcher picks one by {@link #kind()}.
 */
public interface ChannelAdapter<C extends ChannelConfig> {

    ChannelKind kind();

    Class<C> configType();

    default OutboundMessage render(TriggerContext context) {
        String subject = String.format("Smart Garden Alert: %s %s %s",
                context.getKind().getCode(), context.getComparison().getCode(), context.getThreshold());
        String body = String.format("Device %s reported %s = %s, which is %s your threshold of %s.",
                context.deviceName(), context.getKind().getCode(), context.formattedValue(),
                context.getComparison().getCode(), context.getThreshold());
        return new OutboundMessage(subject, body);
    }

    /**
     * Sends one message; any failure, including a non-2xx answer, surfaces
     * as {@link DispatchException}.
     */
    void send(OutboundMessage message, C config) throws DispatchException;
}
