package com.plantwatch.service.notification;

import com.plantwatch.entity.ChannelKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ChannelAdapterRegistry {

    private final Map<ChannelKind, ChannelAdapter<?>> adapters = new EnumMap<>(ChannelKind.class);

    public ChannelAdapterRegistry(List<ChannelAdapter<?>> adapters) {
        for (ChannelAdapter<?> adapter : adapters) {
            ChannelAdapter<?> previous = this.adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for channel kind " + adapter.kind());
            }
        }
        log.debug("Notification adapters: {}", this.adapters.keySet());
    }

    public ChannelAdapter<?> forKind(ChannelKind kind) {
        ChannelAdapter<?> adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalStateException("No adapter for channel kind " + kind);
        }
        return adapter;
    }
}
