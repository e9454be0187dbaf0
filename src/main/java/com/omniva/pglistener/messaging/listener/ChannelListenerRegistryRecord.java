package com.omniva.pglistener.messaging.listener;

import java.time.Duration;

public record ChannelListenerRegistryRecord(
        String channel,
        ChannelListener listener,
        PgChannelListener config,
        String beanName
) {

    /**
     * Check if this listener is enabled
     */
    public boolean isEnabled() {
        return config.enabled();
    }

    public Duration getDebounceInterval() {
        return Duration.ofMillis(config.debounceMillis());
    }
}
