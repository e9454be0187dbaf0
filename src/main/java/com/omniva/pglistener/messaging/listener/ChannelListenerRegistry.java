package com.omniva.pglistener.messaging.listener;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovers {@link PgChannelListener} beans at startup, one listener per channel.
 */
public class ChannelListenerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelListenerRegistry.class);
    private final ApplicationContext applicationContext;
    private final Map<String, ChannelListenerRegistryRecord> listeners = new ConcurrentHashMap<>();

    public ChannelListenerRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void discoverAndRegisterListeners() {
        log.info("Starting channel listener discovery...");

        Map<String, Object> annotatedBeans = applicationContext.getBeansWithAnnotation(PgChannelListener.class);

        int registeredCount = 0;
        for (Map.Entry<String, Object> entry : annotatedBeans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (bean instanceof ChannelListener channelListener) {
                if (registerListener(beanName, channelListener)) {
                    registeredCount++;
                }
            } else {
                log.warn("Bean {} is annotated with @PgChannelListener but doesn't implement ChannelListener", beanName);
            }
        }

        log.info("Successfully registered {} channel listeners", registeredCount);

        listeners.forEach((channel, registration) ->
                log.info("  {} -> {} (debounce: {}ms)",
                        channel, registration.beanName(), registration.config().debounceMillis()));
    }

    private boolean registerListener(String beanName, ChannelListener listener) {
        PgChannelListener annotation = AnnotationUtils.findAnnotation(
                AopUtils.getTargetClass(listener), PgChannelListener.class);

        if (annotation == null) {
            log.warn("ChannelListener {} missing @PgChannelListener annotation", beanName);
            return false;
        }

        String channel = annotation.channel().trim();

        if (channel.isEmpty()) {
            log.error("ChannelListener {} has empty channel name", beanName);
            return false;
        }

        if (annotation.debounceMillis() < 0) {
            log.error("ChannelListener {} has negative debounce {}ms", beanName, annotation.debounceMillis());
            return false;
        }

        ChannelListenerRegistryRecord registration = new ChannelListenerRegistryRecord(
                channel,
                listener,
                annotation,
                beanName
        );

        if (!registration.isEnabled()) {
            log.warn("ChannelListener {} on channel {} is disabled", beanName, channel);
            return false;
        }

        ChannelListenerRegistryRecord existing = listeners.putIfAbsent(channel, registration);
        if (existing != null) {
            log.error("Duplicate channel listener registration for channel {}: {} conflicts with {}",
                    channel, beanName, existing.beanName());
            return false;
        }

        try {
            listener.onRegistered(channel);
        } catch (RuntimeException e) {
            log.error("Error during listener registration for channel {}: {}", channel, e.getMessage(), e);
            listeners.remove(channel);
            throw e;
        }
        return true;
    }

    // ===== PUBLIC API METHODS =====

    public Map<String, ChannelListenerRegistryRecord> getAllListeners() {
        return new LinkedHashMap<>(listeners);
    }

    public int getListenerCount() {
        return listeners.size();
    }

}
