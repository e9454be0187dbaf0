package com.omniva.pglistener.engine;

import com.omniva.pglistener.config.ListenOptions;
import com.omniva.pglistener.engine.crankshaft.policy.ReconnectPolicy;
import com.omniva.pglistener.engine.fault.ListenerConfigurationException;
import com.omniva.pglistener.engine.fault.PgListenerException;
import com.omniva.pglistener.engine.fuelsystem.NotificationDriver;
import com.omniva.pglistener.messaging.listener.ChannelListener;
import com.omniva.pglistener.messaging.listener.ChannelListenerRegistry;
import com.omniva.pglistener.messaging.listener.ChannelListenerRegistryRecord;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PG Listener Engine - Spring lifecycle coordinator
 * <p>
 * PgListenerEngine
 * ├── start() (one PgListener per registered channel listener)
 * └── stop() (closes every handle, waits up to the graceful timeout)
 * <p>
 * ChannelListenerRegistry (business logic routing)
 * └── @PgChannelListener beans (onMessage, onError, onConnectionLoss, onReconnect)
 */
public class PgListenerEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PgListenerEngine.class);

    private final ChannelListenerRegistry listenerRegistry;
    private final NotificationDriver driver;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration pollInterval;
    private final Duration gracefulTimeout;

    private final List<ListenerHandle> handles = new CopyOnWriteArrayList<>();

    // SPRING LIFECYCLE: Track running state (Spring manages the rest)
    private volatile boolean running = false;

    public PgListenerEngine(ChannelListenerRegistry listenerRegistry,
                            NotificationDriver driver,
                            ReconnectPolicy reconnectPolicy,
                            Duration pollInterval,
                            Duration gracefulTimeout) {
        this.listenerRegistry = listenerRegistry;
        this.driver = driver;
        this.reconnectPolicy = reconnectPolicy;
        this.pollInterval = pollInterval;
        this.gracefulTimeout = gracefulTimeout;
    }

    // ===== SPRING LIFECYCLE METHODS =====

    /**
     * Start one listener per registered channel. A channel that cannot be subscribed
     * stops the ones already started and fails the application start.
     */
    @Override
    public void start() {
        if (running) {
            log.warn("PgListenerEngine is already running");
            return;
        }

        if (listenerRegistry.getListenerCount() == 0) {
            log.warn("No channel listeners registered - not starting");
            return;
        }

        if (driver == null) {
            throw new ListenerConfigurationException(
                    "No notification driver: set pg-listener.datasource.url or define a NotificationDriver bean");
        }

        try {
            for (ChannelListenerRegistryRecord registration : listenerRegistry.getAllListeners().values()) {
                handles.add(PgListener.listen(toOptions(registration)));
                log.info("Channel {} -> {} started", registration.channel(), registration.beanName());
            }
            running = true;
            log.info("PgListenerEngine started {} listeners", handles.size());
        } catch (PgListenerException e) {
            log.error("Failed to start channel listeners: {}", e.getMessage(), e);
            closeAll();
            throw e;
        }
    }

    private ListenOptions toOptions(ChannelListenerRegistryRecord registration) {
        ChannelListener listener = registration.listener();
        return ListenOptions.builder()
                .driver(driver)
                .channel(registration.channel())
                .onMessage(listener::onMessage)
                .onError(listener::onError)
                .onConnectionLoss(listener::onConnectionLoss)
                .onReconnect(listener::onReconnect)
                .debounceInterval(registration.getDebounceInterval())
                .reconnectPolicy(reconnectPolicy)
                .pollInterval(pollInterval)
                .build();
    }

    /**
     * Stop every listener and wait for its threads
     */
    @Override
    public void stop() {
        if (!running) {
            log.info("PgListenerEngine is not running");
            return;
        }

        log.info("Stopping {} channel listeners...", handles.size());
        closeAll();
        running = false;
        log.info("PgListenerEngine stopped listening");
    }

    private void closeAll() {
        List<ListenerHandle> stopping = new ArrayList<>(handles);
        handles.clear();
        stopping.forEach(ListenerHandle::close);

        for (ListenerHandle handle : stopping) {
            try {
                if (!handle.awaitTermination(gracefulTimeout)) {
                    log.warn("Listener on channel {} did not stop within {}", handle.getChannel(), gracefulTimeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping channel listeners");
                return;
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 1000;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(@NonNull Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    /**
     * Shutdown hook called by Spring before bean destruction
     */
    @PreDestroy
    public void shutdown() {
        if (running) {
            stop();
        }
    }

    public List<ListenerHandle> getHandles() {
        return Collections.unmodifiableList(handles);
    }
}
