package com.omniva.pglistener.engine.sensors;

import com.omniva.pglistener.engine.crankshaft.SupervisorState;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Listener Sensor Probe
 * <p>
 * Collects real-time data from one listener across all of its subscriptions:
 * - notifications received, delivered and suppressed by debouncing
 * - handler failures
 * - connection losses and successful reconnects
 * <p>
 * Written by the receiver, dispatch loop and supervisor threads; read through {@link #snapshot(SupervisorState)}.
 */
public class ListenerSensorProbe {
    private static final Logger log = LoggerFactory.getLogger(ListenerSensorProbe.class);

    @Getter
    private final String channel;

    @Getter
    private volatile Instant startTime;
    @Getter
    private volatile Instant lastMessageTime;
    @Getter
    private volatile Instant lastConnectionLossTime;
    @Getter
    private volatile Instant lastReconnectTime;

    private final AtomicLong notificationsReceived = new AtomicLong(0);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong messagesSuppressed = new AtomicLong(0);
    private final AtomicLong handlerErrors = new AtomicLong(0);
    private final AtomicLong connectionLosses = new AtomicLong(0);
    private final AtomicLong reconnects = new AtomicLong(0);
    private final AtomicLong failedReconnectAttempts = new AtomicLong(0);

    public ListenerSensorProbe(String channel) {
        this.channel = channel;
    }

    // === Sensor Probe Events ===
    public void recordIgnition() {
        startTime = Instant.now();
        log.info("Sensor probe activated for channel {}", channel);
    }

    public void recordReceived() {
        notificationsReceived.incrementAndGet();
        lastMessageTime = Instant.now();
    }

    public void recordDelivery() {
        messagesDelivered.incrementAndGet();
    }

    public void recordSuppressed() {
        messagesSuppressed.incrementAndGet();
    }

    public void recordHandlerError() {
        handlerErrors.incrementAndGet();
    }

    public void recordConnectionLoss() {
        connectionLosses.incrementAndGet();
        lastConnectionLossTime = Instant.now();
    }

    public void recordFailedReconnectAttempt() {
        failedReconnectAttempts.incrementAndGet();
    }

    public void recordReconnect() {
        reconnects.incrementAndGet();
        lastReconnectTime = Instant.now();
    }

    // === Core Sensor Readings ===
    public Duration getUptime() {
        return startTime != null ? Duration.between(startTime, Instant.now()) : Duration.ZERO;
    }

    public ListenerSensor snapshot(SupervisorState state) {
        return ListenerSensor.builder()
                .channel(channel)
                .state(state)
                .startTime(startTime)
                .lastMessageTime(lastMessageTime)
                .lastReconnectTime(lastReconnectTime)
                .uptime(getUptime())
                .notificationsReceived(notificationsReceived.get())
                .messagesDelivered(messagesDelivered.get())
                .messagesSuppressed(messagesSuppressed.get())
                .handlerErrors(handlerErrors.get())
                .connectionLosses(connectionLosses.get())
                .reconnects(reconnects.get())
                .failedReconnectAttempts(failedReconnectAttempts.get())
                .build();
    }

    // === Raw Sensor Data Getters ===
    public long getNotificationsReceived() { return notificationsReceived.get(); }
    public long getMessagesDelivered() { return messagesDelivered.get(); }
    public long getMessagesSuppressed() { return messagesSuppressed.get(); }
    public long getHandlerErrors() { return handlerErrors.get(); }
    public long getConnectionLosses() { return connectionLosses.get(); }
    public long getReconnects() { return reconnects.get(); }
    public long getFailedReconnectAttempts() { return failedReconnectAttempts.get(); }
}
