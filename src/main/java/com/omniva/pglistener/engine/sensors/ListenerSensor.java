package com.omniva.pglistener.engine.sensors;

import com.omniva.pglistener.engine.crankshaft.SupervisorState;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time monitoring data for one listener
 */
@Builder
@Data
public class ListenerSensor {
    // Identity
    private String channel;

    // Status
    private SupervisorState state;
    private Instant startTime;
    private Instant lastMessageTime;
    private Instant lastReconnectTime;
    private Duration uptime;

    // Metrics
    private long notificationsReceived;
    private long messagesDelivered;
    private long messagesSuppressed;
    private long handlerErrors;
    private long connectionLosses;
    private long reconnects;
    private long failedReconnectAttempts;
}
