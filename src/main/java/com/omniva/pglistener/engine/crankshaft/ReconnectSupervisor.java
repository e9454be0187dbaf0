package com.omniva.pglistener.engine.crankshaft;

import com.omniva.pglistener.engine.CancellationSignal;
import com.omniva.pglistener.engine.crankshaft.policy.ReconnectPolicy;
import com.omniva.pglistener.engine.fault.ErrorReporter;
import com.omniva.pglistener.engine.fuelsystem.NotificationConnection;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import com.omniva.pglistener.engine.transmission.Handoff;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reconnect Supervisor - The Crankshaft
 * <p>
 * This component:
 * - Waits for the active piston (receiver) to report a dead connection
 * - Re-establishes connection and LISTEN with backoff until it succeeds or the listener is cancelled
 * - Attaches a fresh receiver and dispatch loop pair to every new connection
 * - Tears everything down on cancellation
 * <p>
 * State machine:
 * CONNECTED ──failure report──> RECONNECTING ──connect + LISTEN ok──> CONNECTED
 *     │                             │  └──attempt failed: onError, backoff, retry
 *     └─────────cancellation────────┴──────────────> TERMINATED
 * <p>
 * Retries are unbounded; only cancellation stops them. A new pair is started only after the
 * previous dispatch loop has exited, so the handler never runs on two subscriptions at once.
 */
public class ReconnectSupervisor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReconnectSupervisor.class);

    @Getter private final String channel;
    private final ListenerLifecycleManager lifecycleManager;
    private final ReconnectPolicy reconnectPolicy;
    private final Runnable onReconnect;
    private final ErrorReporter errorReporter;
    private final ListenerSensorProbe sensorProbe;
    private final Handoff<Throwable> failureReports;
    private final CancellationSignal listenerSignal;
    private final Duration pollInterval;
    private final ExecutorService threadPool;
    private final ExecutorService timers;

    private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.CONNECTED);
    private final AtomicReference<ListenerContext> activeContext = new AtomicReference<>();
    private final AtomicReference<Instant> supervisionStartTime = new AtomicReference<>();

    public ReconnectSupervisor(String channel,
                               ListenerLifecycleManager lifecycleManager,
                               ReconnectPolicy reconnectPolicy,
                               Runnable onReconnect,
                               ErrorReporter errorReporter,
                               ListenerSensorProbe sensorProbe,
                               Handoff<Throwable> failureReports,
                               CancellationSignal listenerSignal,
                               Duration pollInterval,
                               ExecutorService threadPool,
                               ExecutorService timers) {
        this.channel = channel;
        this.lifecycleManager = lifecycleManager;
        this.reconnectPolicy = reconnectPolicy;
        this.onReconnect = onReconnect;
        this.errorReporter = errorReporter;
        this.sensorProbe = sensorProbe;
        this.failureReports = failureReports;
        this.listenerSignal = listenerSignal;
        this.pollInterval = pollInterval;
        this.threadPool = threadPool;
        this.timers = timers;
    }

    /**
     * Attach the subscription opened synchronously at startup. Initial state is CONNECTED.
     */
    public void attachInitial(NotificationConnection connection) {
        activeContext.set(lifecycleManager.start(connection));
    }

    /**
     * Main supervision loop
     */
    @Override
    public void run() {
        supervisionStartTime.set(Instant.now());
        log.info("Supervision started for channel {}", channel);

        try {
            while (!listenerSignal.isCancelled()) {
                Throwable failure = failureReports.receive(listenerSignal);
                if (failure == null) {
                    break;
                }

                transition(SupervisorState.CONNECTED, SupervisorState.RECONNECTING);
                log.warn("Connection lost on channel {} - reconnecting: {}", channel, failure.getMessage());
                reconnect();
            }
        } finally {
            terminate();
        }
    }

    /**
     * Retry connect + LISTEN until success or cancellation
     */
    private void reconnect() {
        int failedAttempts = 0;

        while (!listenerSignal.isCancelled()) {
            try {
                NotificationConnection connection = lifecycleManager.openSubscription();
                if (!awaitPreviousDispatchLoop()) {
                    connection.close();
                    return;
                }

                activeContext.set(lifecycleManager.start(connection));
                transition(SupervisorState.RECONNECTING, SupervisorState.CONNECTED);
                sensorProbe.recordReconnect();
                log.info("Reconnected on channel {} after {} failed attempts", channel, failedAttempts);
                fireOnReconnect();
                return;

            } catch (SQLException | RuntimeException e) {
                if (e instanceof RejectedExecutionException && listenerSignal.isCancelled()) {
                    return;
                }
                failedAttempts++;
                sensorProbe.recordFailedReconnectAttempt();
                errorReporter.reportReconnectFailure(e);
            }

            Duration backoff = reconnectPolicy.backoff(failedAttempts);
            log.debug("Next reconnect attempt on channel {} in {}", channel, backoff);
            if (!listenerSignal.sleep(backoff)) {
                return;
            }
        }
    }

    /**
     * Block until the previous subscription's dispatch loop has exited. The new connection
     * is already subscribed, so notifications arriving meanwhile are buffered by the server.
     *
     * @return false if the listener was cancelled while waiting
     */
    private boolean awaitPreviousDispatchLoop() {
        ListenerContext previous = activeContext.get();
        try {
            while (!listenerSignal.isCancelled()) {
                if (previous == null || previous.dispatchLoop().awaitStopped(pollInterval)) {
                    return !listenerSignal.isCancelled();
                }
                log.debug("Waiting for handler of subscription {} on channel {} to return",
                        previous.generation(), channel);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void fireOnReconnect() {
        if (onReconnect == null) {
            return;
        }
        try {
            onReconnect.run();
        } catch (RuntimeException callbackError) {
            log.error("onReconnect callback failed for channel {}: {}",
                    channel, callbackError.getMessage(), callbackError);
        }
    }

    /**
     * Release everything owned by this listener. Pending debounce timers are abandoned.
     */
    private void terminate() {
        state.set(SupervisorState.TERMINATED);

        ListenerContext context = activeContext.getAndSet(null);
        if (context != null) {
            context.signal().cancel();
        }

        timers.shutdownNow();
        threadPool.shutdown();

        log.info("Supervision terminated for channel {} - uptime {}", channel, getSupervisionUptime());
    }

    private void transition(SupervisorState from, SupervisorState to) {
        if (!state.compareAndSet(from, to)) {
            log.debug("Ignoring transition {} -> {} on channel {}: state is {}", from, to, channel, state.get());
            return;
        }
        log.debug("Channel {} supervisor {} -> {}", channel, from, to);
    }

    public SupervisorState getState() {
        return state.get();
    }

    /**
     * Check if a subscription is currently delivering
     */
    public boolean isHealthy() {
        ListenerContext context = activeContext.get();
        return state.get() == SupervisorState.CONNECTED && context != null && context.isRunning();
    }

    public Duration getSupervisionUptime() {
        Instant startTime = supervisionStartTime.get();
        return startTime != null ? Duration.between(startTime, Instant.now()) : Duration.ZERO;
    }
}
