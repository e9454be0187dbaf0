package com.omniva.pglistener.engine.piston;

import com.omniva.pglistener.engine.CancellationSignal;
import com.omniva.pglistener.engine.fault.ErrorReporter;
import com.omniva.pglistener.engine.fuelsystem.NotificationConnection;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import com.omniva.pglistener.engine.transmission.DispatchEvent;
import com.omniva.pglistener.engine.transmission.Handoff;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * Notification Receiver - The Engine Piston
 * <p>
 * Like a piston in an engine, this component:
 * - Runs on its own dedicated connection (cylinder) holding one LISTEN subscription
 * - Repeats a blocking wait for the next notification (piston strokes)
 * - Hands every payload to the dispatch loop (transmission)
 * <p>
 * When the wait fails the piston seizes: it runs the connection-loss callback, reports the
 * error, cancels its subscription so the dispatch loop stops, tells the crankshaft
 * (supervisor) exactly once, closes the connection and ends. It never retries by itself.
 * When its subscription is cancelled it unlistens, closes the connection and ends silently,
 * unless the listener itself is still running: then the dispatch loop died and the
 * subscription is handed back to the crankshaft for a fresh pair.
 */
public class NotificationReceiver implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NotificationReceiver.class);

    @Getter private final String channel;
    @Getter private final int generation;
    private final NotificationConnection connection; // Cylinder
    private final Handoff<DispatchEvent> dispatchInbox;
    private final Handoff<Throwable> failureReports;
    private final CancellationSignal subscriptionSignal;
    private final CancellationSignal listenerSignal;
    private final Runnable onConnectionLoss;
    private final ErrorReporter errorReporter;
    private final ListenerSensorProbe sensorProbe;
    private final Duration pollInterval;

    @Getter private volatile boolean running = false;

    public NotificationReceiver(String channel,
                                int generation,
                                NotificationConnection connection,
                                Handoff<DispatchEvent> dispatchInbox,
                                Handoff<Throwable> failureReports,
                                CancellationSignal subscriptionSignal,
                                CancellationSignal listenerSignal,
                                Runnable onConnectionLoss,
                                ErrorReporter errorReporter,
                                ListenerSensorProbe sensorProbe,
                                Duration pollInterval) {
        this.channel = channel;
        this.generation = generation;
        this.connection = connection;
        this.dispatchInbox = dispatchInbox;
        this.failureReports = failureReports;
        this.subscriptionSignal = subscriptionSignal;
        this.listenerSignal = listenerSignal;
        this.onConnectionLoss = onConnectionLoss;
        this.errorReporter = errorReporter;
        this.sensorProbe = sensorProbe;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        running = true;
        log.info("Receiver {} listening on channel {}", generation, channel);

        try {
            // MAIN PISTON LOOP
            while (!subscriptionSignal.isCancelled()) {
                Optional<String> payload;
                try {
                    payload = connection.awaitNotification(pollInterval);
                } catch (SQLException | RuntimeException e) {
                    if (subscriptionSignal.isCancelled()) {
                        break;
                    }
                    seize(e);
                    return;
                }

                if (payload.isPresent()) {
                    sensorProbe.recordReceived();
                    if (!dispatchInbox.send(DispatchEvent.payload(payload.get()), subscriptionSignal)) {
                        break;
                    }
                }
            }

            unlistenQuietly();
            if (!listenerSignal.isCancelled()) {
                // Dispatch loop died while the listener is still wanted
                log.warn("Receiver {} on channel {} lost its dispatch loop - resubscribing", generation, channel);
                failureReports.send(new IllegalStateException("dispatch loop stopped on channel " + channel),
                        listenerSignal);
                return;
            }
            log.info("Receiver {} on channel {} stopping - subscription cancelled", generation, channel);
        } finally {
            running = false;
            connection.close();
        }
    }

    /**
     * Connection failure path. The dispatch loop is stopped before the supervisor hears
     * about the failure, so two pairs never deliver at the same time.
     */
    private void seize(Throwable cause) {
        log.error("Receiver {} lost connection on channel {}: {}", generation, channel, cause.getMessage());

        sensorProbe.recordConnectionLoss();

        if (onConnectionLoss != null) {
            try {
                onConnectionLoss.run();
            } catch (RuntimeException callbackError) {
                log.error("onConnectionLoss callback failed for channel {}: {}",
                        channel, callbackError.getMessage(), callbackError);
            }
        }

        errorReporter.reportConnectionLoss(cause);
        subscriptionSignal.cancel();

        // Gives up if the whole listener is being cancelled
        if (!failureReports.send(cause, listenerSignal)) {
            log.debug("Receiver {} failure report dropped - listener cancelled", generation);
        }
    }

    private void unlistenQuietly() {
        try {
            connection.unlisten(channel);
        } catch (SQLException | RuntimeException e) {
            log.debug("UNLISTEN failed during shutdown of channel {}: {}", channel, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return String.format("NotificationReceiver[generation=%d, channel=%s, running=%s]",
                generation, channel, running);
    }
}
