package com.omniva.pglistener.engine.crankshaft;

import com.omniva.pglistener.config.ListenOptions;
import com.omniva.pglistener.engine.CancellationSignal;
import com.omniva.pglistener.engine.fault.ErrorReporter;
import com.omniva.pglistener.engine.fuelsystem.NotificationConnection;
import com.omniva.pglistener.engine.fuelsystem.NotificationDriver;
import com.omniva.pglistener.engine.piston.NotificationReceiver;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import com.omniva.pglistener.engine.transmission.DispatchEvent;
import com.omniva.pglistener.engine.transmission.DispatchLoop;
import com.omniva.pglistener.engine.transmission.Handoff;
import com.omniva.pglistener.engine.transmission.Transmission;
import com.omniva.pglistener.engine.valvetrain.DebounceRegister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles subscriptions: opens and subscribes connections, and builds the
 * receiver and dispatch loop pair that owns each one.
 */
public class ListenerLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ListenerLifecycleManager.class);

    private final ListenOptions options;
    private final NotificationDriver driver;
    private final ErrorReporter errorReporter;
    private final ListenerSensorProbe sensorProbe;
    private final ListenerThreadPool threadPool;
    private final ScheduledExecutorService timers;
    private final Handoff<Throwable> failureReports;
    private final CancellationSignal listenerSignal;

    private final AtomicInteger nextGeneration = new AtomicInteger(1);

    public ListenerLifecycleManager(ListenOptions options,
                                    NotificationDriver driver,
                                    ErrorReporter errorReporter,
                                    ListenerSensorProbe sensorProbe,
                                    ListenerThreadPool threadPool,
                                    ScheduledExecutorService timers,
                                    Handoff<Throwable> failureReports,
                                    CancellationSignal listenerSignal) {
        this.options = options;
        this.driver = driver;
        this.errorReporter = errorReporter;
        this.sensorProbe = sensorProbe;
        this.threadPool = threadPool;
        this.timers = timers;
        this.failureReports = failureReports;
        this.listenerSignal = listenerSignal;
    }

    /**
     * Connect and LISTEN on the configured channel. The connection is closed if LISTEN fails.
     */
    public NotificationConnection openSubscription() throws SQLException {
        NotificationConnection connection = driver.connect();
        try {
            connection.listen(options.getChannel());
            return connection;
        } catch (SQLException | RuntimeException e) {
            connection.close();
            throw e;
        }
    }

    /**
     * Build a receiver and dispatch loop pair for a subscribed connection and start both.
     * The pair owns the connection from here on.
     */
    public ListenerContext start(NotificationConnection connection) {
        int generation = nextGeneration.getAndIncrement();
        String channel = options.getChannel();

        CancellationSignal subscriptionSignal = listenerSignal.child();
        Handoff<DispatchEvent> inbox = new Handoff<>(options.getPollInterval());

        DebounceRegister debounceRegister = null;
        if (options.isDebounceEnabled()) {
            debounceRegister = new DebounceRegister(options.getDebounceInterval(), timers,
                    payload -> releaseAsync(inbox, subscriptionSignal, payload));
        }

        Transmission transmission = new Transmission(channel, options.getOnMessage(), errorReporter, sensorProbe);
        DispatchLoop dispatchLoop = new DispatchLoop(channel, transmission, debounceRegister,
                inbox, subscriptionSignal, sensorProbe);
        NotificationReceiver receiver = new NotificationReceiver(channel, generation, connection,
                inbox, failureReports, subscriptionSignal, listenerSignal,
                options.getOnConnectionLoss(), errorReporter, sensorProbe, options.getPollInterval());

        try {
            threadPool.execute(dispatchLoop);
            threadPool.execute(receiver);
        } catch (RejectedExecutionException e) {
            subscriptionSignal.cancel();
            connection.close();
            throw e;
        }

        log.info("Subscription {} started on channel {}", generation, channel);
        return new ListenerContext(generation, receiver, dispatchLoop, subscriptionSignal, Instant.now());
    }

    /**
     * Hand an expired debounce window back to its dispatch loop on a separate thread.
     * Abandoned when the subscription is cancelled first.
     */
    private void releaseAsync(Handoff<DispatchEvent> inbox, CancellationSignal signal, String payload) {
        try {
            threadPool.execute(() -> inbox.send(DispatchEvent.release(payload), signal));
        } catch (RejectedExecutionException e) {
            log.debug("Debounce release of {} abandoned - listener is shutting down", payload);
        }
    }
}
