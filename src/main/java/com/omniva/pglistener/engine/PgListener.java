package com.omniva.pglistener.engine;

import com.omniva.pglistener.config.ListenOptions;
import com.omniva.pglistener.engine.crankshaft.ListenerLifecycleManager;
import com.omniva.pglistener.engine.crankshaft.ListenerThreadFactory;
import com.omniva.pglistener.engine.crankshaft.ListenerThreadPool;
import com.omniva.pglistener.engine.crankshaft.ReconnectSupervisor;
import com.omniva.pglistener.engine.fault.ErrorReporter;
import com.omniva.pglistener.engine.fault.ListenerStartupException;
import com.omniva.pglistener.engine.fault.PgListenerException;
import com.omniva.pglistener.engine.fuelsystem.NotificationConnection;
import com.omniva.pglistener.engine.fuelsystem.NotificationDriver;
import com.omniva.pglistener.engine.ignition.OptionsValidator;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import com.omniva.pglistener.engine.transmission.Handoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * PostgreSQL LISTEN/NOTIFY client - the ignition key
 * <p>
 * Starting a listener:
 * 1. Ignition checks (option validation, URL parsing)
 * 2. First connect + LISTEN, synchronously. Failure here is thrown to the caller.
 * 3. Receiver and dispatch loop started on the new connection
 * 4. Reconnect supervisor started; from now on failures only reach {@code onError}
 * <p>
 * The listener runs on background daemon threads until its cancellation signal is
 * cancelled or the returned handle is closed.
 */
public final class PgListener {

    private static final Logger log = LoggerFactory.getLogger(PgListener.class);

    private PgListener() {
    }

    /**
     * Start listening on the configured channel.
     *
     * @throws com.omniva.pglistener.engine.fault.ListenerConfigurationException if the options are invalid
     * @throws ListenerStartupException if the first connect or LISTEN fails
     */
    public static ListenerHandle listen(ListenOptions options) {
        NotificationDriver driver = OptionsValidator.validate(options);
        String channel = options.getChannel();

        CancellationSignal rootSignal = options.getCancellation().child();
        ErrorReporter errorReporter = new ErrorReporter(channel, options.getOnError());
        ListenerSensorProbe sensorProbe = new ListenerSensorProbe(channel);

        String threadPrefix = "pg-listener-" + channel;
        ListenerThreadPool threadPool = new ListenerThreadPool(new ListenerThreadFactory(threadPrefix),
                failure -> errorReporter.report(new PgListenerException(
                        "pg-listener: unexpected failure channel=" + channel + " error=" + failure, failure)));
        ScheduledThreadPoolExecutor timers = new ScheduledThreadPoolExecutor(1,
                new ListenerThreadFactory(threadPrefix + "-debounce"));
        timers.setRemoveOnCancelPolicy(true);

        Handoff<Throwable> failureReports = new Handoff<>(options.getPollInterval());
        ListenerLifecycleManager lifecycleManager = new ListenerLifecycleManager(options, driver,
                errorReporter, sensorProbe, threadPool, timers, failureReports, rootSignal);

        NotificationConnection connection;
        try {
            connection = lifecycleManager.openSubscription();
        } catch (SQLException | RuntimeException e) {
            rootSignal.cancel();
            timers.shutdownNow();
            threadPool.shutdownNow();
            throw new ListenerStartupException(
                    "pg-listener: listening on channel=" + channel + " error=" + e.getMessage(), e);
        }

        ReconnectSupervisor supervisor = new ReconnectSupervisor(channel, lifecycleManager,
                options.getReconnectPolicy(), options.getOnReconnect(), errorReporter, sensorProbe,
                failureReports, rootSignal, options.getPollInterval(), threadPool, timers);

        try {
            supervisor.attachInitial(connection);
            threadPool.execute(supervisor);
        } catch (RejectedExecutionException e) {
            rootSignal.cancel();
            timers.shutdownNow();
            threadPool.shutdownNow();
            throw new ListenerStartupException("pg-listener: starting listener threads channel=" + channel, e);
        }

        sensorProbe.recordIgnition();
        log.info("Listening on channel {} ({})", channel, options);
        return new ListenerHandle(channel, rootSignal, supervisor, threadPool, sensorProbe, errorReporter);
    }
}
