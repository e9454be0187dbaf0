package com.omniva.pglistener.engine;

import com.omniva.pglistener.engine.crankshaft.ListenerThreadPool;
import com.omniva.pglistener.engine.crankshaft.ReconnectSupervisor;
import com.omniva.pglistener.engine.crankshaft.SupervisorState;
import com.omniva.pglistener.engine.fault.ErrorReporter;
import com.omniva.pglistener.engine.sensors.ListenerSensor;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Handle to a running listener returned by {@link PgListener#listen}.
 * <p>
 * Closing the handle cancels the listener. Cancelling the signal passed in the options has
 * the same effect. Both may happen any number of times.
 */
public class ListenerHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ListenerHandle.class);

    private final String channel;
    private final CancellationSignal rootSignal;
    private final ReconnectSupervisor supervisor;
    private final ListenerThreadPool threadPool;
    private final ListenerSensorProbe sensorProbe;
    private final ErrorReporter errorReporter;

    ListenerHandle(String channel,
                   CancellationSignal rootSignal,
                   ReconnectSupervisor supervisor,
                   ListenerThreadPool threadPool,
                   ListenerSensorProbe sensorProbe,
                   ErrorReporter errorReporter) {
        this.channel = channel;
        this.rootSignal = rootSignal;
        this.supervisor = supervisor;
        this.threadPool = threadPool;
        this.sensorProbe = sensorProbe;
        this.errorReporter = errorReporter;
    }

    public String getChannel() {
        return channel;
    }

    public SupervisorState getState() {
        return supervisor.getState();
    }

    /**
     * True until the listener is cancelled, including while it reconnects
     */
    public boolean isActive() {
        return !rootSignal.isCancelled() && supervisor.getState() != SupervisorState.TERMINATED;
    }

    /**
     * True while connected with a running subscription
     */
    public boolean isHealthy() {
        return supervisor.isHealthy();
    }

    public ListenerSensor getSensor() {
        return sensorProbe.snapshot(supervisor.getState());
    }

    public List<String> getRecentErrors() {
        return errorReporter.getRecentErrors();
    }

    /**
     * Wait for every listener thread to finish after cancellation.
     *
     * @return true if all threads ended within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return threadPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        if (rootSignal.cancel()) {
            log.info("Listener on channel {} cancelled", channel);
        }
    }

    @Override
    public String toString() {
        return String.format("ListenerHandle[channel=%s, state=%s]", channel, supervisor.getState());
    }
}
