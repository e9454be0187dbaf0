package com.omniva.pglistener.engine.transmission;

import com.omniva.pglistener.engine.CancellationSignal;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import com.omniva.pglistener.engine.valvetrain.DebounceRegister;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Dispatch Loop - the gearbox
 * <p>
 * Single-threaded event loop bound to one subscription. Each turn it takes exactly one of:
 * - a payload handed over by the receiver
 * - a debounce release handed over by an expired timer
 * - cancellation of the subscription signal, which ends the loop
 * <p>
 * All handler invocations for the subscription happen on this thread, one at a time and in
 * receipt order. The debounce register is confined to this thread and needs no locking.
 * If the loop dies from an {@link Error} thrown by the handler, it cancels its subscription.
 */
public class DispatchLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    @Getter private final String channel;
    private final Transmission transmission;
    private final DebounceRegister debounceRegister; // null when debouncing is disabled
    private final Handoff<DispatchEvent> inbox;
    private final CancellationSignal signal;
    private final ListenerSensorProbe sensorProbe;

    @Getter private volatile boolean running = false;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public DispatchLoop(String channel,
                        Transmission transmission,
                        DebounceRegister debounceRegister,
                        Handoff<DispatchEvent> inbox,
                        CancellationSignal signal,
                        ListenerSensorProbe sensorProbe) {
        this.channel = channel;
        this.transmission = transmission;
        this.debounceRegister = debounceRegister;
        this.inbox = inbox;
        this.signal = signal;
        this.sensorProbe = sensorProbe;
    }

    @Override
    public void run() {
        running = true;
        log.debug("Dispatch loop started for channel {}", channel);

        boolean completed = false;
        try {
            DispatchEvent event;
            while ((event = inbox.receive(signal)) != null) {
                if (signal.isCancelled()) {
                    break;
                }
                switch (event.kind()) {
                    case PAYLOAD -> onPayload(event.payload());
                    case RELEASE -> onRelease(event.payload());
                }
            }
            completed = true;
        } finally {
            running = false;
            if (!completed) {
                // Stops the receiver too; it hands the subscription back to the supervisor
                signal.cancel();
            }
            log.debug("Dispatch loop stopped for channel {}", channel);
            stopped.countDown();
        }
    }

    /**
     * Wait for the loop thread to exit, including a handler call still in progress.
     *
     * @return true if the loop has stopped
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onPayload(String payload) {
        if (debounceRegister == null) {
            transmission.transfer(payload);
            return;
        }

        if (!debounceRegister.admit(payload)) {
            sensorProbe.recordSuppressed();
            log.trace("Suppressed duplicate notification on channel {}: {}", channel, payload);
        }
    }

    private void onRelease(String payload) {
        if (debounceRegister != null && debounceRegister.release(payload)) {
            transmission.transfer(payload);
        }
    }
}
