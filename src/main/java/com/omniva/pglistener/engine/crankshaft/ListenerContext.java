package com.omniva.pglistener.engine.crankshaft;

import com.omniva.pglistener.engine.CancellationSignal;
import com.omniva.pglistener.engine.piston.NotificationReceiver;
import com.omniva.pglistener.engine.transmission.DispatchLoop;

import java.time.Instant;

/**
 * One live subscription: a receiver and dispatch loop pair sharing a cancellation signal
 */
public record ListenerContext(int generation,
                              NotificationReceiver receiver,
                              DispatchLoop dispatchLoop,
                              CancellationSignal signal,
                              Instant startTime) {

    /**
     * Check if this subscription is still delivering
     */
    public boolean isRunning() {
        return !signal.isCancelled() && receiver.isRunning();
    }
}
