package com.omniva.pglistener.engine.crankshaft;

/**
 * Reconnect supervisor states.
 * <p>
 * CONNECTED -> RECONNECTING on a receiver failure report,
 * RECONNECTING -> CONNECTED when connect and LISTEN succeed,
 * any state -> TERMINATED on cancellation.
 */
public enum SupervisorState {
    /** A receiver and dispatch loop pair is active */
    CONNECTED,
    /** No active pair, reconnect attempts in progress */
    RECONNECTING,
    /** Cancelled, no further activity */
    TERMINATED
}
