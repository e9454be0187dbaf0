package com.omniva.pglistener.engine.crankshaft.policy;

import java.time.Duration;

public interface ReconnectPolicy {
    /**
     * Determine how long to wait before the next reconnect attempt
     * @param failedAttempts number of consecutive failed attempts so far, starting at 1
     * @return the wait before the next attempt
     */
    Duration backoff(int failedAttempts);
}
