package com.omniva.pglistener.engine.crankshaft.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits the same interval between every reconnect attempt. Retries are unbounded.
 */
public class FixedBackoffPolicy implements ReconnectPolicy {

    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);

    private final Duration interval;

    public FixedBackoffPolicy() {
        this(DEFAULT_BACKOFF);
    }

    public FixedBackoffPolicy(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Backoff interval cannot be negative: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public Duration backoff(int failedAttempts) {
        return interval;
    }

    @Override
    public String toString() {
        return "FixedBackoffPolicy[" + interval + "]";
    }
}
