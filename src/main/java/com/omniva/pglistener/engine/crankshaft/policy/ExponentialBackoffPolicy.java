package com.omniva.pglistener.engine.crankshaft.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Doubles the wait after every failed attempt, capped at a maximum delay.
 */
public class ExponentialBackoffPolicy implements ReconnectPolicy {
    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoffPolicy.class);

    private final Duration baseDelay;
    private final Duration maxDelay;

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay) {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than base delay " + baseDelay);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration backoff(int failedAttempts) {
        int backoffCount = Math.min(Math.max(failedAttempts - 1, 0), 20); // Cap the shift to prevent overflow
        long delayMs = Math.min(baseDelay.toMillis() * (1L << backoffCount), maxDelay.toMillis());
        if (delayMs == maxDelay.toMillis()) {
            log.debug("Reconnect backoff capped at {} after {} failed attempts", maxDelay, failedAttempts);
        }
        return Duration.ofMillis(delayMs);
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy[base=" + baseDelay + ", max=" + maxDelay + "]";
    }
}
