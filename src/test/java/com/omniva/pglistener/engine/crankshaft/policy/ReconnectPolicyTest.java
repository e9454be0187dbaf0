package com.omniva.pglistener.engine.crankshaft.policy;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectPolicyTest {

    @Test
    void fixedPolicyDefaultsToOneSecond() {
        FixedBackoffPolicy policy = new FixedBackoffPolicy();

        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(1), policy.backoff(50));
    }

    @Test
    void exponentialPolicyDoublesUpToCap() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1));

        assertEquals(Duration.ofMillis(100), policy.backoff(1));
        assertEquals(Duration.ofMillis(200), policy.backoff(2));
        assertEquals(Duration.ofMillis(400), policy.backoff(3));
        assertEquals(Duration.ofMillis(800), policy.backoff(4));
        assertEquals(Duration.ofSeconds(1), policy.backoff(5));
        assertEquals(Duration.ofSeconds(1), policy.backoff(Integer.MAX_VALUE));
    }

    @Test
    void exponentialPolicyRejectsCapBelowBase() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
}
