package com.omniva.pglistener.engine.valvetrain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Debounce Register - the valve timing
 * <p>
 * Tracks payloads that currently have an open suppression window. The first occurrence of a
 * payload opens a window and schedules its release after the debounce interval; further
 * occurrences while the window is open are dropped. The payload delivered is the one that
 * opened the window.
 * <p>
 * Not thread-safe: owned by a single dispatch loop. Timers only call the release sink, which
 * hands the payload back to that loop; the loop then calls {@link #release(String)}.
 * Timers still pending at shutdown are abandoned, never cancelled.
 */
public class DebounceRegister {

    private static final Logger log = LoggerFactory.getLogger(DebounceRegister.class);

    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final Consumer<String> releaseSink;

    private final Set<String> pending = new HashSet<>();

    public DebounceRegister(Duration interval,
                            ScheduledExecutorService scheduler,
                            Consumer<String> releaseSink) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Debounce interval must be positive: " + interval);
        }
        this.interval = interval;
        this.scheduler = scheduler;
        this.releaseSink = releaseSink;
    }

    /**
     * Open a suppression window for the payload unless one is already open.
     *
     * @return true if a new window was opened, false if the payload was suppressed
     */
    public boolean admit(String payload) {
        if (!pending.add(payload)) {
            return false;
        }

        try {
            scheduler.schedule(() -> releaseSink.accept(payload), interval.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            // Scheduler already stopped: the listener is shutting down
            pending.remove(payload);
            log.debug("Debounce timer rejected for payload {} - listener is shutting down", payload);
            return false;
        }
    }

    /**
     * Close the window of an expired timer.
     *
     * @return true if the payload had an open window and is now due for delivery
     */
    public boolean release(String payload) {
        return pending.remove(payload);
    }

    public boolean isPending(String payload) {
        return pending.contains(payload);
    }

    public int getPendingCount() {
        return pending.size();
    }
}
