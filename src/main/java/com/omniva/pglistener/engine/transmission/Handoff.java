package com.omniva.pglistener.engine.transmission;

import com.omniva.pglistener.engine.CancellationSignal;

import java.time.Duration;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-item transfer between two threads that gives up when a cancellation signal fires.
 * <p>
 * Neither side blocks for longer than the poll granularity without re-checking the signal,
 * so an abandoned sender (a late debounce timer, a receiver whose loop has exited) is
 * released instead of hanging forever.
 *
 * @param <T> item type
 */
public class Handoff<T> {

    private final SynchronousQueue<T> queue = new SynchronousQueue<>();
    private final long granularityNanos;

    public Handoff(Duration granularity) {
        this.granularityNanos = granularity.toNanos();
    }

    /**
     * Hand the item over, waiting for a taker.
     *
     * @return true if the item was taken, false if the signal was cancelled first
     */
    public boolean send(T item, CancellationSignal signal) {
        try {
            while (!signal.isCancelled()) {
                if (queue.offer(item, granularityNanos, TimeUnit.NANOSECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /**
     * Wait for the next item.
     *
     * @return the item, or null if the signal was cancelled or the thread interrupted
     */
    public T receive(CancellationSignal signal) {
        try {
            while (!signal.isCancelled()) {
                T item = queue.poll(granularityNanos, TimeUnit.NANOSECONDS);
                if (item != null) {
                    return item;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return null;
    }
}
