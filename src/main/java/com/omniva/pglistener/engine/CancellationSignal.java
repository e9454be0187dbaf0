package com.omniva.pglistener.engine;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared by every blocking point of a listener.
 * <p>
 * A signal is cancelled at most once; further {@link #cancel()} calls are no-ops.
 * A {@link #child()} signal is cancelled together with its parent but can also be
 * cancelled on its own, which is how one subscription is torn down without stopping
 * the whole listener.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Cancel this signal and every child
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            // remove() is atomic, so each callback runs exactly once
            if (callbacks.remove(callback)) {
                callback.run();
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Wait until cancelled or until the timeout elapses.
     *
     * @return true if the signal is cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Sleep for the given duration, waking early on cancellation.
     * An interrupt is treated as cancellation of the wait and restores the flag.
     *
     * @return true if the full duration elapsed without cancellation
     */
    public boolean sleep(Duration duration) {
        try {
            return !await(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Register a callback run once on cancellation. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * Create a signal cancelled together with this one.
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        Runnable propagate = child::cancel;
        onCancel(propagate);
        // Detach from the parent once the child is cancelled
        child.onCancel(() -> callbacks.remove(propagate));
        return child;
    }
}
