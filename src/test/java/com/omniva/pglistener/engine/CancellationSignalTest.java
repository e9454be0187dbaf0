package com.omniva.pglistener.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void cancelIsIdempotent() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger callbacks = new AtomicInteger();
        signal.onCancel(callbacks::incrementAndGet);

        assertTrue(signal.cancel());
        assertFalse(signal.cancel());
        assertFalse(signal.cancel());

        assertTrue(signal.isCancelled());
        assertEquals(1, callbacks.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        AtomicInteger callbacks = new AtomicInteger();
        signal.onCancel(callbacks::incrementAndGet);

        assertEquals(1, callbacks.get());
    }

    @Test
    void childIsCancelledWithParent() {
        CancellationSignal parent = new CancellationSignal();
        CancellationSignal child = parent.child();
        CancellationSignal grandChild = child.child();

        parent.cancel();

        assertTrue(child.isCancelled());
        assertTrue(grandChild.isCancelled());
    }

    @Test
    void cancellingChildLeavesParentRunning() {
        CancellationSignal parent = new CancellationSignal();
        CancellationSignal child = parent.child();

        child.cancel();

        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
        assertTrue(parent.child().cancel());
    }

    @Test
    void sleepWakesEarlyOnCancellation() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        boolean elapsed = signal.sleep(Duration.ofSeconds(10));
        long tookMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertFalse(elapsed);
        assertTrue(tookMillis < 5000, "sleep took " + tookMillis + "ms");
        canceller.join();
    }

    @Test
    void sleepCompletesWhenNotCancelled() {
        assertTrue(new CancellationSignal().sleep(Duration.ofMillis(10)));
    }
}
