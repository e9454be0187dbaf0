package com.omniva.pglistener.engine.crankshaft;

import org.springframework.lang.NonNull;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ThreadFactory for listener threads with:
 * - Meaningful thread names ({@code pg-listener-<channel>-<n>})
 * - Daemon threads, so an idle listener never keeps the JVM alive
 * - Normal thread priority
 */
public class ListenerThreadFactory implements ThreadFactory {

    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final String namePrefix;

    /**
     * @param namePrefix Prefix for thread names (e.g., "pg-listener-orders")
     */
    public ListenerThreadFactory(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    @Override
    public Thread newThread(@NonNull Runnable r) {
        Thread t = new Thread(r, namePrefix + "-" + threadCounter.getAndIncrement());
        t.setDaemon(true);
        t.setPriority(Thread.NORM_PRIORITY);
        return t;
    }
}
