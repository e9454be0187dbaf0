package com.omniva.pglistener.engine.crankshaft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Unbounded pool running every thread of one listener: the supervisor, each receiver and
 * dispatch loop pair, and the short-lived debounce release tasks.
 * <p>
 * Tasks are expected to handle their own failures. Anything that escapes reaches
 * {@link #afterExecute(Runnable, Throwable)} and is passed to the failure handler so a dying
 * background thread never goes unnoticed.
 */
public class ListenerThreadPool extends ThreadPoolExecutor {
    private static final Logger log = LoggerFactory.getLogger(ListenerThreadPool.class);

    private final Consumer<Throwable> failureHandler;

    // Track executing threads for shutdown handling
    private final Map<Runnable, Thread> runnableToThreadMap = new ConcurrentHashMap<>();

    public ListenerThreadPool(ThreadFactory threadFactory, Consumer<Throwable> failureHandler) {
        super(0, Integer.MAX_VALUE, 30L, TimeUnit.SECONDS, new SynchronousQueue<>(), threadFactory);
        this.failureHandler = failureHandler;
    }

    @Override
    protected void beforeExecute(Thread t, Runnable r) {
        super.beforeExecute(t, r);
        runnableToThreadMap.put(r, t);
    }

    /**
     * Tasks go through {@link #execute(Runnable)}, so anything they throw arrives here as {@code t}.
     */
    @Override
    protected void afterExecute(Runnable r, Throwable t) {
        super.afterExecute(r, t);
        runnableToThreadMap.remove(r);

        if (t != null) {
            log.error("Listener task failed with exception: {}", t.getMessage(), t);
            failureHandler.accept(t);
        }
    }

    public int getExecutingTaskCount() {
        return runnableToThreadMap.size();
    }

    /**
     * Interrupt all executing threads (for emergency shutdown)
     */
    public void interruptAllExecutingThreads() {
        Map<Runnable, Thread> executingThreads = Map.copyOf(runnableToThreadMap);
        log.debug("Interrupting {} executing threads", executingThreads.size());

        for (Thread thread : executingThreads.values()) {
            if (thread != null && thread.isAlive() && !thread.isInterrupted()) {
                thread.interrupt();
            }
        }
    }

    @Override
    protected void terminated() {
        super.terminated();
        runnableToThreadMap.clear();
        log.debug("ListenerThreadPool has terminated");
    }

    @Override
    @NonNull
    public List<Runnable> shutdownNow() {
        interruptAllExecutingThreads();
        return super.shutdownNow();
    }

    @Override
    @NonNull
    public String toString() {
        return String.format("ListenerThreadPool[pool=%d, active=%d, completed=%d, executing=%d]",
                getPoolSize(),
                getActiveCount(),
                getCompletedTaskCount(),
                getExecutingTaskCount());
    }
}
