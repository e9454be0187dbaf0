package com.omniva.pglistener.engine.fault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Converts post-startup failures into {@code onError} callback invocations.
 * <p>
 * Every failure detected by the receiver, dispatch loop or supervisor passes through here:
 * - the message is formatted with the {@code pg-listener:} prefix, the channel and the cause
 * - the error is logged and kept in a bounded history for diagnostics
 * - the user callback (if any) is invoked; a throwing callback is logged, never propagated
 * <p>
 * Thread-safe, shared by all threads of one listener.
 */
public class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);
    private static final String PREFIX = "pg-listener: ";
    private static final int MAX_RECENT_ERRORS = 100;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String channel;
    private final Consumer<? super PgListenerException> onError;

    private final List<String> recentErrors = new CopyOnWriteArrayList<>();

    public ErrorReporter(String channel, Consumer<? super PgListenerException> onError) {
        this.channel = channel;
        this.onError = onError;
    }

    /**
     * The message handler failed for a payload
     */
    public void reportHandlerFailure(String payload, Throwable cause) {
        String message = String.format(PREFIX + "handling notification channel=%s msg=%s error=%s",
                channel, payload, describe(cause));
        report(new NotificationHandlingException(message, channel, payload, cause));
    }

    /**
     * Waiting for the next notification failed - the connection is considered dead
     */
    public void reportConnectionLoss(Throwable cause) {
        String message = String.format(PREFIX + "waiting for notification channel=%s error=%s",
                channel, describe(cause));
        report(new ConnectionLostException(message, cause));
    }

    /**
     * A connect-and-subscribe attempt made by the supervisor failed
     */
    public void reportReconnectFailure(Throwable cause) {
        String message = String.format(PREFIX + "reconnecting channel=%s error=%s",
                channel, describe(cause));
        report(new ReconnectException(message, cause));
    }

    /**
     * Record the error and forward it to the callback
     */
    public void report(PgListenerException error) {
        log.warn(error.getMessage());
        track(error);

        if (onError == null) {
            return;
        }
        try {
            onError.accept(error);
        } catch (RuntimeException callbackError) {
            log.error("onError callback failed for channel {}: {}", channel, callbackError.getMessage(), callbackError);
        }
    }

    private void track(PgListenerException error) {
        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        recentErrors.add(String.format("[%s] %s", timestamp, error.getMessage()));

        // Keep only the most recent errors
        while (recentErrors.size() > MAX_RECENT_ERRORS) {
            recentErrors.remove(0);
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    // ========================================
    // MONITORING METHODS
    // ========================================

    public List<String> getRecentErrors() {
        return new ArrayList<>(recentErrors);
    }

    public int getRecentErrorCount() {
        return recentErrors.size();
    }

    public String getLastError() {
        return recentErrors.isEmpty() ? null : recentErrors.get(recentErrors.size() - 1);
    }

    public boolean hasRecentErrors() {
        return !recentErrors.isEmpty();
    }
}
