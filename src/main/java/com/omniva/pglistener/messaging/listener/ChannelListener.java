package com.omniva.pglistener.messaging.listener;

import com.omniva.pglistener.engine.fault.PgListenerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interface for handling channel notifications
 * Implementations should be annotated with @PgChannelListener
 * <p>
 * PgChannelListener(
 * channel = "orders",
 * debounceMillis = 200,
 * enabled = true/false
 * )
 */
public interface ChannelListener {

    Logger log = LoggerFactory.getLogger(ChannelListener.class);

    /**
     * Handle one notification payload. A thrown exception is reported through
     * {@link #onError} and the next payload is still delivered.
     */
    void onMessage(String payload) throws Exception;

    /**
     * Called for every failure after the listener started (optional override)
     */
    default void onError(PgListenerException error) {
        log.warn("{}: {}", getListenerName(), error.getMessage());
    }

    /**
     * Called when the database connection is lost (optional override)
     */
    default void onConnectionLoss() {
        // Default: do nothing
    }

    /**
     * Called after the subscription was re-established (optional override)
     */
    default void onReconnect() {
        // Default: do nothing
    }

    /**
     * Called when listener is registered (optional override)
     */
    default void onRegistered(String channel) {
        // Default: do nothing
    }

    /**
     * Get listener name for logging/debugging
     */
    default String getListenerName() {
        return this.getClass().getSimpleName();
    }
}
