package com.omniva.pglistener.engine.fuelsystem;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * One live database connection able to subscribe to a channel and wait for its notifications.
 * <p>
 * Not thread-safe except for {@link #close()}, which may be called from another thread to
 * break a pending {@link #awaitNotification(Duration)}.
 */
public interface NotificationConnection extends AutoCloseable {

    void listen(String channel) throws SQLException;

    void unlisten(String channel) throws SQLException;

    /**
     * Block until the next notification arrives or the timeout elapses.
     *
     * @return the payload, or empty on timeout
     * @throws SQLException if the connection failed
     */
    Optional<String> awaitNotification(Duration timeout) throws SQLException;

    /**
     * Close the connection, ignoring errors
     */
    @Override
    void close();
}
