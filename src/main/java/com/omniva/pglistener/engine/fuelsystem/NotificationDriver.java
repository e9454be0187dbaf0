package com.omniva.pglistener.engine.fuelsystem;

import java.sql.SQLException;

/**
 * Source of dedicated notification connections - the fuel pump.
 * <p>
 * Each call opens a new connection that is owned by exactly one receiver until it is closed.
 */
@FunctionalInterface
public interface NotificationDriver {

    /**
     * Open a new connection ready for LISTEN
     *
     * @throws SQLException if the database cannot be reached
     */
    NotificationConnection connect() throws SQLException;
}
