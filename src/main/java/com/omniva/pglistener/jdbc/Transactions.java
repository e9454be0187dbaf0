package com.omniva.pglistener.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Transaction helpers for plain JDBC
 */
public final class Transactions {

    private static final Logger log = LoggerFactory.getLogger(Transactions.class);

    private Transactions() {
    }

    /**
     * Run the callback in a transaction. Commits when it returns, rolls back when it
     * throws anything, then rethrows the original failure.
     * <p>
     * A rollback on a connection that is already closed is skipped. Any other rollback
     * failure is attached to the original failure as suppressed.
     */
    public static <T> T inTransaction(TxStarter starter, TxCallback<T> callback) throws SQLException {
        Connection connection = starter.begin();
        try {
            T result;
            try {
                result = callback.execute(connection);
            } catch (Throwable failure) {
                rollback(connection, failure);
                throw failure;
            }
            connection.commit();
            return result;
        } finally {
            starter.release(connection);
        }
    }

    private static void rollback(Connection connection, Throwable failure) {
        try {
            if (connection.isClosed()) {
                log.debug("Skipping rollback - connection already closed");
                return;
            }
            connection.rollback();
            log.debug("Transaction rolled back: {}", failure.getMessage());
        } catch (SQLException rollbackError) {
            failure.addSuppressed(rollbackError);
        }
    }

    /**
     * Execute the statements in order and stop at the first failure
     */
    public static void execAll(Connection connection, String... statements) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }
}
