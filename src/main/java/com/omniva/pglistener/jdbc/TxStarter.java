package com.omniva.pglistener.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of transactional connections for {@link Transactions#inTransaction}.
 * <p>
 * {@link #begin()} returns a connection with auto-commit off; {@link #release(Connection)}
 * is called exactly once afterwards, whether the transaction committed or rolled back.
 */
public interface TxStarter {

    Connection begin() throws SQLException;

    void release(Connection connection) throws SQLException;

    /**
     * Borrow a connection per transaction and close it afterwards
     */
    static TxStarter of(DataSource dataSource) {
        return new TxStarter() {
            @Override
            public Connection begin() throws SQLException {
                Connection connection = dataSource.getConnection();
                try {
                    connection.setAutoCommit(false);
                    return connection;
                } catch (SQLException e) {
                    connection.close();
                    throw e;
                }
            }

            @Override
            public void release(Connection connection) throws SQLException {
                connection.close();
            }
        };
    }

    /**
     * Run transactions on a caller-owned connection. The connection stays open and its
     * auto-commit mode is restored afterwards.
     */
    static TxStarter of(Connection connection) {
        return new TxStarter() {
            private boolean previousAutoCommit;

            @Override
            public Connection begin() throws SQLException {
                previousAutoCommit = connection.getAutoCommit();
                connection.setAutoCommit(false);
                return connection;
            }

            @Override
            public void release(Connection released) throws SQLException {
                if (!released.isClosed()) {
                    released.setAutoCommit(previousAutoCommit);
                }
            }
        };
    }
}
