package com.omniva.pglistener.engine.fuelsystem;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Obtains notification connections from a {@link DataSource}, typically a dedicated Hikari pool.
 * The pool must not recycle connections underneath a waiting receiver (idle timeout and max lifetime off).
 */
public class DataSourceNotificationDriver implements NotificationDriver {

    private final DataSource dataSource;

    public DataSourceNotificationDriver(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public NotificationConnection connect() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            return new PgNotificationConnection(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }
}
