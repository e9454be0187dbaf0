package com.omniva.pglistener.engine.fuelsystem;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens unpooled connections straight from the PostgreSQL JDBC driver.
 * Used when a listener is configured with a connection URL.
 * <p>
 * A connect attempt cannot observe cancellation, so {@code connectTimeout} and {@code loginTimeout}
 * default to {@value #DEFAULT_CONNECT_TIMEOUT_SECONDS} seconds unless the caller sets them.
 */
public class PgJdbcNotificationDriver implements NotificationDriver {

    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 5;

    private final String jdbcUrl;
    private final Properties properties;

    public PgJdbcNotificationDriver(String jdbcUrl) {
        this(jdbcUrl, new Properties());
    }

    public PgJdbcNotificationDriver(String jdbcUrl, Properties properties) {
        this.jdbcUrl = jdbcUrl;
        this.properties = new Properties();
        this.properties.putAll(properties);
        String timeout = String.valueOf(DEFAULT_CONNECT_TIMEOUT_SECONDS);
        if (!jdbcUrl.contains("connectTimeout=")) {
            this.properties.putIfAbsent("connectTimeout", timeout);
        }
        if (!jdbcUrl.contains("loginTimeout=")) {
            this.properties.putIfAbsent("loginTimeout", timeout);
        }
    }

    /**
     * Copy of the properties passed to the driver on every connect
     */
    public Properties getConnectionProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }

    @Override
    public NotificationConnection connect() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl, properties);
        try {
            return new PgNotificationConnection(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
    }

    @Override
    public String toString() {
        // Never log credentials
        int query = jdbcUrl.indexOf('?');
        String safeUrl = query >= 0 ? jdbcUrl.substring(0, query) : jdbcUrl;
        return "PgJdbcNotificationDriver[" + safeUrl + "]";
    }
}
