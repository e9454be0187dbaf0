package com.omniva.pglistener.engine.fuelsystem;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.Queue;

/**
 * PostgreSQL JDBC notification connection.
 * <p>
 * The driver can return several notifications from one read, so the surplus is buffered
 * and handed out one at a time in arrival order.
 */
public class PgNotificationConnection implements NotificationConnection {

    private static final Logger log = LoggerFactory.getLogger(PgNotificationConnection.class);

    private final Connection connection;
    private final PGConnection pgConnection;
    private final Queue<String> buffered = new ArrayDeque<>();

    public PgNotificationConnection(Connection connection) throws SQLException {
        this.connection = connection;
        this.pgConnection = connection.unwrap(PGConnection.class);
        // LISTEN only takes effect once committed
        connection.setAutoCommit(true);
    }

    @Override
    public void listen(String channel) throws SQLException {
        execute("LISTEN " + quoteIdentifier(channel));
    }

    @Override
    public void unlisten(String channel) throws SQLException {
        execute("UNLISTEN " + quoteIdentifier(channel));
    }

    @Override
    public Optional<String> awaitNotification(Duration timeout) throws SQLException {
        if (!buffered.isEmpty()) {
            return Optional.of(buffered.poll());
        }

        // 0 would block forever
        int timeoutMillis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        PGNotification[] notifications = pgConnection.getNotifications(timeoutMillis);
        if (notifications == null) {
            return Optional.empty();
        }
        for (PGNotification notification : notifications) {
            buffered.add(notification.getParameter());
        }
        return Optional.ofNullable(buffered.poll());
    }

    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException closeError) {
            log.warn("Error closing notification connection: {}", closeError.getMessage());
        }
    }

    private void execute(String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    /**
     * Quote a channel name as an SQL identifier so that case and special characters survive
     */
    static String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
