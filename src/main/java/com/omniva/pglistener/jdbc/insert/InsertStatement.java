package com.omniva.pglistener.jdbc.insert;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * INSERT text with numbered placeholders and its arguments in placeholder order
 */
public record InsertStatement(String sql, List<Object> args) {

    private static final Pattern VALUE_PLACEHOLDER = Pattern.compile("(?<=[(,])\\$\\d+(?=[,)])");

    public InsertStatement {
        // Stream.toList keeps null arguments and is unmodifiable
        args = args == null ? List.of() : args.stream().toList();
    }

    /**
     * Prepare the statement on the connection with every argument bound. The numbered
     * placeholders of the VALUES list are rewritten to JDBC {@code ?} markers.
     */
    public PreparedStatement prepare(Connection connection) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(toJdbcSql());
        try {
            for (int i = 0; i < args.size(); i++) {
                statement.setObject(i + 1, args.get(i));
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    String toJdbcSql() {
        return VALUE_PLACEHOLDER.matcher(sql).replaceAll("?");
    }
}
