package com.omniva.pglistener.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Work run inside a transaction by {@link Transactions#inTransaction}
 */
@FunctionalInterface
public interface TxCallback<T> {

    T execute(Connection connection) throws SQLException;
}
