package com.tanumd.core.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Work performed with a short-lived database connection.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SqlFunction<T> {

    /**
     * Runs against the connection. The connection must not escape this call.
     *
     * @param connection open connection
     * @return result
     * @throws SQLException on statement failure
     */
    T apply(Connection connection) throws SQLException;
}
