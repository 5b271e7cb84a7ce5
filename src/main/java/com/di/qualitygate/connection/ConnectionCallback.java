package com.di.qualitygate.connection;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work run by {@link ConnectionManager#execute(ConnectionCallback)} on a leased connection.
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

    T doInConnection(Connection connection) throws SQLException;
}
