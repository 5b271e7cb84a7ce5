package com.di.qualitygate.connection;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A connection lease that is always returned to its pool on {@link #close()}, on every exit path.
 * A lease marked poisoned, or whose connection is already closed, is evicted instead of reused.
 */
public final class ScopedConnection implements AutoCloseable {

    private final ConnectionManager manager;
    private final Connection connection;
    private boolean poisoned;
    private boolean released;

    ScopedConnection(ConnectionManager manager, Connection connection) {
        this.manager = manager;
        this.connection = connection;
    }

    public Connection connection() {
        if (released) {
            throw new IllegalStateException("Connection lease already released");
        }
        return connection;
    }

    /** Marks the connection as unusable so the pool discards it on release. */
    public void markPoisoned() {
        this.poisoned = true;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        manager.release(connection, poisoned || isClosed());
    }

    private boolean isClosed() {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }
}
