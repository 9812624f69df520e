package com.duckmart.segment.runtime;

import org.duckdb.DuckDBConnection;
import java.util.Objects;

/**
 * A borrowed DuckDB connection that goes back to its pool on {@link #close()}.
 *
 * <p>Use with try-with-resources so the connection is returned even when a
 * statement fails:
 * <pre>
 *   try (PooledConnection pooled = manager.borrowConnection()) {
 *       PreparedStatement stmt = pooled.get().prepareStatement(sql);
 *   }
 * </pre>
 *
 * @see DuckDBConnectionManager
 */
public class PooledConnection implements AutoCloseable {

    private final DuckDBConnection connection;
    private final DuckDBConnectionManager manager;
    private boolean released = false;

    PooledConnection(DuckDBConnection connection, DuckDBConnectionManager manager) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
    }

    /**
     * Returns the underlying connection.
     *
     * @return the underlying connection
     * @throws IllegalStateException if this connection was already released
     */
    public DuckDBConnection get() {
        if (released) {
            throw new IllegalStateException("Connection has already been released to the pool");
        }
        return connection;
    }

    /**
     * Releases the connection to the pool. Calling it again has no effect.
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            manager.releaseConnection(connection);
        }
    }

    public boolean isReleased() {
        return released;
    }
}
