package com.duckmart.segment.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pool of DuckDB connections over one database instance.
 *
 * <p>The manager opens a single root connection and fills the pool with
 * {@link DuckDBConnection#duplicate() duplicates} of it, so every pooled
 * connection sees the same database, including in-memory ones. Each concurrent
 * segment request borrows its own connection; statements and their bound
 * parameters are never shared.
 *
 * <p>Example usage:
 * <pre>
 *   // Persistent dataset, opened read-only
 *   DuckDBConnectionManager manager = new DuckDBConnectionManager(
 *       Configuration.persistent("/data/duckmart.db").withReadOnly(true));
 *
 *   try (PooledConnection pooled = manager.borrowConnection()) {
 *       // Execute queries...
 *   }
 *
 *   manager.close();
 * </pre>
 *
 * @see SegmentExecutor
 */
public class DuckDBConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConnectionManager.class);

    private final String jdbcUrl;
    private final Configuration config;
    private final DuckDBConnection root;
    private final BlockingQueue<DuckDBConnection> connectionPool;
    private final int poolSize;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager over a fresh in-memory database.
     */
    public DuckDBConnectionManager() {
        this(Configuration.inMemory());
    }

    /**
     * Creates a connection manager with the specified configuration.
     *
     * @param config the configuration
     * @throws IllegalStateException if the database cannot be opened
     */
    public DuckDBConnectionManager(Configuration config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.jdbcUrl = config.inMemory ? "jdbc:duckdb:" : "jdbc:duckdb:" + config.databasePath;
        this.poolSize = config.poolSize > 0 ? config.poolSize :
                        Math.min(Runtime.getRuntime().availableProcessors(), 8);
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);

        try {
            Properties properties = new Properties();
            if (config.readOnly) {
                properties.setProperty("duckdb.read_only", "true");
            }
            this.root = DriverManager.getConnection(jdbcUrl, properties).unwrap(DuckDBConnection.class);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to open DuckDB database " + jdbcUrl, e);
        }

        try {
            configure(root);
            for (int i = 0; i < poolSize; i++) {
                connectionPool.offer(createConnection());
            }
        } catch (SQLException e) {
            try {
                close();
            } catch (SQLException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw new IllegalStateException("Failed to initialize connection pool", e);
        }

        logger.info("DuckDB pool ready: url={}, poolSize={}, readOnly={}", jdbcUrl, poolSize, config.readOnly);
    }

    /**
     * Acquires a connection from the pool.
     *
     * <p>Blocks until a connection is available or the configured acquire
     * timeout elapses.
     *
     * @return a connection from the pool
     * @throws SQLException if the pool is exhausted or closed
     */
    public DuckDBConnection getConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Connection manager is closed");
        }

        try {
            DuckDBConnection conn = connectionPool.poll(config.acquireTimeoutMs, TimeUnit.MILLISECONDS);
            if (conn == null) {
                throw new SQLException("Connection pool exhausted - timeout after "
                    + config.acquireTimeoutMs + " ms");
            }
            if (!conn.isClosed()) {
                return conn;
            }
            return createConnection();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    /**
     * Borrows a connection that returns itself to the pool when closed.
     *
     * <pre>
     *   try (PooledConnection pooled = manager.borrowConnection()) {
     *       DuckDBConnection conn = pooled.get();
     *   }
     * </pre>
     *
     * @return pooled connection that auto-releases on close
     * @throws SQLException if no connection available or pool is closed
     */
    public PooledConnection borrowConnection() throws SQLException {
        return new PooledConnection(getConnection(), this);
    }

    /**
     * Returns a connection to the pool.
     *
     * <p>A connection that is no longer valid is closed and replaced by a new
     * duplicate of the root connection.
     *
     * @param conn the connection to release (may be null)
     */
    public void releaseConnection(DuckDBConnection conn) {
        if (conn == null) {
            return;
        }
        if (closed) {
            closeQuietly(conn);
            return;
        }

        if (!isConnectionValid(conn)) {
            logger.warn("Invalid connection detected, not returning to pool");
            closeQuietly(conn);
            try {
                DuckDBConnection replacement = createConnection();
                if (!connectionPool.offer(replacement)) {
                    logger.warn("Connection pool full, closing replacement");
                    closeQuietly(replacement);
                }
            } catch (SQLException e) {
                logger.warn("Failed to create replacement connection: {}", e.getMessage());
            }
            return;
        }

        if (!connectionPool.offer(conn)) {
            logger.warn("Connection pool full, closing extra connection");
            closeQuietly(conn);
        }
    }

    private boolean isConnectionValid(DuckDBConnection conn) {
        try {
            return !conn.isClosed() && conn.isValid(5);
        } catch (SQLException e) {
            return false;
        }
    }

    private DuckDBConnection createConnection() throws SQLException {
        return (DuckDBConnection) root.duplicate();
    }

    private void configure(DuckDBConnection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (config.memoryLimit != null) {
                stmt.execute("SET memory_limit='" + config.memoryLimit + "'");
            }
            if (config.threads > 0) {
                stmt.execute("SET threads=" + config.threads);
            }
            stmt.execute("SET enable_progress_bar=false");
        }
    }

    private void closeQuietly(DuckDBConnection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.debug("Failed to close connection: {}", e.getMessage());
        }
    }

    /**
     * Closes all pooled connections and the database.
     *
     * <p>Connections still borrowed are closed when they are released.
     *
     * @throws SQLException if any connection fails to close
     */
    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;

        SQLException firstException = null;
        DuckDBConnection conn;
        while ((conn = connectionPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                if (firstException == null) {
                    firstException = e;
                }
            }
        }
        if (root != null) {
            try {
                root.close();
            } catch (SQLException e) {
                if (firstException == null) {
                    firstException = e;
                }
            }
        }

        if (firstException != null) {
            throw firstException;
        }
        logger.info("DuckDB pool closed: {}", jdbcUrl);
    }

    public int getPoolSize() {
        return poolSize;
    }

    /**
     * Returns the number of idle connections in the pool.
     *
     * @return connections available to borrow
     */
    public int getAvailableConnections() {
        return connectionPool.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Configuration for the connection manager.
     */
    public static class Configuration {
        /** Whether to use an in-memory database */
        public boolean inMemory = true;

        /** Database file path (for persistent databases) */
        public String databasePath = null;

        /** Connection pool size (0 = auto-detect) */
        public int poolSize = 0;

        /** Open the database read-only */
        public boolean readOnly = false;

        /** How long a borrower waits for a free connection */
        public long acquireTimeoutMs = 30_000;

        /** DuckDB memory_limit setting, e.g. "4GB" (null = engine default) */
        public String memoryLimit = null;

        /** DuckDB threads setting (0 = engine default) */
        public int threads = 0;

        public static Configuration inMemory() {
            Configuration config = new Configuration();
            config.inMemory = true;
            return config;
        }

        public static Configuration persistent(String path) {
            Configuration config = new Configuration();
            config.inMemory = false;
            config.databasePath = Objects.requireNonNull(path, "path must not be null");
            return config;
        }

        public Configuration withPoolSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("poolSize must be non-negative");
            }
            this.poolSize = size;
            return this;
        }

        public Configuration withReadOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Configuration withAcquireTimeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("acquireTimeoutMs must be positive");
            }
            this.acquireTimeoutMs = timeoutMs;
            return this;
        }

        public Configuration withMemoryLimit(String memoryLimit) {
            if (memoryLimit != null && !memoryLimit.matches("\\d+(\\.\\d+)?\\s*[KMGT]?i?B")) {
                throw new IllegalArgumentException("Invalid memory limit: " + memoryLimit);
            }
            this.memoryLimit = memoryLimit;
            return this;
        }

        public Configuration withThreads(int threads) {
            if (threads < 0) {
                throw new IllegalArgumentException("threads must be non-negative");
            }
            this.threads = threads;
            return this;
        }
    }
}
