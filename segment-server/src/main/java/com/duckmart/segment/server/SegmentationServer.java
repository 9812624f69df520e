package com.duckmart.segment.server;

import com.duckmart.segment.config.SegmentationConfig;
import com.duckmart.segment.runtime.DuckDBConnectionManager;
import com.duckmart.segment.schema.DatasetInitializer;
import com.duckmart.segment.service.SegmentationService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Segmentation HTTP server bootstrap.
 *
 * Responsibilities:
 * 1. Open (or adopt) the DuckDB connection pool
 * 2. Create and optionally load the dataset
 * 3. Mount the servlets on an embedded Jetty server
 * 4. Handle graceful shutdown
 *
 * Usage:
 * <pre>
 * SegmentationServer server = new SegmentationServer(8000, "/data/duckmart.db", SegmentationConfig.defaults());
 * server.start();
 * server.blockUntilShutdown();
 * </pre>
 */
public class SegmentationServer {
    private static final Logger logger = LoggerFactory.getLogger(SegmentationServer.class);

    public static final int DEFAULT_PORT = 8000;

    private final int port;
    private final String duckDbPath;
    private final SegmentationConfig config;
    private final boolean ownsConnectionManager;

    private Path attributesCsv;
    private Path eventsCsv;
    private DuckDBConnectionManager connectionManager;
    private Server jetty;
    private ServerConnector connector;

    /**
     * Create server with default configuration.
     * - Port: 8000
     * - DuckDB: in-memory, empty dataset
     */
    public SegmentationServer() {
        this(DEFAULT_PORT, (String) null, SegmentationConfig.defaults());
    }

    /**
     * Create server that opens its own database.
     *
     * @param port HTTP port (0 for an ephemeral port)
     * @param duckDbPath Path to DuckDB database file (null for in-memory)
     * @param config segmentation limits and schema
     */
    public SegmentationServer(int port, String duckDbPath, SegmentationConfig config) {
        this.port = port;
        this.duckDbPath = duckDbPath;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ownsConnectionManager = true;
    }

    /**
     * Create server over an existing pool. The pool is left open on {@link #stop()}.
     *
     * @param port HTTP port (0 for an ephemeral port)
     * @param connectionManager an open connection manager
     * @param config segmentation limits and schema
     */
    public SegmentationServer(int port, DuckDBConnectionManager connectionManager, SegmentationConfig config) {
        this.port = port;
        this.duckDbPath = null;
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ownsConnectionManager = false;
    }

    /**
     * Load the dataset from CSV files on {@link #start()}, replacing current content.
     *
     * @param attributesCsv headered user attributes CSV
     * @param eventsCsv headered user events CSV
     * @return this server
     */
    public SegmentationServer withDataset(Path attributesCsv, Path eventsCsv) {
        this.attributesCsv = Objects.requireNonNull(attributesCsv, "attributesCsv must not be null");
        this.eventsCsv = Objects.requireNonNull(eventsCsv, "eventsCsv must not be null");
        return this;
    }

    /**
     * Start the server.
     *
     * @throws IOException if the HTTP listener fails to start
     * @throws SQLException if DuckDB cannot be opened
     */
    public void start() throws IOException, SQLException {
        logger.info("Starting Segmentation Server...");
        logger.info("Configuration: port={}, duckDbPath={}, {}",
            port, duckDbPath != null ? duckDbPath : "in-memory", config);

        // 1. DuckDB pool and dataset
        if (connectionManager == null) {
            initializeDuckDB();
        }
        if (attributesCsv != null) {
            DatasetInitializer initializer = new DatasetInitializer(connectionManager, config.schema());
            initializer.createSchema();
            initializer.loadDataset(attributesCsv, eventsCsv);
        }

        // 2. Servlets
        SegmentationJson json = new SegmentationJson();
        SegmentationService service = new SegmentationService(config, connectionManager);

        ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        context.addServlet(new ServletHolder(new SegmentServlet(service, json)), "/segment");
        context.addServlet(new ServletHolder(new ExamplesServlet()), "/examples");
        context.addServlet(new ServletHolder(StatusServlet.health(json)), "/health");
        context.addServlet(new ServletHolder(StatusServlet.root(json)), "/");

        // 3. Jetty
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setName("segment-http");
        jetty = new Server(threadPool);
        connector = new ServerConnector(jetty);
        connector.setPort(port);
        jetty.addConnector(connector);
        jetty.setHandler(context);

        try {
            jetty.start();
        } catch (Exception e) {
            stop();
            throw new IOException("Failed to start HTTP listener on port " + port, e);
        }

        logger.info("Segmentation Server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        logger.info("Stopping Segmentation Server...");

        // 1. Stop accepting requests
        if (jetty != null) {
            try {
                jetty.setStopTimeout(2000);
                jetty.stop();
            } catch (Exception e) {
                logger.error("Error stopping HTTP listener", e);
            }
        }

        // 2. Close DuckDB connection manager
        if (connectionManager != null && ownsConnectionManager) {
            try {
                connectionManager.close();
                logger.info("DuckDB connection manager closed");
            } catch (SQLException e) {
                logger.error("Error closing DuckDB connection manager", e);
            }
        }

        logger.info("Segmentation Server stopped");
    }

    /**
     * Block until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        if (jetty != null) {
            jetty.join();
        }
    }

    /**
     * Open the connection pool and make sure the relations exist.
     *
     * <p>A persistent database without CSV files to load is opened read-only.
     */
    private void initializeDuckDB() throws SQLException {
        logger.info("Initializing DuckDB connection manager...");

        DuckDBConnectionManager.Configuration dbConfig;
        if (duckDbPath != null) {
            dbConfig = DuckDBConnectionManager.Configuration.persistent(duckDbPath)
                .withReadOnly(attributesCsv == null);
        } else {
            dbConfig = DuckDBConnectionManager.Configuration.inMemory();
        }
        connectionManager = new DuckDBConnectionManager(dbConfig);
        logger.info("DuckDB connection manager created with pool size {}", connectionManager.getPoolSize());

        if (!dbConfig.readOnly && attributesCsv == null) {
            new DatasetInitializer(connectionManager, config.schema()).createSchema();
        }

        // Test connection
        try (var pooled = connectionManager.borrowConnection();
             var stmt = pooled.get().createStatement();
             var rs = stmt.executeQuery("SELECT 1 AS test")) {
            if (rs.next()) {
                logger.info("DuckDB connection test successful: {}", rs.getInt(1));
            }
        } catch (SQLException e) {
            logger.error("DuckDB connection test failed", e);
            throw e;
        }
    }

    /**
     * Get the bound port, which differs from the configured one when that was 0.
     *
     * @return Port number
     */
    public int getPort() {
        if (connector != null && connector.getLocalPort() > 0) {
            return connector.getLocalPort();
        }
        return port;
    }

    public DuckDBConnectionManager getConnectionManager() {
        return connectionManager;
    }

    /**
     * Main entry point.
     *
     * Usage:
     * <pre>
     * java -jar segment-server.jar [port] [duckDbPath|:memory:] [maxLimit] [usersCsv eventsCsv]
     * </pre>
     *
     * Examples:
     * <pre>
     * # Start with defaults (port 8000, in-memory, empty dataset)
     * java -jar segment-server.jar
     *
     * # Serve an existing database read-only
     * java -jar segment-server.jar 8000 /data/duckmart.db
     *
     * # Load CSV files into an in-memory database, returning at most 500 users
     * java -jar segment-server.jar 8000 :memory: 500 user_attributes.csv user_events.csv
     * </pre>
     */
    public static void main(String[] args) {
        try {
            int port = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_PORT;
            String duckDbPath = args.length > 1 && !args[1].equals(":memory:") ? args[1] : null;
            SegmentationConfig config = SegmentationConfig.defaults();
            if (args.length > 2) {
                config = config.withMaxLimit(Integer.parseInt(args[2]));
            }

            SegmentationServer server = new SegmentationServer(port, duckDbPath, config);
            if (args.length > 4) {
                server.withDataset(Path.of(args[3]), Path.of(args[4]));
            } else if (args.length == 4) {
                throw new IllegalArgumentException("Both usersCsv and eventsCsv are required");
            }
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown hook triggered");
                try {
                    server.stop();
                } catch (Exception e) {
                    logger.error("Error during shutdown", e);
                }
            }));

            logger.info("================================================");
            logger.info("DuckMart Segmentation Server is running");
            logger.info("Port: {}", server.getPort());
            logger.info("DuckDB: {}", duckDbPath != null ? duckDbPath : "in-memory");
            logger.info("Max limit: {}", config.maxLimit());
            logger.info("================================================");
            logger.info("Try:");
            logger.info("  curl http://localhost:{}/examples", server.getPort());
            logger.info("  curl -X POST http://localhost:{}/segment \\", server.getPort());
            logger.info("       -H 'Content-Type: application/json' \\");
            logger.info("       -d '{\"user_filters\": [{\"field\": \"age\", \"operator\": \"gte\", \"value\": 25}]}'");
            logger.info("================================================");

            server.blockUntilShutdown();

        } catch (Exception e) {
            logger.error("Server failed to start", e);
            System.exit(1);
        }
    }
}
