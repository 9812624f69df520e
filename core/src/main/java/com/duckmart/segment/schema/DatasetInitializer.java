package com.duckmart.segment.schema;

import com.duckmart.segment.exception.QueryExecutionException;
import com.duckmart.segment.generator.SQLQuoting;
import com.duckmart.segment.runtime.DuckDBConnectionManager;
import com.duckmart.segment.runtime.PooledConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.duckmart.segment.generator.SQLQuoting.quoteIdentifier;

/**
 * Creates and loads the two relations segment queries read.
 *
 * <p>The attributes relation gets one column per whitelisted field, keyed by the
 * identity column. The events relation references it and is indexed on
 * (identity, event name, timestamp) for the per-user counts.
 *
 * <p>Example usage:
 * <pre>
 *   DatasetInitializer initializer = new DatasetInitializer(manager, SegmentSchema.defaults());
 *   initializer.createSchema();
 *   initializer.loadDataset(Path.of("user_attributes.csv"), Path.of("user_events.csv"));
 * </pre>
 *
 * <p>This is the only component that writes; the compiler and executor only read.
 */
public class DatasetInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatasetInitializer.class);

    private final DuckDBConnectionManager connectionManager;
    private final SegmentSchema schema;

    public DatasetInitializer(DuckDBConnectionManager connectionManager, SegmentSchema schema) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Creates both relations and their indexes if they do not exist.
     *
     * @throws QueryExecutionException if a DDL statement fails
     */
    public void createSchema() {
        for (String ddl : schemaStatements()) {
            execute(ddl);
        }
        logger.info("Segment schema ready: {}, {}", schema.attributesTable(), schema.eventsTable());
    }

    /**
     * Returns the DDL issued by {@link #createSchema()}, in order.
     *
     * @return the statements
     */
    public List<String> schemaStatements() {
        String attributes = quoteIdentifier(schema.attributesTable());
        String events = quoteIdentifier(schema.eventsTable());
        String identity = quoteIdentifier(schema.identityColumn());
        String eventName = quoteIdentifier(schema.eventNameColumn());
        String eventTime = quoteIdentifier(schema.eventTimeColumn());

        List<String> columns = new ArrayList<>();
        for (AttributeField field : schema.fields().values()) {
            String column = quoteIdentifier(field.name()) + " " + field.type().sqlType();
            if (field.name().equals(schema.identityColumn())) {
                column += " PRIMARY KEY";
            }
            columns.add(column);
        }

        List<String> statements = new ArrayList<>();
        statements.add("CREATE TABLE IF NOT EXISTS " + attributes + " (" + String.join(", ", columns) + ")");
        statements.add("CREATE TABLE IF NOT EXISTS " + events + " ("
            + identity + " INTEGER, "
            + eventName + " VARCHAR, "
            + eventTime + " TIMESTAMP, "
            + "FOREIGN KEY (" + identity + ") REFERENCES " + attributes + "(" + identity + "))");
        statements.add(index(schema.eventsTable(), "user_event_time",
            identity + ", " + eventName + ", " + eventTime));
        if (schema.fields().containsKey("age")) {
            statements.add(index(schema.attributesTable(), "age", quoteIdentifier("age")));
        }
        if (schema.fields().containsKey("location")) {
            statements.add(index(schema.attributesTable(), "location", quoteIdentifier("location")));
        }
        return statements;
    }

    /**
     * Replaces the content of both relations with the given CSV files.
     *
     * <p>Events are cleared before attributes and loaded after them, so the
     * foreign key holds throughout.
     *
     * @param attributesCsv headered CSV with the attribute columns
     * @param eventsCsv headered CSV with identity, event name and timestamp
     * @throws IllegalArgumentException if a file does not exist
     * @throws QueryExecutionException if loading fails
     */
    public void loadDataset(Path attributesCsv, Path eventsCsv) {
        requireFile(attributesCsv);
        requireFile(eventsCsv);

        execute("DELETE FROM " + quoteIdentifier(schema.eventsTable()));
        execute("DELETE FROM " + quoteIdentifier(schema.attributesTable()));
        insertCsv(schema.attributesTable(), attributesCsv);
        insertCsv(schema.eventsTable(), eventsCsv);

        logger.info("Loaded {} users and {} events",
            countRows(schema.attributesTable()), countRows(schema.eventsTable()));
    }

    /**
     * Counts the rows of a relation.
     *
     * @param table the relation name
     * @return the row count
     * @throws QueryExecutionException if the relation cannot be read
     */
    public long countRows(String table) {
        String sql = "SELECT COUNT(*) FROM " + quoteIdentifier(table);
        try (PooledConnection pooled = connectionManager.borrowConnection();
             Statement stmt = pooled.get().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to count rows: " + e.getMessage(), e, sql);
        }
    }

    private void insertCsv(String table, Path csv) {
        String path = SQLQuoting.quoteFilePath(csv.toAbsolutePath().toString());
        execute("INSERT INTO " + quoteIdentifier(table) + " BY NAME SELECT * FROM read_csv(" + path + ", header = true)");
    }

    private static String index(String table, String suffix, String columns) {
        return "CREATE INDEX IF NOT EXISTS " + quoteIdentifier("idx_" + table + "_" + suffix)
            + " ON " + quoteIdentifier(table) + " (" + columns + ")";
    }

    private static void requireFile(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("CSV file not found: " + path);
        }
    }

    private void execute(String sql) {
        logger.debug("Executing: {}", sql);
        try (PooledConnection pooled = connectionManager.borrowConnection();
             Statement stmt = pooled.get().createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to execute statement: " + e.getMessage(), e, sql);
        }
    }
}
