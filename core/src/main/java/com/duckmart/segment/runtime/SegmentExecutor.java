package com.duckmart.segment.runtime;

import com.duckmart.segment.exception.QueryExecutionException;
import com.duckmart.segment.generator.SegmentQuery;
import com.duckmart.segment.schema.AttributeField;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes segment statements against DuckDB.
 *
 * <p>Each call borrows a connection, prepares the statement, binds its
 * parameters positionally and reads every row before the connection goes back
 * to the pool. The statement is a single read, so there is nothing to commit or
 * roll back; failures are reported, never retried.
 *
 * <p>Example usage:
 * <pre>
 *   SegmentExecutor executor = new SegmentExecutor(manager);
 *   SegmentResult result = executor.execute(assembler.assemble(validated));
 * </pre>
 *
 * @see DuckDBConnectionManager
 */
public class SegmentExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SegmentExecutor.class);

    private final DuckDBConnectionManager connectionManager;

    /**
     * Creates an executor over the given pool.
     *
     * @param connectionManager the connection manager
     */
    public SegmentExecutor(DuckDBConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(
            connectionManager, "connectionManager must not be null");
    }

    /**
     * Runs a segment statement.
     *
     * @param query the assembled statement
     * @return identities in statement order, with projection columns
     * @throws QueryExecutionException if the connection or the statement fails
     */
    public SegmentResult execute(SegmentQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        long start = System.nanoTime();
        try (PooledConnection pooled = connectionManager.borrowConnection()) {
            DuckDBConnection conn = pooled.get();

            try (PreparedStatement stmt = conn.prepareStatement(query.sql())) {
                List<Object> parameters = query.parameters();
                for (int i = 0; i < parameters.size(); i++) {
                    stmt.setObject(i + 1, parameters.get(i));
                }

                List<Long> userIds = new ArrayList<>();
                List<Map<String, Object>> rows = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        userIds.add(rs.getLong(1));
                        Map<String, Object> row = new LinkedHashMap<>();
                        int column = 2;
                        for (AttributeField field : query.projection()) {
                            row.put(field.name(), readValue(rs.getObject(column++)));
                        }
                        rows.add(row);
                    }
                }

                logger.debug("Segment query returned {} rows in {} ms",
                    userIds.size(), (System.nanoTime() - start) / 1_000_000);
                return new SegmentResult(userIds, rows);

            } catch (SQLException e) {
                throw new QueryExecutionException(
                    "Failed to execute segment query: " + e.getMessage(), e, query.sql());
            }
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to acquire database connection: " + e.getMessage(), e, query.sql());
        }
    }

    /**
     * Normalizes driver values: temporal types become ISO-8601 text.
     */
    private static Object readValue(Object value) {
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value;
    }

    public DuckDBConnectionManager getConnectionManager() {
        return connectionManager;
    }
}
