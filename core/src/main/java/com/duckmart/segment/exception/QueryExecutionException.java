package com.duckmart.segment.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when a compiled segment query cannot be executed.
 *
 * <p>Wraps the {@link java.sql.SQLException} from DuckDB, or from the connection
 * pool, together with the statement that failed. Failures are internal faults: the
 * request was already validated, so the cause is the storage engine or the dataset.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Dataset relations missing (bootstrap not run)</li>
 *   <li>Column missing from a relation that the schema whitelists</li>
 *   <li>Stored values not convertible to the column type</li>
 *   <li>Connection pool exhausted or closed</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       SegmentResult result = executor.execute(query);
 *   } catch (QueryExecutionException e) {
 *       logger.error(e.getTechnicalMessage());
 *       respond(500, e.getUserMessage());
 *   }
 * </pre>
 *
 * @see com.duckmart.segment.runtime.SegmentExecutor
 */
public class QueryExecutionException extends RuntimeException {

    private static final Pattern MISSING_TABLE = Pattern.compile("Table with name (\\S+) does not exist");
    private static final Pattern MISSING_COLUMN = Pattern.compile("column \"([^\"]+)\" not found");
    private static final Pattern CONVERSION = Pattern.compile("Could not convert string '([^']*)' to ([A-Z0-9_]+)");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a message suitable for an API error body.
     *
     * <p>DuckDB error categories are mapped to short descriptions; the statement
     * text and driver details are left to {@link #getTechnicalMessage()}.
     *
     * @return user-facing error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Segment query failed.";
        }

        if (message.contains("Catalog Error")) {
            Matcher matcher = MISSING_TABLE.matcher(message);
            if (matcher.find()) {
                return "Segment dataset is not available: relation " + matcher.group(1) + " is missing.";
            }
            return "Segment dataset is not available.";
        }

        if (message.contains("Binder Error")) {
            Matcher matcher = MISSING_COLUMN.matcher(message);
            if (matcher.find()) {
                return "Segment dataset has no column '" + matcher.group(1) + "'.";
            }
            return "Segment query does not match the dataset schema.";
        }

        if (message.contains("Conversion Error")) {
            Matcher matcher = CONVERSION.matcher(message);
            if (matcher.find()) {
                return "Value '" + matcher.group(1) + "' cannot be compared as " + matcher.group(2) + ".";
            }
            return "Segment query compared values of incompatible types.";
        }

        if (message.contains("Out of Memory Error")) {
            return "Segment query exceeded the storage engine memory limit.";
        }

        if (message.contains("exhausted") || message.contains("closed")) {
            return "Segment storage is unavailable, retry later.";
        }

        return "Segment query failed.";
    }

    /**
     * Returns a detailed technical message for logs.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Segment Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
