package com.duckmart.segment.generator;

/**
 * Quoting for the identifiers and file paths that segment statements embed.
 *
 * <p>Filter values are never quoted into SQL text; they are bound as statement
 * parameters. Only whitelisted identifiers and bootstrap file paths pass through
 * this class.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("timestamp");           // "timestamp"
 *   SQLQuoting.qualify("ua", "signup_date");            // ua."signup_date"
 *   SQLQuoting.quoteFilePath("/data/user_events.csv");  // '/data/user_events.csv'
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard,
     * so reserved words such as {@code timestamp} are safe as column names.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Qualifies a column with a relation alias.
     *
     * @param alias an unquoted alias that is a plain identifier
     * @param column the column name
     * @return {@code alias."column"}
     */
    public static String qualify(String alias, String column) {
        validateIdentifier(alias);
        return alias + "." + quoteIdentifier(column);
    }

    /**
     * Quotes a file path for {@code read_csv}.
     *
     * <p>Rejects paths containing statement separators or comment markers.
     *
     * @param path the file path to quote
     * @return quoted path safe for SQL
     * @throws IllegalArgumentException if path is null, empty, or contains
     *         suspicious characters
     */
    public static String quoteFilePath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }

        if (path.contains(";") || path.contains("--") ||
            path.contains("/*") || path.contains("*/")) {
            throw new IllegalArgumentException(
                "Invalid characters in file path (possible SQL injection): " + path);
        }

        return "'" + path.replace("'", "''") + "'";
    }

    /**
     * Validates that a string is a plain identifier.
     *
     * <p>Only letters, digits and underscores, not starting with a digit.
     *
     * @param identifier the identifier to validate
     * @throws IllegalArgumentException if identifier is null, empty, or
     *         contains invalid characters
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (!identifier.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException(
                "Invalid identifier (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + identifier);
        }
    }
}
