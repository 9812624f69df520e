package com.duckmart.segment.schema;

/**
 * Declared type of a user attribute column.
 *
 * <p>The type decides which filter values and operators a column accepts:
 * <ul>
 *   <li>{@link #INTEGER}: numeric values, all comparison operators</li>
 *   <li>{@link #DATE}: ISO-8601 date strings, all comparison operators</li>
 *   <li>{@link #STRING}: string values, equality, set membership and LIKE</li>
 * </ul>
 */
public enum FieldType {
    INTEGER("INTEGER"),
    STRING("VARCHAR"),
    DATE("DATE");

    private final String sqlType;

    FieldType(String sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Returns the DuckDB column type.
     *
     * @return the SQL type name
     */
    public String sqlType() {
        return sqlType;
    }

    /**
     * Returns whether values of this type have a meaningful order.
     *
     * @return true for numeric and date columns
     */
    public boolean isOrdered() {
        return this == INTEGER || this == DATE;
    }
}
