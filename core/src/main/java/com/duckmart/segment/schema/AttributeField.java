package com.duckmart.segment.schema;

import java.util.Objects;

/**
 * A whitelisted column of the user attributes relation.
 *
 * @param name the column name, as used in filter requests and in SQL
 * @param type the declared column type
 */
public record AttributeField(String name, FieldType type) {

    public AttributeField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (!name.matches("[a-z_][a-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid attribute column name: " + name);
        }
    }
}
