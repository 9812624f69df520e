package com.duckmart.segment.generator;

import com.duckmart.segment.schema.AttributeField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A complete segment statement ready for execution.
 *
 * <p>The statement selects the identity column first, followed by the projection
 * columns in order, sorted by identity and limited.
 *
 * @param sql the statement text
 * @param parameters the values bound to its placeholders, in order
 * @param projection the attribute columns selected after the identity
 * @param limit the row limit applied
 */
public record SegmentQuery(String sql, List<Object> parameters, List<AttributeField> projection, int limit) {

    public SegmentQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        projection = List.copyOf(projection);
    }
}
