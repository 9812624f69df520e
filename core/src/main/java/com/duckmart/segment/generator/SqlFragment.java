package com.duckmart.segment.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL text with its positional {@code ?} parameters, in order.
 *
 * @param sql the SQL text
 * @param parameters the values bound to the placeholders of {@code sql}
 */
public record SqlFragment(String sql, List<Object> parameters) {

    public SqlFragment {
        Objects.requireNonNull(sql, "sql must not be null");
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        long placeholders = sql.chars().filter(c -> c == '?').count();
        if (placeholders != parameters.size()) {
            throw new IllegalArgumentException(String.format(
                "Fragment has %d placeholders but %d parameters: %s", placeholders, parameters.size(), sql));
        }
    }

    public static SqlFragment of(String sql, Object... parameters) {
        List<Object> values = new ArrayList<>(parameters.length);
        Collections.addAll(values, parameters);
        return new SqlFragment(sql, values);
    }
}
