package com.duckmart.segment.filter;

import com.duckmart.segment.schema.AttributeField;
import java.util.Collections;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A validated attribute filter.
 *
 * <p>Values are normalized to the column type: {@link Long} or
 * {@link java.math.BigDecimal} for integer columns, {@link java.time.LocalDate}
 * for date columns and {@link String} otherwise. Scalar operators carry exactly
 * one value; IN and NOT_IN carry one or more.
 *
 * @param field the whitelisted column
 * @param operator the operator
 * @param values the normalized values
 */
public record AttributePredicate(AttributeField field, UserOperator operator, List<Object> values) {

    public AttributePredicate {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        values = Collections.unmodifiableList(new ArrayList<>(values));
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Predicate on " + field.name() + " has no values");
        }
    }

    /**
     * Returns the scalar operand.
     *
     * @return the first value
     */
    public Object value() {
        return values.get(0);
    }
}
