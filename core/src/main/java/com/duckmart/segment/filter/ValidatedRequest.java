package com.duckmart.segment.filter;

import com.duckmart.segment.schema.AttributeField;
import java.util.List;
import java.util.Objects;

/**
 * A segmentation request that passed validation.
 *
 * <p>This is the only input the compiler accepts. Its limit is already clamped to
 * the configured maximum and every identifier it references is whitelisted.
 *
 * @param attributePredicates the attribute group, AND-combined
 * @param eventPredicates the event group, AND-combined
 * @param logicOperator the combinator between the two groups
 * @param limit the effective row limit
 * @param requestedLimit the limit as requested, before clamping
 * @param projection extra attribute columns to return
 */
public record ValidatedRequest(List<AttributePredicate> attributePredicates,
                               List<EventPredicate> eventPredicates,
                               LogicOperator logicOperator,
                               int limit,
                               int requestedLimit,
                               List<AttributeField> projection) {

    public ValidatedRequest {
        attributePredicates = List.copyOf(attributePredicates);
        eventPredicates = List.copyOf(eventPredicates);
        projection = List.copyOf(projection);
        Objects.requireNonNull(logicOperator, "logicOperator must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public boolean isUnfiltered() {
        return attributePredicates.isEmpty() && eventPredicates.isEmpty();
    }

    public boolean limitClamped() {
        return limit < requestedLimit;
    }
}
