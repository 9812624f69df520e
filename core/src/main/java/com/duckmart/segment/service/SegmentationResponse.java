package com.duckmart.segment.service;

import com.duckmart.segment.filter.ValidatedRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of a segmentation request.
 *
 * @param userIds matching identities in ascending order
 * @param totalCount number of identities returned (never more than the effective limit)
 * @param filtersApplied the request as validated and normalized, clamped limit included
 * @param rows projection columns per identity, empty maps when none were requested
 */
public record SegmentationResponse(List<Long> userIds,
                                   int totalCount,
                                   ValidatedRequest filtersApplied,
                                   List<Map<String, Object>> rows) {

    public SegmentationResponse {
        userIds = List.copyOf(userIds);
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
        Objects.requireNonNull(filtersApplied, "filtersApplied must not be null");
        if (totalCount != userIds.size()) {
            throw new IllegalArgumentException("totalCount must equal the number of identities");
        }
    }

    public boolean hasProjection() {
        return !filtersApplied.projection().isEmpty();
    }
}
