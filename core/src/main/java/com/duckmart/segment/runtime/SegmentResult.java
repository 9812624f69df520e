package com.duckmart.segment.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by a segment query, in ascending identity order.
 *
 * @param userIds the matching identities
 * @param rows one map per identity holding the projection columns by name
 *             (empty maps when no projection was requested)
 */
public record SegmentResult(List<Long> userIds, List<Map<String, Object>> rows) {

    public SegmentResult {
        userIds = List.copyOf(userIds);
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
        if (userIds.size() != rows.size()) {
            throw new IllegalArgumentException("userIds and rows must have the same size");
        }
    }

    public int count() {
        return userIds.size();
    }
}
