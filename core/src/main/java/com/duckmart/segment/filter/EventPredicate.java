package com.duckmart.segment.filter;

import java.util.Objects;

/**
 * A validated event filter: {@code count(events named eventName [in window]) <operator> count}.
 *
 * @param eventName the event name
 * @param operator the count operator
 * @param count the non-negative threshold
 * @param timeRangeDays the positive trailing window in days, or null for all time
 */
public record EventPredicate(String eventName, CountOperator operator, long count, Integer timeRangeDays) {

    public EventPredicate {
        Objects.requireNonNull(eventName, "eventName must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        if (timeRangeDays != null && timeRangeDays <= 0) {
            throw new IllegalArgumentException("timeRangeDays must be positive");
        }
    }

    public boolean hasTimeWindow() {
        return timeRangeDays != null;
    }
}
