package com.duckmart.segment.filter;

/**
 * An event filter as received, before validation.
 *
 * <p>Compares how many times a user emitted {@code eventName}, optionally only
 * counting events of the last {@code timeRangeDays} days.
 *
 * <p>Example: {@code {"event_name": "LOGIN", "operator": "gte", "count": 1}}
 *
 * @param eventName the event name
 * @param operator the count operator code
 * @param count the count threshold
 * @param timeRangeDays the trailing window in days, or null for all time
 */
public record EventFilter(String eventName, String operator, long count, Integer timeRangeDays) {

    public static final String DEFAULT_OPERATOR = "gte";
    public static final long DEFAULT_COUNT = 1;

    public static EventFilter of(String eventName, String operator, long count) {
        return new EventFilter(eventName, operator, count, null);
    }

    public static EventFilter within(String eventName, String operator, long count, int days) {
        return new EventFilter(eventName, operator, count, days);
    }
}
