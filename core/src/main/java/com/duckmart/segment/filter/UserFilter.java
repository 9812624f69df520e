package com.duckmart.segment.filter;

/**
 * An attribute filter as received, before validation.
 *
 * <p>Example: {@code {"field": "age", "operator": "gte", "value": 25}}
 *
 * @param field the attribute column name
 * @param operator the operator code
 * @param value the value to compare against
 */
public record UserFilter(String field, String operator, FilterValue value) {

    public static UserFilter of(String field, String operator, Object value) {
        return new UserFilter(field, operator, FilterValue.scalar(value));
    }

    public static UserFilter ofList(String field, String operator, Object... values) {
        return new UserFilter(field, operator, FilterValue.list(values));
    }
}
