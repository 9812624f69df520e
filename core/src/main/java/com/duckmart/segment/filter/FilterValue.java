package com.duckmart.segment.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The value side of an attribute filter: either a single scalar or a list of scalars.
 *
 * <p>Elements are kept as received from the transport: {@link String},
 * {@link Long} for integral numbers, {@link java.math.BigDecimal} for other numbers,
 * {@link Boolean}, or {@code null}. Type checks against the target column happen
 * in the validator, not here.
 */
public final class FilterValue {

    private final List<Object> elements;
    private final boolean list;

    private FilterValue(List<Object> elements, boolean list) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.list = list;
    }

    /**
     * Creates a scalar value.
     *
     * @param value the scalar (may be null)
     * @return the filter value
     */
    public static FilterValue scalar(Object value) {
        return new FilterValue(Collections.singletonList(value), false);
    }

    /**
     * Creates a list value.
     *
     * @param values the list elements
     * @return the filter value
     */
    public static FilterValue list(List<?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new FilterValue(new ArrayList<Object>(values), true);
    }

    public static FilterValue list(Object... values) {
        return list(Arrays.asList(values));
    }

    public boolean isList() {
        return list;
    }

    /**
     * Returns the elements; a scalar has exactly one.
     *
     * @return the elements, possibly containing nulls
     */
    public List<Object> elements() {
        return elements;
    }

    /**
     * Returns the scalar element.
     *
     * @return the single element
     * @throws IllegalStateException if this is a list value
     */
    public Object single() {
        if (list) {
            throw new IllegalStateException("List value has no single element");
        }
        return elements.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterValue other)) return false;
        return list == other.list && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, list);
    }

    @Override
    public String toString() {
        if (!list) {
            return render(elements.get(0));
        }
        return elements.stream()
            .map(FilterValue::render)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String render(Object value) {
        if (value instanceof String s) {
            return "\"" + s + "\"";
        }
        return String.valueOf(value);
    }
}
