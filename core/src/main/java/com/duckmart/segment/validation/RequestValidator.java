package com.duckmart.segment.validation;

import com.duckmart.segment.config.SegmentationConfig;
import com.duckmart.segment.exception.ValidationException;
import com.duckmart.segment.filter.AttributePredicate;
import com.duckmart.segment.filter.CountOperator;
import com.duckmart.segment.filter.EventFilter;
import com.duckmart.segment.filter.EventPredicate;
import com.duckmart.segment.filter.FilterValue;
import com.duckmart.segment.filter.LogicOperator;
import com.duckmart.segment.filter.SegmentationRequest;
import com.duckmart.segment.filter.UserFilter;
import com.duckmart.segment.filter.UserOperator;
import com.duckmart.segment.filter.ValidatedRequest;
import com.duckmart.segment.schema.AttributeField;
import com.duckmart.segment.schema.FieldType;
import com.duckmart.segment.schema.SegmentSchema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates segmentation requests before compilation.
 *
 * <p>Checks, per attribute filter and in this order:
 * <ol>
 *   <li>the field is whitelisted by the schema</li>
 *   <li>the operator is an attribute operator</li>
 *   <li>the value fits the operator and the field type: IN and NOT_IN take a
 *       non-empty list, every other operator a single scalar; ordering operators
 *       need an integer or date field; LIKE needs a string field and a pattern
 *       using only the {@code %} and {@code _} wildcards</li>
 * </ol>
 * then, per event filter, the event name, the count operator, {@code count >= 0}
 * and {@code time_range_days > 0}; and finally the logic operator, the projection
 * and the limit. A limit above the configured maximum is clamped, not rejected.
 *
 * <p>All violations are collected and thrown together in one
 * {@link ValidationException}. The validator has no side effects and is safe to
 * share between threads.
 *
 * <p>Example usage:
 * <pre>
 *   RequestValidator validator = new RequestValidator(SegmentationConfig.defaults());
 *   ValidatedRequest validated = validator.validate(request);  // throws ValidationException
 * </pre>
 */
public class RequestValidator {

    private static final String USER_OPERATORS = Arrays.stream(UserOperator.values())
        .map(UserOperator::code).collect(Collectors.joining(", "));
    private static final String COUNT_OPERATORS = Arrays.stream(CountOperator.values())
        .map(CountOperator::code).collect(Collectors.joining(", "));

    private static final BigDecimal MIN_BIGINT = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal MAX_BIGINT = BigDecimal.valueOf(Long.MAX_VALUE);

    // Four-digit years only; DuckDB rejects signed and extended years at execution.
    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4)
        .appendLiteral('-')
        .appendValue(ChronoField.MONTH_OF_YEAR, 2)
        .appendLiteral('-')
        .appendValue(ChronoField.DAY_OF_MONTH, 2)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);

    private final SegmentationConfig config;
    private final SegmentSchema schema;

    /**
     * Creates a validator for the given configuration.
     *
     * @param config the whitelist and limits to enforce
     */
    public RequestValidator(SegmentationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.schema = config.schema();
    }

    /**
     * Validates and normalizes a request.
     *
     * @param request the request as received
     * @return the validated request
     * @throws ValidationException if any check fails
     * @throws NullPointerException if request is null
     */
    public ValidatedRequest validate(SegmentationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<Violation> violations = new ArrayList<>();

        List<AttributePredicate> attributePredicates = new ArrayList<>();
        for (int i = 0; i < request.userFilters().size(); i++) {
            AttributePredicate predicate = validateUserFilter(
                "user_filters[" + i + "]", request.userFilters().get(i), violations);
            if (predicate != null) {
                attributePredicates.add(predicate);
            }
        }

        List<EventPredicate> eventPredicates = new ArrayList<>();
        for (int i = 0; i < request.eventFilters().size(); i++) {
            EventPredicate predicate = validateEventFilter(
                "event_filters[" + i + "]", request.eventFilters().get(i), violations);
            if (predicate != null) {
                eventPredicates.add(predicate);
            }
        }

        LogicOperator logicOperator = LogicOperator.AND;
        if (request.logicOperator() != null) {
            logicOperator = LogicOperator.fromName(request.logicOperator()).orElse(null);
            if (logicOperator == null) {
                violations.add(new Violation("logic_operator", null, null, request.logicOperator(),
                    "logic_operator must be AND or OR"));
            }
        }

        List<AttributeField> projection = validateProjection(request.attributes(), violations);

        int requestedLimit = request.limit() != null ? request.limit() : config.defaultLimit();
        if (requestedLimit <= 0) {
            violations.add(new Violation("limit", null, null, String.valueOf(requestedLimit),
                "limit must be a positive integer"));
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        int limit = Math.min(requestedLimit, config.maxLimit());
        return new ValidatedRequest(attributePredicates, eventPredicates, logicOperator,
            limit, requestedLimit, projection);
    }

    // ==================== Attribute filters ====================

    private AttributePredicate validateUserFilter(String path, UserFilter filter, List<Violation> violations) {
        if (filter == null) {
            violations.add(new Violation(path, null, null, null, "filter must not be null"));
            return null;
        }

        AttributeField field = schema.field(filter.field()).orElse(null);
        if (field == null) {
            violations.add(new Violation(path, filter.field(), filter.operator(), render(filter.value()),
                "unknown field; expected one of " + schema.fields().keySet()));
            return null;
        }

        UserOperator operator = UserOperator.fromCode(filter.operator()).orElse(null);
        if (operator == null) {
            violations.add(new Violation(path, field.name(), filter.operator(), render(filter.value()),
                "unsupported operator; expected one of " + USER_OPERATORS));
            return null;
        }

        int before = violations.size();
        List<Object> values = validateValue(path, field, operator, filter.value(), violations);
        if (violations.size() > before) {
            return null;
        }
        return new AttributePredicate(field, operator, values);
    }

    private List<Object> validateValue(String path, AttributeField field, UserOperator operator,
                                       FilterValue value, List<Violation> violations) {
        String opCode = operator.code();
        if (value == null) {
            violations.add(new Violation(path, field.name(), opCode, null, "value is required"));
            return List.of();
        }

        if (operator.isOrdering() && !field.type().isOrdered()) {
            violations.add(new Violation(path, field.name(), opCode, render(value),
                "operator " + opCode + " requires an integer or date field"));
            return List.of();
        }
        if (operator == UserOperator.LIKE && field.type() != FieldType.STRING) {
            violations.add(new Violation(path, field.name(), opCode, render(value),
                "operator like requires a string field"));
            return List.of();
        }

        if (operator.isSetMembership()) {
            if (!value.isList()) {
                violations.add(new Violation(path, field.name(), opCode, render(value),
                    "operator " + opCode + " requires a list value"));
                return List.of();
            }
            if (value.elements().isEmpty()) {
                violations.add(new Violation(path, field.name(), opCode, render(value),
                    "operator " + opCode + " requires a non-empty list"));
                return List.of();
            }
            if (value.elements().size() > config.maxListSize()) {
                violations.add(new Violation(path, field.name(), opCode, value.elements().size() + " values",
                    "list holds more than " + config.maxListSize() + " values"));
                return List.of();
            }
        } else if (value.isList()) {
            violations.add(new Violation(path, field.name(), opCode, render(value),
                "operator " + opCode + " requires a single value, not a list"));
            return List.of();
        }

        List<Object> normalized = new ArrayList<>();
        for (Object element : value.elements()) {
            String problem = problemWith(field, operator, element);
            if (problem != null) {
                violations.add(new Violation(path, field.name(), opCode, render(value), problem));
                return List.of();
            }
            normalized.add(normalize(field.type(), element));
        }
        return normalized;
    }

    /**
     * Returns why an element cannot be compared with the field, or null if it can.
     */
    private static String problemWith(AttributeField field, UserOperator operator, Object element) {
        if (element == null) {
            return "null values are not supported";
        }
        switch (field.type()) {
            case INTEGER:
                if (!(element instanceof Number)) {
                    return "field " + field.name() + " expects a number";
                }
                if ((element instanceof Double d && !Double.isFinite(d))
                        || (element instanceof Float f && !Float.isFinite(f))) {
                    return "field " + field.name() + " expects a finite number";
                }
                BigDecimal number = toDecimal(element);
                if (number.compareTo(MIN_BIGINT) < 0 || number.compareTo(MAX_BIGINT) > 0) {
                    return "value is outside the 64-bit integer range";
                }
                return null;
            case DATE:
                if (!(element instanceof String s)) {
                    return "field " + field.name() + " expects a date string (yyyy-MM-dd)";
                }
                try {
                    LocalDate date = LocalDate.parse(s, DATE_FORMAT);
                    return date.getYear() >= 1 ? null : "field " + field.name() + " expects a year from 0001";
                } catch (DateTimeParseException e) {
                    return "field " + field.name() + " expects a date string (yyyy-MM-dd)";
                }
            case STRING:
                if (!(element instanceof String text)) {
                    return "field " + field.name() + " expects a string";
                }
                if (operator == UserOperator.LIKE && text.indexOf('\\') >= 0) {
                    return "like pattern may only use the % and _ wildcards";
                }
                return null;
            default:
                return "field " + field.name() + " has unsupported type " + field.type();
        }
    }

    private static Object normalize(FieldType type, Object element) {
        switch (type) {
            case INTEGER:
                if (element instanceof Long || element instanceof Integer
                        || element instanceof Short || element instanceof Byte) {
                    return ((Number) element).longValue();
                }
                BigDecimal decimal = toDecimal(element);
                try {
                    return decimal.longValueExact();
                } catch (ArithmeticException e) {
                    return decimal;
                }
            case DATE:
                return LocalDate.parse((String) element, DATE_FORMAT);
            default:
                return element;
        }
    }

    private static BigDecimal toDecimal(Object number) {
        if (number instanceof BigDecimal bd) {
            return bd;
        }
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(((Number) number).longValue());
        }
        return new BigDecimal(number.toString());
    }

    // ==================== Event filters ====================

    private EventPredicate validateEventFilter(String path, EventFilter filter, List<Violation> violations) {
        if (filter == null) {
            violations.add(new Violation(path, null, null, null, "filter must not be null"));
            return null;
        }

        String eventName = filter.eventName();
        if (eventName == null || eventName.isBlank()) {
            violations.add(new Violation(path, eventName, filter.operator(), null, "event_name is required"));
            return null;
        }
        if (!schema.acceptsEvent(eventName)) {
            violations.add(new Violation(path, eventName, filter.operator(), null,
                "unknown event; expected one of " + schema.knownEvents()));
            return null;
        }

        CountOperator operator = CountOperator.fromCode(filter.operator()).orElse(null);
        if (operator == null) {
            violations.add(new Violation(path, eventName, filter.operator(), String.valueOf(filter.count()),
                "unsupported operator; expected one of " + COUNT_OPERATORS));
            return null;
        }

        boolean valid = true;
        if (filter.count() < 0) {
            violations.add(new Violation(path, eventName, operator.code(), String.valueOf(filter.count()),
                "count must be non-negative"));
            valid = false;
        }
        if (filter.timeRangeDays() != null && filter.timeRangeDays() <= 0) {
            violations.add(new Violation(path, eventName, operator.code(), String.valueOf(filter.timeRangeDays()),
                "time_range_days must be positive"));
            valid = false;
        }
        if (!valid) {
            return null;
        }
        return new EventPredicate(eventName, operator, filter.count(), filter.timeRangeDays());
    }

    // ==================== Projection ====================

    private List<AttributeField> validateProjection(List<String> attributes, List<Violation> violations) {
        Set<AttributeField> projection = new LinkedHashSet<>();
        for (int i = 0; i < attributes.size(); i++) {
            String name = attributes.get(i);
            AttributeField field = schema.field(name).orElse(null);
            if (field == null) {
                violations.add(new Violation("attributes[" + i + "]", name, null, null,
                    "unknown field; expected one of " + schema.fields().keySet()));
            } else if (!field.name().equals(schema.identityColumn())) {
                projection.add(field);
            }
        }
        return new ArrayList<>(projection);
    }

    private static String render(FilterValue value) {
        return value == null ? null : value.toString();
    }
}
