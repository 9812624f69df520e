package com.duckmart.segment.generator;

import com.duckmart.segment.config.SegmentationConfig;
import com.duckmart.segment.exception.ConfigurationException;
import com.duckmart.segment.filter.AttributePredicate;
import com.duckmart.segment.filter.CountOperator;
import com.duckmart.segment.filter.EventPredicate;
import com.duckmart.segment.filter.UserOperator;
import com.duckmart.segment.schema.AttributeField;
import com.duckmart.segment.schema.FieldType;
import com.duckmart.segment.schema.SegmentSchema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.duckmart.segment.generator.SQLQuoting.*;

/**
 * Compiles validated filters into parameterized SQL fragments.
 *
 * <p>Attribute predicates become row-level tests on the attributes relation
 * (alias {@value #ATTRIBUTES_ALIAS}):
 * <pre>
 *   age gte 25                  -&gt;  ua."age" &gt;= ?
 *   location in [CA, NY]        -&gt;  ua."location" IN (?, ?)
 *   signup_date lt 2024-01-01   -&gt;  ua."signup_date" &lt; CAST(? AS DATE)
 *   name like Smith             -&gt;  ua."name" LIKE ?            -- bound as %Smith%
 * </pre>
 *
 * <p>Event predicates need a per-user aggregation. Each one compiles to a
 * conditional count column for the grouped events relation (alias
 * {@value #EVENTS_ALIAS}) and a comparison on that column after it has been
 * LEFT JOINed to the attributes relation (alias {@value #COUNTS_ALIAS}):
 * <pre>
 *   LOGIN gte 1 within 30 days  -&gt;  COUNT(*) FILTER (WHERE e."event_name" = ?
 *                                       AND e."timestamp" &gt;= CAST(? AS TIMESTAMP)) AS "ec_0"
 *                                   COALESCE(ec."ec_0", 0) &gt;= ?
 * </pre>
 * The COALESCE gives users without a matching event a count of 0, so
 * {@code eq 0} and {@code lte} comparisons include them.
 *
 * <p>Only whitelisted identifiers appear in the SQL text; every filter value is
 * a bound parameter.
 *
 * @see SegmentQueryAssembler
 */
public class PredicateCompiler {

    public static final String ATTRIBUTES_ALIAS = "ua";
    public static final String EVENTS_ALIAS = "e";
    public static final String COUNTS_ALIAS = "ec";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    // Windows reaching before this instant count every event.
    private static final LocalDateTime EARLIEST_WINDOW_START = LocalDate.of(1, 1, 1).atStartOfDay();

    private final SegmentationConfig config;
    private final SegmentSchema schema;

    public PredicateCompiler(SegmentationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.schema = config.schema();
    }

    /**
     * Compiles an attribute predicate to a boolean SQL expression.
     *
     * @param predicate the validated predicate
     * @return the expression and its parameters
     * @throws ConfigurationException if the field is not in this compiler's schema
     */
    public SqlFragment compile(AttributePredicate predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        AttributeField field = resolve(predicate.field());

        String column = qualify(ATTRIBUTES_ALIAS, field.name());
        String placeholder = placeholder(field.type());
        UserOperator operator = predicate.operator();
        if (field.type() == FieldType.INTEGER) {
            return compileInteger(column, operator, predicate);
        }

        return switch (operator) {
            case EQ -> compare(column, "=", placeholder, bind(field.type(), predicate.value()));
            case NE -> compare(column, "<>", placeholder, bind(field.type(), predicate.value()));
            case GT -> compare(column, ">", placeholder, bind(field.type(), predicate.value()));
            case GTE -> compare(column, ">=", placeholder, bind(field.type(), predicate.value()));
            case LT -> compare(column, "<", placeholder, bind(field.type(), predicate.value()));
            case LTE -> compare(column, "<=", placeholder, bind(field.type(), predicate.value()));
            case IN -> membership(column, "IN", placeholder, field.type(), predicate.values());
            case NOT_IN -> membership(column, "NOT IN", placeholder, field.type(), predicate.values());
            case LIKE -> SqlFragment.of(column + " LIKE ?", likePattern((String) predicate.value()));
        };
    }

    /**
     * Compiles an event predicate to its count column and count comparison.
     *
     * @param predicate the validated predicate
     * @param ordinal position of the predicate in its group, used to name the count column
     * @return the aggregate column and the comparison on it
     */
    public EventAggregate compile(EventPredicate predicate, int ordinal) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative");
        }
        String alias = "ec_" + ordinal;

        StringBuilder condition = new StringBuilder()
            .append(qualify(EVENTS_ALIAS, schema.eventNameColumn())).append(" = ?");
        List<Object> parameters = new ArrayList<>();
        parameters.add(predicate.eventName());
        LocalDateTime start = predicate.hasTimeWindow() ? windowStart(predicate.timeRangeDays()) : null;
        if (start != null && !start.isBefore(EARLIEST_WINDOW_START)) {
            condition.append(" AND ").append(qualify(EVENTS_ALIAS, schema.eventTimeColumn()))
                .append(" >= CAST(? AS TIMESTAMP)");
            parameters.add(start.format(TIMESTAMP_FORMAT));
        }
        SqlFragment countColumn = new SqlFragment(
            "COUNT(*) FILTER (WHERE " + condition + ") AS " + quoteIdentifier(alias), parameters);

        String symbol = switch (predicate.operator()) {
            case EQ -> "=";
            case NE -> "<>";
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
        };
        SqlFragment comparison = SqlFragment.of(
            "COALESCE(" + qualify(COUNTS_ALIAS, alias) + ", 0) " + symbol + " ?", predicate.count());

        return new EventAggregate(alias, countColumn, comparison);
    }

    /**
     * Returns the earliest event time counted by a trailing window.
     *
     * <p>The window starts at midnight {@code days} days before today, today being
     * taken from the configured clock and zone.
     *
     * @param days the window length in days
     * @return the inclusive window start
     */
    public LocalDateTime windowStart(int days) {
        return LocalDate.now(config.clock()).minusDays(days).atStartOfDay();
    }

    /**
     * Converts a LIKE filter value to the bound pattern.
     *
     * <p>A value without wildcards matches as a substring, e.g. {@code Smith}
     * becomes {@code %Smith%}. A value with {@code %} or {@code _} is used as is.
     *
     * @param value the validated filter value
     * @return the LIKE pattern
     */
    public static String likePattern(String value) {
        if (value.indexOf('%') >= 0 || value.indexOf('_') >= 0) {
            return value;
        }
        return "%" + value + "%";
    }

    private AttributeField resolve(AttributeField field) {
        AttributeField known = schema.field(field.name()).orElse(null);
        if (known == null) {
            throw new ConfigurationException(
                "Field '" + field.name() + "' passed validation but is not in the compiler schema " + schema);
        }
        if (known.type() != field.type()) {
            throw new ConfigurationException(String.format(
                "Field '%s' validated as %s but the compiler schema declares %s",
                field.name(), field.type(), known.type()));
        }
        return known;
    }

    /**
     * Integer columns are BIGINT, so a fractional bound is rounded toward the
     * side that keeps the comparison exact: {@code age lt 30.1} is {@code age < 31}
     * and {@code age gt 30.1} is {@code age > 30}. A fractional value never equals
     * an integer, so it drops out of {@code eq}/{@code in} and makes
     * {@code ne}/{@code not_in} true for every non-null value.
     */
    private static SqlFragment compileInteger(String column, UserOperator operator, AttributePredicate predicate) {
        return switch (operator) {
            case EQ, IN -> {
                List<Object> exact = exactIntegers(predicate.values());
                if (exact.isEmpty()) {
                    yield SqlFragment.of("FALSE");
                }
                yield operator == UserOperator.EQ
                    ? compare(column, "=", "?", exact.get(0))
                    : membership(column, "IN", "?", FieldType.INTEGER, exact);
            }
            case NE, NOT_IN -> {
                List<Object> exact = exactIntegers(predicate.values());
                if (exact.isEmpty()) {
                    yield SqlFragment.of(column + " IS NOT NULL");
                }
                yield operator == UserOperator.NE
                    ? compare(column, "<>", "?", exact.get(0))
                    : membership(column, "NOT IN", "?", FieldType.INTEGER, exact);
            }
            case GT -> compare(column, ">", "?", rounded(predicate.value(), RoundingMode.FLOOR));
            case GTE -> compare(column, ">=", "?", rounded(predicate.value(), RoundingMode.CEILING));
            case LT -> compare(column, "<", "?", rounded(predicate.value(), RoundingMode.CEILING));
            case LTE -> compare(column, "<=", "?", rounded(predicate.value(), RoundingMode.FLOOR));
            case LIKE -> throw new ConfigurationException("LIKE passed validation on integer column " + column);
        };
    }

    private static List<Object> exactIntegers(List<Object> values) {
        List<Object> exact = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof Long) {
                exact.add(value);
            } else if (value instanceof BigDecimal decimal && decimal.stripTrailingZeros().scale() <= 0) {
                exact.add(decimal.longValueExact());
            }
        }
        return exact;
    }

    private static long rounded(Object value, RoundingMode mode) {
        if (value instanceof Long l) {
            return l;
        }
        return ((BigDecimal) value).setScale(0, mode).longValueExact();
    }

    private static SqlFragment compare(String column, String symbol, String placeholder, Object value) {
        return SqlFragment.of(column + " " + symbol + " " + placeholder, value);
    }

    private static SqlFragment membership(String column, String keyword, String placeholder,
                                          FieldType type, List<Object> values) {
        List<Object> parameters = new ArrayList<>(values.size());
        for (Object value : values) {
            parameters.add(bind(type, value));
        }
        String placeholders = String.join(", ", Collections.nCopies(values.size(), placeholder));
        return new SqlFragment(column + " " + keyword + " (" + placeholders + ")", parameters);
    }

    private static String placeholder(FieldType type) {
        return type == FieldType.DATE ? "CAST(? AS DATE)" : "?";
    }

    private static Object bind(FieldType type, Object value) {
        // Dates travel as ISO text and are cast in SQL.
        return type == FieldType.DATE ? value.toString() : value;
    }

    /**
     * Output of compiling one event predicate.
     *
     * @param alias the unquoted name of the count column
     * @param countColumn the conditional count for the grouped events relation
     * @param comparison the boolean test on the joined count
     */
    public record EventAggregate(String alias, SqlFragment countColumn, SqlFragment comparison) {
    }
}
