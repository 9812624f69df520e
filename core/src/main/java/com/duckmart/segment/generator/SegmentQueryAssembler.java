package com.duckmart.segment.generator;

import com.duckmart.segment.config.SegmentationConfig;
import com.duckmart.segment.filter.AttributePredicate;
import com.duckmart.segment.filter.EventPredicate;
import com.duckmart.segment.filter.LogicOperator;
import com.duckmart.segment.filter.ValidatedRequest;
import com.duckmart.segment.generator.PredicateCompiler.EventAggregate;
import com.duckmart.segment.schema.AttributeField;
import com.duckmart.segment.schema.SegmentSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.duckmart.segment.generator.PredicateCompiler.ATTRIBUTES_ALIAS;
import static com.duckmart.segment.generator.PredicateCompiler.COUNTS_ALIAS;
import static com.duckmart.segment.generator.PredicateCompiler.EVENTS_ALIAS;
import static com.duckmart.segment.generator.SQLQuoting.*;

/**
 * Assembles compiled predicates into one segment statement.
 *
 * <p>Generated shape (the CTE and join only when event predicates exist):
 * <pre>
 *   WITH event_counts AS (
 *     SELECT e."user_id", COUNT(*) FILTER (WHERE ...) AS "ec_0", ...
 *     FROM "user_events" AS e
 *     WHERE e."event_name" IN (?, ...)
 *     GROUP BY e."user_id")
 *   SELECT DISTINCT ua."user_id"[, ua."name", ...]
 *   FROM "user_attributes" AS ua
 *   LEFT JOIN event_counts AS ec ON ec."user_id" = ua."user_id"
 *   WHERE (attribute group) AND|OR (event group)
 *   ORDER BY ua."user_id" ASC
 *   LIMIT n
 * </pre>
 *
 * <p>Predicates inside a group are always AND-combined; only the boundary
 * between the attribute group and the event group uses the request's logic
 * operator. An empty group is the neutral element of that operator (true under
 * AND, false under OR), so a request with one group selects the same users under
 * either operator, and a request with no predicates has no WHERE clause.
 *
 * <p>Parameters are collected in textual order: CTE parameters, attribute group,
 * event group. The limit is a validated {@code int} and is written inline.
 */
public class SegmentQueryAssembler {

    static final String COUNTS_CTE = "event_counts";

    private final SegmentSchema schema;
    private final PredicateCompiler compiler;

    public SegmentQueryAssembler(SegmentationConfig config) {
        this(config, new PredicateCompiler(config));
    }

    public SegmentQueryAssembler(SegmentationConfig config, PredicateCompiler compiler) {
        this.schema = Objects.requireNonNull(config, "config must not be null").schema();
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
    }

    /**
     * Builds the statement for a validated request.
     *
     * @param request the validated request
     * @return the statement, its parameters and projection
     */
    public SegmentQuery assemble(ValidatedRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        List<SqlFragment> attributeFragments = new ArrayList<>();
        for (AttributePredicate predicate : request.attributePredicates()) {
            attributeFragments.add(compiler.compile(predicate));
        }

        List<EventAggregate> aggregates = new ArrayList<>();
        for (int i = 0; i < request.eventPredicates().size(); i++) {
            aggregates.add(compiler.compile(request.eventPredicates().get(i), i));
        }

        String identity = schema.identityColumn();
        StringBuilder sql = new StringBuilder();
        List<Object> parameters = new ArrayList<>();

        if (!aggregates.isEmpty()) {
            appendCountsCte(sql, parameters, aggregates, request.eventPredicates());
        }

        sql.append("SELECT DISTINCT ").append(qualify(ATTRIBUTES_ALIAS, identity));
        for (AttributeField field : request.projection()) {
            sql.append(", ").append(qualify(ATTRIBUTES_ALIAS, field.name()));
        }
        sql.append("\nFROM ").append(quoteIdentifier(schema.attributesTable()))
            .append(" AS ").append(ATTRIBUTES_ALIAS);

        if (!aggregates.isEmpty()) {
            sql.append("\nLEFT JOIN ").append(COUNTS_CTE).append(" AS ").append(COUNTS_ALIAS)
                .append(" ON ").append(qualify(COUNTS_ALIAS, identity))
                .append(" = ").append(qualify(ATTRIBUTES_ALIAS, identity));
        }

        SqlFragment attributeGroup = conjunction(attributeFragments);
        List<SqlFragment> comparisons = new ArrayList<>();
        for (EventAggregate aggregate : aggregates) {
            comparisons.add(aggregate.comparison());
        }
        SqlFragment eventGroup = conjunction(comparisons);

        SqlFragment where = combine(attributeGroup, eventGroup, request.logicOperator());
        if (where != null) {
            sql.append("\nWHERE ").append(where.sql());
            parameters.addAll(where.parameters());
        }

        sql.append("\nORDER BY ").append(qualify(ATTRIBUTES_ALIAS, identity)).append(" ASC");
        sql.append("\nLIMIT ").append(request.limit());

        return new SegmentQuery(sql.toString(), parameters, request.projection(), request.limit());
    }

    private void appendCountsCte(StringBuilder sql, List<Object> parameters,
                                 List<EventAggregate> aggregates, List<EventPredicate> predicates) {
        String identity = schema.identityColumn();
        sql.append("WITH ").append(COUNTS_CTE).append(" AS (\n  SELECT ")
            .append(qualify(EVENTS_ALIAS, identity));
        for (EventAggregate aggregate : aggregates) {
            sql.append(",\n    ").append(aggregate.countColumn().sql());
            parameters.addAll(aggregate.countColumn().parameters());
        }

        // Only rows of a requested event can change a count.
        Set<String> eventNames = new LinkedHashSet<>();
        for (EventPredicate predicate : predicates) {
            eventNames.add(predicate.eventName());
        }
        sql.append("\n  FROM ").append(quoteIdentifier(schema.eventsTable())).append(" AS ").append(EVENTS_ALIAS)
            .append("\n  WHERE ").append(qualify(EVENTS_ALIAS, schema.eventNameColumn()))
            .append(" IN (").append(String.join(", ", Collections.nCopies(eventNames.size(), "?")))
            .append(")")
            .append("\n  GROUP BY ").append(qualify(EVENTS_ALIAS, identity))
            .append(")\n");
        parameters.addAll(eventNames);
    }

    /**
     * AND-combines fragments, or returns null for an empty group.
     */
    private static SqlFragment conjunction(List<SqlFragment> fragments) {
        if (fragments.isEmpty()) {
            return null;
        }
        if (fragments.size() == 1) {
            return fragments.get(0);
        }
        List<String> parts = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();
        for (SqlFragment fragment : fragments) {
            parts.add("(" + fragment.sql() + ")");
            parameters.addAll(fragment.parameters());
        }
        return new SqlFragment(String.join(" AND ", parts), parameters);
    }

    /**
     * Joins the two groups with the logic operator; a missing group is neutral.
     */
    private static SqlFragment combine(SqlFragment attributeGroup, SqlFragment eventGroup, LogicOperator operator) {
        if (attributeGroup == null) {
            return eventGroup;
        }
        if (eventGroup == null) {
            return attributeGroup;
        }
        List<Object> parameters = new ArrayList<>(attributeGroup.parameters());
        parameters.addAll(eventGroup.parameters());
        return new SqlFragment(
            "(" + attributeGroup.sql() + ")\n  " + operator.name() + " (" + eventGroup.sql() + ")",
            parameters);
    }
}
