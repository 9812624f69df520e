package com.duckmart.segment.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Whitelist of the relations and columns the segmentation compiler may reference.
 *
 * <p>Every identifier that appears unparameterized in a generated statement comes
 * from this class: table names, the identity column, the event name and timestamp
 * columns, and the attribute columns that filters can target. Filter values never
 * do.
 *
 * <p>The default schema mirrors the DuckMart dataset:
 * <pre>
 *   user_attributes(user_id, name, age, gender, location,
 *                   signup_date, subscription_plan, device_type)
 *   user_events(user_id, event_name, "timestamp")
 * </pre>
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class SegmentSchema {

    public static final String DEFAULT_ATTRIBUTES_TABLE = "user_attributes";
    public static final String DEFAULT_EVENTS_TABLE = "user_events";

    private final String attributesTable;
    private final String eventsTable;
    private final String identityColumn;
    private final String eventNameColumn;
    private final String eventTimeColumn;
    private final Map<String, AttributeField> fields;
    private final Set<String> knownEvents;

    private SegmentSchema(String attributesTable,
                          String eventsTable,
                          String identityColumn,
                          String eventNameColumn,
                          String eventTimeColumn,
                          Map<String, AttributeField> fields,
                          Set<String> knownEvents) {
        this.attributesTable = Objects.requireNonNull(attributesTable, "attributesTable must not be null");
        this.eventsTable = Objects.requireNonNull(eventsTable, "eventsTable must not be null");
        this.identityColumn = Objects.requireNonNull(identityColumn, "identityColumn must not be null");
        this.eventNameColumn = Objects.requireNonNull(eventNameColumn, "eventNameColumn must not be null");
        this.eventTimeColumn = Objects.requireNonNull(eventTimeColumn, "eventTimeColumn must not be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.knownEvents = Collections.unmodifiableSet(new LinkedHashSet<>(knownEvents));
        for (String identifier : List.of(attributesTable, eventsTable, identityColumn, eventNameColumn, eventTimeColumn)) {
            if (!identifier.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new IllegalArgumentException("Invalid schema identifier: " + identifier);
            }
        }
        if (!this.fields.containsKey(identityColumn)) {
            throw new IllegalArgumentException(
                "Identity column '" + identityColumn + "' must be a whitelisted attribute");
        }
    }

    /**
     * Returns the DuckMart schema with no restriction on event names.
     *
     * @return the default schema
     */
    public static SegmentSchema defaults() {
        Map<String, AttributeField> fields = new LinkedHashMap<>();
        for (AttributeField field : List.of(
                new AttributeField("user_id", FieldType.INTEGER),
                new AttributeField("name", FieldType.STRING),
                new AttributeField("age", FieldType.INTEGER),
                new AttributeField("gender", FieldType.STRING),
                new AttributeField("location", FieldType.STRING),
                new AttributeField("signup_date", FieldType.DATE),
                new AttributeField("subscription_plan", FieldType.STRING),
                new AttributeField("device_type", FieldType.STRING))) {
            fields.put(field.name(), field);
        }
        return new SegmentSchema(DEFAULT_ATTRIBUTES_TABLE, DEFAULT_EVENTS_TABLE,
            "user_id", "event_name", "timestamp", fields, Set.of());
    }

    /**
     * Returns a copy that only accepts the given event names in event filters.
     *
     * @param eventNames the accepted event names (empty to accept any)
     * @return the restricted schema
     */
    public SegmentSchema withKnownEvents(Set<String> eventNames) {
        Objects.requireNonNull(eventNames, "eventNames must not be null");
        return new SegmentSchema(attributesTable, eventsTable, identityColumn,
            eventNameColumn, eventTimeColumn, fields, eventNames);
    }

    /**
     * Returns a copy reading from differently named relations.
     *
     * @param attributesTable the user attributes relation
     * @param eventsTable the user events relation
     * @return the renamed schema
     */
    public SegmentSchema withTables(String attributesTable, String eventsTable) {
        return new SegmentSchema(attributesTable, eventsTable, identityColumn,
            eventNameColumn, eventTimeColumn, fields, knownEvents);
    }

    /**
     * Returns a copy without the given attribute columns.
     *
     * @param names the columns to remove from the whitelist
     * @return the reduced schema
     */
    public SegmentSchema withoutFields(String... names) {
        Map<String, AttributeField> reduced = new LinkedHashMap<>(fields);
        for (String name : names) {
            reduced.remove(name);
        }
        return new SegmentSchema(attributesTable, eventsTable, identityColumn,
            eventNameColumn, eventTimeColumn, reduced, knownEvents);
    }

    /**
     * Looks up a whitelisted attribute column.
     *
     * @param name the column name from a filter
     * @return the field, or empty if the name is not whitelisted
     */
    public Optional<AttributeField> field(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(fields.get(name));
    }

    public boolean acceptsEvent(String eventName) {
        return knownEvents.isEmpty() || knownEvents.contains(eventName);
    }

    public Map<String, AttributeField> fields() {
        return fields;
    }

    public Set<String> knownEvents() {
        return knownEvents;
    }

    public String attributesTable() {
        return attributesTable;
    }

    public String eventsTable() {
        return eventsTable;
    }

    public String identityColumn() {
        return identityColumn;
    }

    public String eventNameColumn() {
        return eventNameColumn;
    }

    public String eventTimeColumn() {
        return eventTimeColumn;
    }

    @Override
    public String toString() {
        return String.format("SegmentSchema(%s, %s, fields=%s)",
            attributesTable, eventsTable, fields.keySet());
    }
}
