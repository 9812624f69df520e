package com.duckmart.segment.server;

import com.duckmart.segment.exception.ValidationException;
import com.duckmart.segment.filter.AttributePredicate;
import com.duckmart.segment.filter.EventFilter;
import com.duckmart.segment.filter.EventPredicate;
import com.duckmart.segment.filter.FilterValue;
import com.duckmart.segment.filter.SegmentationRequest;
import com.duckmart.segment.filter.UserFilter;
import com.duckmart.segment.filter.ValidatedRequest;
import com.duckmart.segment.schema.AttributeField;
import com.duckmart.segment.service.SegmentationResponse;
import com.duckmart.segment.validation.Violation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON mapping between the HTTP wire format and the segmentation types.
 *
 * <p>Request bodies are read as a {@link JsonNode} tree rather than bound to
 * classes, so a filter value can be either a scalar or a list and the defaults
 * of the wire format ({@code operator = "gte"} and {@code count = 1} for event
 * filters) are applied in one place. Integral numbers become {@link Long}, other
 * numbers {@link BigDecimal}. Unknown keys are ignored.
 *
 * <p>Shape errors (wrong JSON type for a key) raise {@link MalformedRequestException};
 * everything else is left to the validator.
 */
public final class SegmentationJson {

    private final ObjectMapper mapper;

    public SegmentationJson() {
        this(new ObjectMapper());
    }

    public SegmentationJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // ==================== Reading ====================

    /**
     * Parses a request body.
     *
     * @param body the body stream
     * @return the request as received
     * @throws MalformedRequestException if the body is not a JSON object of the request shape
     */
    public SegmentationRequest readRequest(InputStream body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedRequestException("Failed to read request body", e);
        }
        return readRequest(root);
    }

    /**
     * Converts a parsed request body.
     *
     * @param root the JSON tree
     * @return the request as received
     * @throws MalformedRequestException if the tree does not have the request shape
     */
    public SegmentationRequest readRequest(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return SegmentationRequest.empty();
        }
        if (!root.isObject()) {
            throw new MalformedRequestException("Request body must be a JSON object");
        }

        List<UserFilter> userFilters = new ArrayList<>();
        JsonNode users = array(root, "user_filters");
        for (int i = 0; i < users.size(); i++) {
            userFilters.add(readUserFilter("user_filters[" + i + "]", users.get(i)));
        }

        List<EventFilter> eventFilters = new ArrayList<>();
        JsonNode events = array(root, "event_filters");
        for (int i = 0; i < events.size(); i++) {
            eventFilters.add(readEventFilter("event_filters[" + i + "]", events.get(i)));
        }

        List<String> attributes = new ArrayList<>();
        JsonNode projection = array(root, "attributes");
        for (int i = 0; i < projection.size(); i++) {
            attributes.add(requireText("attributes[" + i + "]", projection.get(i)));
        }

        String logicOperator = text(root, "logic_operator");
        Long limit = integer(root, "limit");
        Integer boundedLimit = null;
        if (limit != null) {
            boundedLimit = (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, limit));
        }

        return new SegmentationRequest(userFilters, eventFilters, logicOperator, boundedLimit, attributes);
    }

    private UserFilter readUserFilter(String path, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedRequestException(path + " must be an object");
        }
        JsonNode value = node.get("value");
        FilterValue filterValue;
        if (value != null && value.isArray()) {
            List<Object> elements = new ArrayList<>();
            for (int i = 0; i < value.size(); i++) {
                elements.add(scalar(path + ".value[" + i + "]", value.get(i)));
            }
            filterValue = FilterValue.list(elements);
        } else {
            filterValue = FilterValue.scalar(scalar(path + ".value", value));
        }
        return new UserFilter(text(node, "field"), text(node, "operator"), filterValue);
    }

    private EventFilter readEventFilter(String path, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedRequestException(path + " must be an object");
        }
        String operator = text(node, "operator");
        Long count = integer(node, "count");
        Long days = integer(node, "time_range_days");
        Integer boundedDays = null;
        if (days != null) {
            boundedDays = (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, days));
        }
        return new EventFilter(
            text(node, "event_name"),
            operator != null ? operator : EventFilter.DEFAULT_OPERATOR,
            count != null ? count : EventFilter.DEFAULT_COUNT,
            boundedDays);
    }

    private static Object scalar(String path, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
            throw new MalformedRequestException(path + " must be a finite number");
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        throw new MalformedRequestException(path + " must be a string, number, boolean or list of those");
    }

    private static JsonNode array(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!node.isArray()) {
            throw new MalformedRequestException(key + " must be an array");
        }
        return node;
    }

    private static String text(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        return requireText(key, node);
    }

    private static String requireText(String path, JsonNode node) {
        if (node == null || !node.isTextual()) {
            throw new MalformedRequestException(path + " must be a string");
        }
        return node.textValue();
    }

    private static Long integer(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new MalformedRequestException(key + " must be an integer");
        }
        return node.longValue();
    }

    // ==================== Writing ====================

    /**
     * Renders a successful response.
     *
     * <p>{@code users} is present only when the request asked for attribute columns.
     *
     * @param response the service response
     * @return {@code {user_ids, total_count, filters_applied[, users]}}
     */
    public ObjectNode writeResponse(SegmentationResponse response) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode ids = node.putArray("user_ids");
        response.userIds().forEach(ids::add);
        node.put("total_count", response.totalCount());
        node.set("filters_applied", writeFiltersApplied(response.filtersApplied()));

        if (response.hasProjection()) {
            ArrayNode users = node.putArray("users");
            for (int i = 0; i < response.userIds().size(); i++) {
                ObjectNode user = users.addObject();
                user.put("user_id", response.userIds().get(i));
                for (Map.Entry<String, Object> column : response.rows().get(i).entrySet()) {
                    user.set(column.getKey(), mapper.valueToTree(column.getValue()));
                }
            }
        }
        return node;
    }

    /**
     * Renders the normalized request echoed in {@code filters_applied}.
     *
     * @param request the validated request
     * @return the echo
     */
    public ObjectNode writeFiltersApplied(ValidatedRequest request) {
        ObjectNode node = mapper.createObjectNode();

        ArrayNode users = node.putArray("user_filters");
        for (AttributePredicate predicate : request.attributePredicates()) {
            ObjectNode filter = users.addObject();
            filter.put("field", predicate.field().name());
            filter.put("operator", predicate.operator().code());
            if (predicate.operator().isSetMembership()) {
                ArrayNode values = filter.putArray("value");
                predicate.values().forEach(v -> values.add(valueNode(v)));
            } else {
                filter.set("value", valueNode(predicate.value()));
            }
        }

        ArrayNode events = node.putArray("event_filters");
        for (EventPredicate predicate : request.eventPredicates()) {
            ObjectNode filter = events.addObject();
            filter.put("event_name", predicate.eventName());
            filter.put("operator", predicate.operator().code());
            filter.put("count", predicate.count());
            if (predicate.hasTimeWindow()) {
                filter.put("time_range_days", predicate.timeRangeDays());
            } else {
                filter.putNull("time_range_days");
            }
        }

        node.put("logic_operator", request.logicOperator().name());
        node.put("limit", request.limit());
        if (!request.projection().isEmpty()) {
            ArrayNode attributes = node.putArray("attributes");
            for (AttributeField field : request.projection()) {
                attributes.add(field.name());
            }
        }
        return node;
    }

    private JsonNode valueNode(Object value) {
        if (value instanceof Long l) {
            return mapper.getNodeFactory().numberNode(l);
        }
        if (value instanceof BigDecimal d) {
            return mapper.getNodeFactory().numberNode(d);
        }
        return mapper.getNodeFactory().textNode(String.valueOf(value));
    }

    /**
     * Renders a 400 body for a rejected request.
     *
     * @param e the validation failure
     * @return {@code {error, message, violations[]}}
     */
    public ObjectNode writeValidationError(ValidationException e) {
        ObjectNode node = error("validation_error", e.getMessage());
        ArrayNode violations = node.putArray("violations");
        for (Violation violation : e.getViolations()) {
            ObjectNode v = violations.addObject();
            v.put("path", violation.path());
            v.put("field", violation.field());
            v.put("operator", violation.operator());
            v.put("value", violation.value());
            v.put("reason", violation.reason());
        }
        return node;
    }

    /**
     * Renders a 400 body for an unreadable request.
     *
     * @param e the parse failure
     * @return {@code {error, message, violations[]}} with no violations
     */
    public ObjectNode writeMalformedRequest(MalformedRequestException e) {
        ObjectNode node = error("malformed_request", e.getMessage());
        node.putArray("violations");
        return node;
    }

    /**
     * Renders an error body.
     *
     * @param error a stable error code
     * @param message a human-readable message
     * @return {@code {error, message}}
     */
    public ObjectNode error(String error, String message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", error);
        node.put("message", message);
        return node;
    }

    public String write(JsonNode node) throws JsonProcessingException {
        return mapper.writeValueAsString(node);
    }
}
