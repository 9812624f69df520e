package com.duckmart.segment.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A segmentation request as received from the transport.
 *
 * <p>Null collections are read as empty, a null logic operator as {@code AND} and a
 * null limit as the configured default. Nothing else is interpreted here; see
 * {@code RequestValidator} for the accepted shapes.
 *
 * <p>Example:
 * <pre>
 *   SegmentationRequest request = SegmentationRequest.builder()
 *       .userFilter(UserFilter.of("location", "eq", "California"))
 *       .eventFilter(EventFilter.of("LOGIN", "gte", 1))
 *       .logicOperator("AND")
 *       .limit(100)
 *       .build();
 * </pre>
 *
 * @param userFilters filters on user attributes
 * @param eventFilters filters on per-user event counts
 * @param logicOperator "AND" or "OR" between the two groups
 * @param limit maximum number of identities to return, or null
 * @param attributes attribute columns to return with each identity
 */
public record SegmentationRequest(List<UserFilter> userFilters,
                                  List<EventFilter> eventFilters,
                                  String logicOperator,
                                  Integer limit,
                                  List<String> attributes) {

    public SegmentationRequest {
        userFilters = userFilters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(userFilters));
        eventFilters = eventFilters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(eventFilters));
        attributes = attributes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(attributes));
    }

    /**
     * Returns a request without filters, selecting all users up to the default limit.
     *
     * @return the empty request
     */
    public static SegmentationRequest empty() {
        return new SegmentationRequest(null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Incremental construction of a {@link SegmentationRequest}.
     */
    public static final class Builder {
        private final List<UserFilter> userFilters = new ArrayList<>();
        private final List<EventFilter> eventFilters = new ArrayList<>();
        private final List<String> attributes = new ArrayList<>();
        private String logicOperator;
        private Integer limit;

        private Builder() {
        }

        public Builder userFilter(UserFilter filter) {
            userFilters.add(filter);
            return this;
        }

        public Builder eventFilter(EventFilter filter) {
            eventFilters.add(filter);
            return this;
        }

        public Builder logicOperator(String logicOperator) {
            this.logicOperator = logicOperator;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder attributes(String... names) {
            attributes.addAll(Arrays.asList(names));
            return this;
        }

        public SegmentationRequest build() {
            return new SegmentationRequest(userFilters, eventFilters, logicOperator, limit, attributes);
        }
    }
}
