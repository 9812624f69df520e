package com.duckmart.segment.config;

import com.duckmart.segment.schema.SegmentSchema;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Settings shared by the validator, the compiler and the service.
 *
 * <p>Defaults:
 * <ul>
 *   <li>maximum limit 1000, also used when a request has no limit</li>
 *   <li>at most 1000 values in an IN / NOT_IN list</li>
 *   <li>the DuckMart schema, see {@link SegmentSchema#defaults()}</li>
 *   <li>a UTC system clock for event time windows</li>
 * </ul>
 *
 * <p>Instances are immutable; each {@code with*} method returns a copy.
 *
 * <p>Example usage:
 * <pre>
 *   SegmentationConfig config = SegmentationConfig.defaults()
 *       .withMaxLimit(5000)
 *       .withClock(Clock.fixed(Instant.parse("2025-07-01T00:00:00Z"), ZoneOffset.UTC));
 * </pre>
 */
public final class SegmentationConfig {

    public static final int DEFAULT_MAX_LIMIT = 1000;
    public static final int DEFAULT_MAX_LIST_SIZE = 1000;

    private final int maxLimit;
    private final int defaultLimit;
    private final int maxListSize;
    private final SegmentSchema schema;
    private final Clock clock;

    private SegmentationConfig(int maxLimit, int defaultLimit, int maxListSize,
                               SegmentSchema schema, Clock clock) {
        this.maxLimit = maxLimit;
        this.defaultLimit = defaultLimit;
        this.maxListSize = maxListSize;
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static SegmentationConfig defaults() {
        return new SegmentationConfig(DEFAULT_MAX_LIMIT, DEFAULT_MAX_LIMIT, DEFAULT_MAX_LIST_SIZE,
            SegmentSchema.defaults(), Clock.system(ZoneOffset.UTC));
    }

    /**
     * Sets the upper bound on returned identities.
     *
     * <p>The default limit is lowered along with it when it would exceed the new maximum.
     *
     * @param maxLimit the maximum, positive
     * @return the modified copy
     */
    public SegmentationConfig withMaxLimit(int maxLimit) {
        if (maxLimit <= 0) {
            throw new IllegalArgumentException("maxLimit must be positive");
        }
        return new SegmentationConfig(maxLimit, Math.min(defaultLimit, maxLimit), maxListSize, schema, clock);
    }

    /**
     * Sets the limit used when a request does not name one.
     *
     * @param defaultLimit the default, positive and at most the maximum
     * @return the modified copy
     */
    public SegmentationConfig withDefaultLimit(int defaultLimit) {
        if (defaultLimit <= 0 || defaultLimit > maxLimit) {
            throw new IllegalArgumentException(
                "defaultLimit must be between 1 and maxLimit (" + maxLimit + ")");
        }
        return new SegmentationConfig(maxLimit, defaultLimit, maxListSize, schema, clock);
    }

    public SegmentationConfig withMaxListSize(int maxListSize) {
        if (maxListSize <= 0) {
            throw new IllegalArgumentException("maxListSize must be positive");
        }
        return new SegmentationConfig(maxLimit, defaultLimit, maxListSize, schema, clock);
    }

    public SegmentationConfig withSchema(SegmentSchema schema) {
        return new SegmentationConfig(maxLimit, defaultLimit, maxListSize, schema, clock);
    }

    public SegmentationConfig withClock(Clock clock) {
        return new SegmentationConfig(maxLimit, defaultLimit, maxListSize, schema, clock);
    }

    public int maxLimit() {
        return maxLimit;
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public int maxListSize() {
        return maxListSize;
    }

    public SegmentSchema schema() {
        return schema;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public String toString() {
        return String.format("SegmentationConfig(maxLimit=%d, defaultLimit=%d, maxListSize=%d, zone=%s, %s)",
            maxLimit, defaultLimit, maxListSize, clock.getZone(), schema);
    }
}
