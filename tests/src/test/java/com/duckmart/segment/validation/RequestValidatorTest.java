package com.duckmart.segment.validation;

import com.duckmart.segment.config.SegmentationConfig;
import com.duckmart.segment.exception.ValidationException;
import com.duckmart.segment.filter.CountOperator;
import com.duckmart.segment.filter.EventFilter;
import com.duckmart.segment.filter.FilterValue;
import com.duckmart.segment.filter.LogicOperator;
import com.duckmart.segment.filter.SegmentationRequest;
import com.duckmart.segment.filter.UserFilter;
import com.duckmart.segment.filter.UserOperator;
import com.duckmart.segment.filter.ValidatedRequest;
import com.duckmart.segment.schema.SegmentSchema;
import com.duckmart.segment.test.TestBase;
import com.duckmart.segment.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RequestValidator}: whitelist, operator and value checks,
 * normalization, defaults and limit clamping.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Request Validator Tests")
public class RequestValidatorTest extends TestBase {

    private RequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator(SegmentationConfig.defaults());
    }

    private ValidatedRequest validate(SegmentationRequest.Builder builder) {
        return validator.validate(builder.build());
    }

    private ValidationException rejection(SegmentationRequest.Builder builder) {
        Throwable thrown = catchThrowable(() -> validator.validate(builder.build()));
        assertThat(thrown).isInstanceOf(ValidationException.class);
        return (ValidationException) thrown;
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Empty request selects everyone with AND and the default limit")
        void testEmptyRequest() {
            ValidatedRequest validated = validator.validate(SegmentationRequest.empty());

            assertThat(validated.isUnfiltered()).isTrue();
            assertThat(validated.logicOperator()).isEqualTo(LogicOperator.AND);
            assertThat(validated.limit()).isEqualTo(SegmentationConfig.DEFAULT_MAX_LIMIT);
            assertThat(validated.projection()).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"or", "OR", "Or", " or "})
        @DisplayName("Logic operator is case-insensitive")
        void testLogicOperatorCase(String name) {
            ValidatedRequest validated = validate(SegmentationRequest.builder().logicOperator(name));
            assertThat(validated.logicOperator()).isEqualTo(LogicOperator.OR);
        }

        @Test
        @DisplayName("Unknown logic operator is rejected")
        void testUnknownLogicOperator() {
            ValidationException e = rejection(SegmentationRequest.builder().logicOperator("XOR"));
            assertThat(e.getViolations()).extracting(Violation::reason)
                .containsExactly("logic_operator must be AND or OR");
        }
    }

    @Nested
    @DisplayName("Limit")
    class Limit {

        @Test
        @DisplayName("Limit above the maximum is clamped, not rejected")
        void testClamp() {
            ValidatedRequest validated = validate(SegmentationRequest.builder().limit(50_000));

            assertThat(validated.limit()).isEqualTo(1000);
            assertThat(validated.requestedLimit()).isEqualTo(50_000);
            assertThat(validated.limitClamped()).isTrue();
        }

        @Test
        @DisplayName("Limit within the maximum is kept")
        void testWithinMaximum() {
            ValidatedRequest validated = validate(SegmentationRequest.builder().limit(25));

            assertThat(validated.limit()).isEqualTo(25);
            assertThat(validated.limitClamped()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
        @DisplayName("Non-positive limit is rejected")
        void testNonPositive(int limit) {
            ValidationException e = rejection(SegmentationRequest.builder().limit(limit));
            assertThat(e.getViolations()).extracting(Violation::path).containsExactly("limit");
        }

        @Test
        @DisplayName("Configured maximum applies")
        void testConfiguredMaximum() {
            RequestValidator strict = new RequestValidator(SegmentationConfig.defaults().withMaxLimit(10));

            assertThat(strict.validate(SegmentationRequest.empty()).limit()).isEqualTo(10);
            assertThat(strict.validate(SegmentationRequest.builder().limit(11).build()).limit()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Attribute filters")
    class AttributeFilters {

        @Test
        @DisplayName("Unknown field is rejected")
        void testUnknownField() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("password", "eq", "x")));

            Violation violation = e.getViolations().get(0);
            assertThat(violation.path()).isEqualTo("user_filters[0]");
            assertThat(violation.field()).isEqualTo("password");
            assertThat(violation.reason()).startsWith("unknown field");
        }

        @Test
        @DisplayName("Field names are matched exactly")
        void testFieldCase() {
            rejection(SegmentationRequest.builder().userFilter(UserFilter.of("AGE", "eq", 30)));
        }

        @Test
        @DisplayName("Unknown operator is rejected")
        void testUnknownOperator() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "between", 30)));
            assertThat(e.getViolations().get(0).reason()).startsWith("unsupported operator");
        }

        @Test
        @DisplayName("Operator codes are case-sensitive")
        void testOperatorCase() {
            rejection(SegmentationRequest.builder().userFilter(UserFilter.of("age", "GTE", 30)));
        }

        @Test
        @DisplayName("Integer values are normalized to Long")
        void testIntegerNormalization() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "gte", 25)));

            assertThat(validated.attributePredicates().get(0).value()).isEqualTo(25L);
            assertThat(validated.attributePredicates().get(0).operator()).isEqualTo(UserOperator.GTE);
        }

        @Test
        @DisplayName("Fractional numbers on integer fields stay decimal")
        void testDecimalValue() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "gt", new BigDecimal("29.5"))));

            assertThat(validated.attributePredicates().get(0).value()).isEqualTo(new BigDecimal("29.5"));
        }

        @Test
        @DisplayName("Integral decimals become Long")
        void testIntegralDecimal() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "eq", new BigDecimal("30.0"))));

            assertThat(validated.attributePredicates().get(0).value()).isEqualTo(30L);
        }

        @Test
        @DisplayName("Date strings are parsed for date fields")
        void testDateNormalization() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.of("signup_date", "gte", "2024-06-01")));

            assertThat(validated.attributePredicates().get(0).value()).isEqualTo(LocalDate.of(2024, 6, 1));
        }

        @Test
        @DisplayName("Malformed date is rejected")
        void testMalformedDate() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("signup_date", "gte", "June 1st")));
            assertThat(e.getViolations().get(0).reason()).contains("expects a date string");
        }

        @ParameterizedTest
        @ValueSource(strings = {"+99999-01-01", "-0001-01-01", "99999-01-01", "0000-06-01", "2024-02-30", "2024-6-1"})
        @DisplayName("Dates need a four-digit year from 0001 and a real calendar day")
        void testDateRange(String date) {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("signup_date", "lt", date)));
            assertThat(e.getViolations()).singleElement()
                .satisfies(v -> assertThat(v.reason()).startsWith("field signup_date expects a"));
        }

        @Test
        @DisplayName("Earliest and latest four-digit years are accepted")
        void testDateBounds() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("signup_date", "not_in", "0001-01-01", "9999-12-31")));

            assertThat(validated.attributePredicates().get(0).values())
                .containsExactly(LocalDate.of(1, 1, 1), LocalDate.of(9999, 12, 31));
        }

        @Test
        @DisplayName("Integer values outside the 64-bit range are rejected")
        void testIntegerRange() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "gt", new BigDecimal("1e50")))
                .userFilter(UserFilter.ofList("age", "in", 30, new BigDecimal("-9223372036854775809")))
                .userFilter(UserFilter.of("age", "lt", Double.POSITIVE_INFINITY)));

            assertThat(e.getViolations()).extracting(Violation::reason).containsExactly(
                "value is outside the 64-bit integer range",
                "value is outside the 64-bit integer range",
                "field age expects a finite number");
        }

        @Test
        @DisplayName("Integer range bounds are inclusive")
        void testIntegerRangeBounds() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "lte", new BigDecimal("9223372036854775807")))
                .userFilter(UserFilter.of("age", "gt", new BigDecimal("-9223372036854775807.5"))));

            assertThat(validated.attributePredicates().get(0).value()).isEqualTo(Long.MAX_VALUE);
            assertThat(validated.attributePredicates().get(1).value())
                .isEqualTo(new BigDecimal("-9223372036854775807.5"));
        }

        @Test
        @DisplayName("String for an integer field is rejected")
        void testTypeMismatch() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "eq", "thirty")));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("field age expects a number");
        }

        @Test
        @DisplayName("Number for a string field is rejected")
        void testNumberForString() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("location", "eq", 7)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("field location expects a string");
        }

        @Test
        @DisplayName("Ordering operators need an integer or date field")
        void testOrderingOnString() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("location", "gt", "M")));
            assertThat(e.getViolations().get(0).reason())
                .isEqualTo("operator gt requires an integer or date field");
        }

        @Test
        @DisplayName("LIKE needs a string field")
        void testLikeOnInteger() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "like", "3%")));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("operator like requires a string field");
        }

        @Test
        @DisplayName("LIKE rejects backslash escapes")
        void testLikeEscape() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("name", "like", "User\\_1")));
            assertThat(e.getViolations().get(0).reason())
                .isEqualTo("like pattern may only use the % and _ wildcards");
        }

        @Test
        @DisplayName("Null value is rejected")
        void testNullValue() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(new UserFilter("age", "eq", null)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("value is required");
        }

        @Test
        @DisplayName("Null scalar is rejected")
        void testNullScalar() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("gender", "eq", null)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("null values are not supported");
        }
    }

    @Nested
    @DisplayName("Set membership")
    class SetMembership {

        @Test
        @DisplayName("IN takes a list and keeps order")
        void testInList() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("location", "in", "Texas", "Ohio")));

            assertThat(validated.attributePredicates().get(0).values()).containsExactly("Texas", "Ohio");
        }

        @Test
        @DisplayName("IN with a scalar is rejected")
        void testInScalar() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("location", "in", "Texas")));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("operator in requires a list value");
        }

        @Test
        @DisplayName("Empty IN list is rejected")
        void testEmptyIn() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(new UserFilter("location", "not_in", FilterValue.list())));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("operator not_in requires a non-empty list");
        }

        @Test
        @DisplayName("Lists over the configured size are rejected")
        void testListTooLong() {
            RequestValidator small = new RequestValidator(SegmentationConfig.defaults().withMaxListSize(2));

            assertThatThrownBy(() -> small.validate(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("age", "in", 1, 2, 3)).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("list holds more than 2 values");
        }

        @Test
        @DisplayName("Scalar operators reject lists")
        void testEqWithList() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("age", "eq", 1, 2)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("operator eq requires a single value, not a list");
        }

        @Test
        @DisplayName("Every list element is type-checked")
        void testListElementTypes() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("age", "in", 25, "x", 30)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("field age expects a number");
        }
    }

    @Nested
    @DisplayName("Event filters")
    class EventFilters {

        @Test
        @DisplayName("Valid event filter is carried over")
        void testValid() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .eventFilter(EventFilter.within("PURCHASE_MADE", "gte", 2, 30)));

            assertThat(validated.eventPredicates()).hasSize(1);
            assertThat(validated.eventPredicates().get(0).operator()).isEqualTo(CountOperator.GTE);
            assertThat(validated.eventPredicates().get(0).count()).isEqualTo(2);
            assertThat(validated.eventPredicates().get(0).timeRangeDays()).isEqualTo(30);
        }

        @Test
        @DisplayName("Negative count is rejected")
        void testNegativeCount() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("LOGIN", "gte", -1)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("count must be non-negative");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -7})
        @DisplayName("Non-positive window is rejected")
        void testNonPositiveWindow(int days) {
            ValidationException e = rejection(SegmentationRequest.builder()
                .eventFilter(EventFilter.within("LOGIN", "gte", 1, days)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("time_range_days must be positive");
        }

        @Test
        @DisplayName("LIKE is not a count operator")
        void testLikeOnCount() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("LOGIN", "like", 1)));
            assertThat(e.getViolations().get(0).reason()).startsWith("unsupported operator");
        }

        @Test
        @DisplayName("Blank event name is rejected")
        void testBlankName() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .eventFilter(EventFilter.of(" ", "gte", 1)));
            assertThat(e.getViolations().get(0).reason()).isEqualTo("event_name is required");
        }

        @Test
        @DisplayName("Known-event whitelist applies when configured")
        void testKnownEvents() {
            SegmentationConfig config = SegmentationConfig.defaults()
                .withSchema(SegmentSchema.defaults().withKnownEvents(Set.of("LOGIN")));
            RequestValidator restricted = new RequestValidator(config);

            assertThatCode(() -> restricted.validate(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("LOGIN", "gte", 1)).build())).doesNotThrowAnyException();
            assertThatThrownBy(() -> restricted.validate(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("DROP TABLE", "gte", 1)).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown event");
        }
    }

    @Nested
    @DisplayName("Projection and aggregation of violations")
    class ProjectionAndViolations {

        @Test
        @DisplayName("Projection skips the identity column and duplicates")
        void testProjection() {
            ValidatedRequest validated = validate(SegmentationRequest.builder()
                .attributes("user_id", "name", "age", "name"));

            assertThat(validated.projection()).extracting(f -> f.name()).containsExactly("name", "age");
        }

        @Test
        @DisplayName("Unknown projection column is rejected")
        void testUnknownProjection() {
            ValidationException e = rejection(SegmentationRequest.builder().attributes("email"));
            assertThat(e.getViolations().get(0).path()).isEqualTo("attributes[0]");
        }

        @Test
        @DisplayName("All violations are reported together")
        void testCollectsAll() {
            ValidationException e = rejection(SegmentationRequest.builder()
                .userFilter(UserFilter.of("unknown", "eq", 1))
                .userFilter(UserFilter.of("age", "eq", "x"))
                .eventFilter(EventFilter.of("LOGIN", "gte", -5))
                .logicOperator("NAND")
                .limit(0));

            assertThat(e.getViolations()).extracting(Violation::path)
                .containsExactly("user_filters[0]", "user_filters[1]", "event_filters[0]", "logic_operator", "limit");
            assertThat(e.getMessage()).contains("(and 4 more)");
            assertThat(e.getTechnicalMessage()).contains("Segmentation request rejected");
        }
    }
}
