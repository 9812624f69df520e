package com.duckmart.segment.integration;

import com.duckmart.segment.filter.EventFilter;
import com.duckmart.segment.filter.SegmentationRequest;
import com.duckmart.segment.filter.UserFilter;
import com.duckmart.segment.service.SegmentationResponse;
import com.duckmart.segment.service.SegmentationService;
import com.duckmart.segment.test.SegmentTestDataset;
import com.duckmart.segment.test.SegmentTestDataset.User;
import com.duckmart.segment.test.TestBase;
import com.duckmart.segment.test.TestCategories;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end segmentation over the deterministic dataset, checked against the
 * Java mirror of its rows.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Segmentation Scenario Tests")
public class SegmentationScenarioTest extends TestBase {

    private static SegmentTestDataset dataset;
    private static SegmentationService service;

    @BeforeAll
    static void setUpDataset() {
        dataset = SegmentTestDataset.create();
        service = new SegmentationService(SegmentTestDataset.config(), dataset.connectionManager());
    }

    @AfterAll
    static void tearDownDataset() throws SQLException {
        dataset.close();
    }

    private static List<Long> run(SegmentationRequest request) {
        return service.segment(request).userIds();
    }

    private static Predicate<User> hasEvent(String eventName, Predicate<Long> count) {
        return u -> count.test(dataset.eventCount(u.userId(), eventName));
    }

    @Nested
    @DisplayName("Example scenarios")
    class Scenarios {

        @Test
        @DisplayName("Users aged 25 to 34")
        void testAgeRange() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "gte", 25))
                .userFilter(UserFilter.of("age", "lte", 34))
                .build());

            assertThat(actual)
                .isNotEmpty()
                .isEqualTo(dataset.expected(u -> u.age() >= 25 && u.age() <= 34));
        }

        @Test
        @DisplayName("California users who logged in at least once")
        void testCaliforniaLogins() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("location", "eq", "California"))
                .eventFilter(EventFilter.of("LOGIN", "gte", 1))
                .build());

            assertThat(actual)
                .isNotEmpty()
                .isEqualTo(dataset.expected(
                    hasEvent("LOGIN", c -> c >= 1).and(u -> u.location().equals("California"))));
        }

        @Test
        @DisplayName("Premium users who purchased in the last 30 days")
        void testPremiumRecentPurchasers() {
            LocalDateTime start = LocalDateTime.of(2025, 6, 1, 0, 0);
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("subscription_plan", "eq", "Premium"))
                .eventFilter(EventFilter.within("PURCHASE_MADE", "gte", 1, 30))
                .build());

            assertThat(actual)
                .isNotEmpty()
                .isEqualTo(dataset.expected(u -> u.subscriptionPlan().equals("Premium")
                    && dataset.eventCountSince(u.userId(), "PURCHASE_MADE", start) >= 1));
        }

        @Test
        @DisplayName("Mobile users who added to cart but never purchased")
        void testCartAbandoners() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("device_type", "eq", "Mobile"))
                .eventFilter(EventFilter.of("ADDED_TO_CART", "gte", 1))
                .eventFilter(EventFilter.of("PURCHASE_MADE", "eq", 0))
                .build());

            assertThat(actual)
                .isNotEmpty()
                .isEqualTo(dataset.expected(u -> u.deviceType().equals("Mobile")
                    && dataset.eventCount(u.userId(), "ADDED_TO_CART") >= 1
                    && dataset.eventCount(u.userId(), "PURCHASE_MADE") == 0));
        }
    }

    @Nested
    @DisplayName("Zero counts")
    class ZeroCounts {

        @Test
        @DisplayName("Users without any events match count = 0")
        void testUsersWithoutEvents() {
            List<Long> actual = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("LOGIN", "eq", 0))
                .build());

            assertThat(actual).contains(9_001L, 9_500L, 10_000L);
            assertThat(actual).isEqualTo(dataset.expected(hasEvent("LOGIN", c -> c == 0)));
        }

        @Test
        @DisplayName("count < 1 equals count = 0")
        void testLessThanOne() {
            List<Long> lt = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("SEARCH", "lt", 1)).build());
            List<Long> eq = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("SEARCH", "eq", 0)).build());

            assertThat(lt).isEqualTo(eq);
        }

        @Test
        @DisplayName("count >= 0 selects everyone")
        void testAtLeastZero() {
            List<Long> actual = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("PASSWORD_CHANGE", "gte", 0)).build());

            assertThat(actual).hasSize(SegmentTestDataset.USER_COUNT);
        }

        @Test
        @DisplayName("Event never emitted by anyone counts as zero")
        void testUnknownEventName() {
            List<Long> none = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("NEVER_HAPPENED", "gte", 1)).build());
            List<Long> all = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("NEVER_HAPPENED", "eq", 0)).build());

            assertThat(none).isEmpty();
            assertThat(all).hasSize(SegmentTestDataset.USER_COUNT);
        }

        @Test
        @DisplayName("ne 0 means at least one event")
        void testNotEqualZero() {
            List<Long> actual = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("LOGOUT", "ne", 0)).build());

            assertThat(actual).isEqualTo(dataset.expected(hasEvent("LOGOUT", c -> c != 0)));
        }
    }

    @Nested
    @DisplayName("Time windows")
    class TimeWindows {

        @ParameterizedTest(name = "last {0} days")
        @ValueSource(ints = {1, 7, 30, 90, 400})
        @DisplayName("Windowed count only sees events since midnight N days ago")
        void testWindow(int days) {
            LocalDateTime start = LocalDate.of(2025, 7, 1).minusDays(days).atStartOfDay();
            List<Long> actual = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.within("VIEW_PRODUCT", "gte", 1, days)).build());

            assertThat(actual).isEqualTo(dataset.expected(
                u -> dataset.eventCountSince(u.userId(), "VIEW_PRODUCT", start) >= 1));
        }

        @ParameterizedTest(name = "last {0} days")
        @ValueSource(ints = {4_000_000, Integer.MAX_VALUE})
        @DisplayName("Window reaching before year 1 matches the all-time count")
        void testUnboundedWindow(int days) {
            List<Long> actual = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.within("LOGIN", "gte", 1, days)).build());

            assertThat(actual).isEqualTo(dataset.expected(hasEvent("LOGIN", c -> c >= 1)));
        }

        @Test
        @DisplayName("Widening the window never loses matches for gte")
        void testMonotone() {
            List<Long> narrow = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.within("EMAIL_OPENED", "gte", 1, 14)).build());
            List<Long> wide = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.within("EMAIL_OPENED", "gte", 1, 60)).build());

            assertThat(wide).containsAll(narrow);
        }
    }

    @Nested
    @DisplayName("Combination laws")
    class CombinationLaws {

        @Test
        @DisplayName("AND result is a subset of OR result")
        void testAndSubsetOfOr() {
            SegmentationRequest.Builder builder = SegmentationRequest.builder()
                .userFilter(UserFilter.of("gender", "eq", "Female"))
                .eventFilter(EventFilter.of("PURCHASE_MADE", "gte", 2));

            List<Long> and = run(builder.logicOperator("AND").build());
            List<Long> or = run(builder.logicOperator("OR").build());

            assertThat(or).containsAll(and);
            assertThat(or).isEqualTo(dataset.expected(u -> u.gender().equals("Female")
                || dataset.eventCount(u.userId(), "PURCHASE_MADE") >= 2));
        }

        @Test
        @DisplayName("Single group gives the same users under AND and OR")
        void testSingleGroup() {
            SegmentationRequest.Builder builder = SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("location", "in", "Texas", "Ohio"));

            assertThat(run(builder.logicOperator("OR").build()))
                .isEqualTo(run(builder.logicOperator("AND").build()))
                .isEqualTo(dataset.expected(u -> Set.of("Texas", "Ohio").contains(u.location())));
        }

        @Test
        @DisplayName("Repeated runs return identical results")
        void testIdempotent() {
            SegmentationRequest request = SegmentationRequest.builder()
                .userFilter(UserFilter.of("device_type", "ne", "Desktop"))
                .eventFilter(EventFilter.of("SEARCH", "gt", 1))
                .limit(300)
                .build();

            assertThat(run(request)).isEqualTo(run(request));
        }
    }

    @Nested
    @DisplayName("Operators and limits")
    class OperatorsAndLimits {

        @Test
        @DisplayName("NOT IN excludes listed values")
        void testNotIn() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("subscription_plan", "not_in", "Free", "Basic")).build());

            assertThat(actual).isEqualTo(dataset.expected(
                u -> !Set.of("Free", "Basic").contains(u.subscriptionPlan())));
        }

        @Test
        @DisplayName("LIKE without wildcards matches substrings")
        void testLikeSubstring() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("location", "like", "Carolina")).build());

            assertThat(actual).isEqualTo(dataset.expected(u -> u.location().contains("Carolina")));
        }

        @Test
        @DisplayName("LIKE with wildcards is a pattern")
        void testLikePattern() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("name", "like", "User 99_")).build());

            assertThat(actual).containsExactly(990L, 991L, 992L, 993L, 994L, 995L, 996L, 997L, 998L, 999L);
        }

        @Test
        @DisplayName("Fractional bounds on age compare numerically")
        void testFractionalAge() {
            List<Long> below = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "lt", new BigDecimal("30.12345678901234567890123456789012345678901")))
                .build());
            assertThat(below).isEqualTo(dataset.expected(u -> u.age() <= 30));

            List<Long> above = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "gte", new BigDecimal("64.5")))
                .build());
            assertThat(above).isEqualTo(dataset.expected(u -> u.age() >= 65));

            assertThat(run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "eq", new BigDecimal("30.5")))
                .build())).isEmpty();
            assertThat(run(SegmentationRequest.builder()
                .userFilter(UserFilter.ofList("age", "not_in", new BigDecimal("30.5"), 30))
                .build())).isEqualTo(dataset.expected(u -> u.age() != 30));
        }

        @Test
        @DisplayName("Date comparisons use calendar order")
        void testDateComparison() {
            List<Long> actual = run(SegmentationRequest.builder()
                .userFilter(UserFilter.of("signup_date", "lt", "2024-02-01")).build());

            assertThat(actual).isEqualTo(dataset.expected(
                u -> u.signupDate().isBefore(LocalDate.of(2024, 2, 1))));
        }

        @Test
        @DisplayName("Limit returns the lowest identities of the full result")
        void testLimitPrefix() {
            SegmentationRequest.Builder builder = SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "gt", 40));

            List<Long> full = run(builder.build());
            List<Long> limited = run(builder.limit(25).build());

            assertThat(limited).hasSize(25).isEqualTo(full.subList(0, 25));
        }

        @Test
        @DisplayName("Results are ascending and free of duplicates")
        void testOrderedDistinct() {
            List<Long> actual = run(SegmentationRequest.builder()
                .eventFilter(EventFilter.of("LOGIN", "gte", 1))
                .eventFilter(EventFilter.of("LOGOUT", "gte", 1))
                .logicOperator("OR")
                .build());

            assertThat(actual).isSorted().doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Response echoes the normalized request and projection")
        void testResponse() {
            SegmentationResponse response = service.segment(SegmentationRequest.builder()
                .userFilter(UserFilter.of("age", "eq", 30))
                .attributes("name", "location")
                .limit(5)
                .build());

            assertThat(response.totalCount()).isEqualTo(response.userIds().size()).isLessThanOrEqualTo(5);
            assertThat(response.filtersApplied().limit()).isEqualTo(5);
            assertThat(response.hasProjection()).isTrue();
            for (int i = 0; i < response.userIds().size(); i++) {
                User user = dataset.users().get((int) (response.userIds().get(i) - 1));
                assertThat(response.rows().get(i))
                    .containsEntry("name", user.name())
                    .containsEntry("location", user.location());
            }
        }
    }

    @Test
    @TestCategories.Concurrency
    @DisplayName("Concurrent requests do not interfere")
    void testConcurrentRequests() throws Exception {
        List<String> locations = List.of("Texas", "Ohio", "Georgia", "Michigan", "Florida", "Illinois");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                String location = locations.get(i % locations.size());
                futures.add(executor.submit(() -> run(SegmentationRequest.builder()
                    .userFilter(UserFilter.of("location", "eq", location))
                    .eventFilter(EventFilter.of("LOGIN", "gte", 1))
                    .build())));
            }
            for (int i = 0; i < futures.size(); i++) {
                String location = locations.get(i % locations.size());
                assertThat(futures.get(i).get(30, TimeUnit.SECONDS)).isEqualTo(dataset.expected(
                    hasEvent("LOGIN", c -> c >= 1).and(u -> u.location().equals(location))));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
