package com.pricecache.service.cache;

import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.core.model.DateRange;
import com.pricecache.service.config.CacheServiceConfig.RefreshSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RefreshPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-28T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 28);

    private final RefreshPolicy policy =
        new RefreshPolicy(RefreshSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static CoverageMetadata meta(Instant lastUpdated, Instant lastFullRefresh) {
        return new CoverageMetadata("MSFT", LocalDate.of(2020, 1, 2), LocalDate.of(2024, 6, 27),
            lastUpdated, lastFullRefresh, 1000, true, CoverageMetadata.STATUS_ACTIVE);
    }

    private static Instant daysAgo(double days) {
        return NOW.minus(Duration.ofMinutes((long) (days * 24 * 60)));
    }

    @Nested
    @DisplayName("decideStrategy")
    class DecideStrategyTests {

        @Test
        @DisplayName("Uncached symbol gets a full refresh")
        void uncached() {
            assertEquals(RefreshStrategy.FULL_REFRESH, policy.decideStrategy(null, false));
        }

        @Test
        @DisplayName("Forcing always wins")
        void forced() {
            assertEquals(RefreshStrategy.FULL_REFRESH, policy.decideStrategy(meta(NOW, NOW), true));
        }

        @Test
        @DisplayName("Never fully refreshed means full refresh")
        void neverFull() {
            assertEquals(RefreshStrategy.FULL_REFRESH, policy.decideStrategy(meta(NOW, null), false));
        }

        @Test
        @DisplayName("Full refresh is due after the full interval")
        void fullIntervalElapsed() {
            assertEquals(RefreshStrategy.FULL_REFRESH, policy.decideStrategy(meta(NOW, daysAgo(30)), false));
        }

        @Test
        @DisplayName("Partial days round down")
        void partialDaysRoundDown() {
            // 29.9 days since the full refresh is still 29 whole days
            assertEquals(RefreshStrategy.APPEND_ONLY,
                policy.decideStrategy(meta(daysAgo(1), daysAgo(29.9)), false));
        }

        @Test
        @DisplayName("Rolling window is due after the rolling interval")
        void rollingDue() {
            assertEquals(RefreshStrategy.ROLLING_WINDOW,
                policy.decideStrategy(meta(daysAgo(7), daysAgo(10)), false));
        }

        @Test
        @DisplayName("Recently updated symbols only append")
        void appendOnly() {
            assertEquals(RefreshStrategy.APPEND_ONLY,
                policy.decideStrategy(meta(daysAgo(1), daysAgo(10)), false));
        }
    }

    @Nested
    @DisplayName("refreshRange")
    class RefreshRangeTests {

        @Test
        @DisplayName("Full refresh fetches the whole request")
        void fullRange() {
            Optional<DateRange> range = policy.refreshRange(RefreshStrategy.FULL_REFRESH,
                LocalDate.of(2020, 1, 1), TODAY, TODAY);

            assertEquals(Optional.of(DateRange.of(LocalDate.of(2020, 1, 1), TODAY)), range);
        }

        @Test
        @DisplayName("Rolling window starts the configured number of days back")
        void rollingRange() {
            Optional<DateRange> range = policy.refreshRange(RefreshStrategy.ROLLING_WINDOW,
                LocalDate.of(2020, 1, 1), TODAY, TODAY);

            assertEquals(Optional.of(DateRange.of(LocalDate.of(2024, 3, 30), TODAY)), range);
        }

        @Test
        @DisplayName("Rolling window after the request end has nothing to fetch")
        void rollingPastRequest() {
            assertTrue(policy.refreshRange(RefreshStrategy.ROLLING_WINDOW,
                LocalDate.of(2020, 1, 1), LocalDate.of(2023, 12, 31), TODAY).isEmpty());
        }

        @Test
        @DisplayName("Append re-fetches the recent days even when cached")
        void appendRecentDays() {
            Optional<DateRange> range = policy.refreshRange(RefreshStrategy.APPEND_ONLY,
                LocalDate.of(2020, 1, 1), TODAY, LocalDate.of(2024, 6, 27));

            assertEquals(Optional.of(DateRange.of(LocalDate.of(2024, 6, 26), TODAY)), range);
        }

        @Test
        @DisplayName("Append starts the day after the cached end when that is earlier")
        void appendAfterCached() {
            Optional<DateRange> range = policy.refreshRange(RefreshStrategy.APPEND_ONLY,
                LocalDate.of(2020, 1, 1), TODAY, LocalDate.of(2024, 6, 20));

            assertEquals(Optional.of(DateRange.of(LocalDate.of(2024, 6, 21), TODAY)), range);
        }

        @Test
        @DisplayName("Append with nothing cached fetches the whole request")
        void appendUncached() {
            Optional<DateRange> range = policy.refreshRange(RefreshStrategy.APPEND_ONLY,
                LocalDate.of(2024, 1, 1), TODAY, null);

            assertEquals(Optional.of(DateRange.of(LocalDate.of(2024, 1, 1), TODAY)), range);
        }
    }

    @Nested
    @DisplayName("shouldRefreshDate and adjustments")
    class DateTests {

        @Test
        @DisplayName("The last few days are always refreshed")
        void recentDays() {
            assertTrue(policy.shouldRefreshDate(TODAY.minusDays(1), NOW));
        }

        @Test
        @DisplayName("Dates in the rolling window refresh once the interval passed")
        void rollingWindowDates() {
            assertTrue(policy.shouldRefreshDate(TODAY.minusDays(30), daysAgo(8)));
            assertFalse(policy.shouldRefreshDate(TODAY.minusDays(30), daysAgo(1)));
            assertTrue(policy.shouldRefreshDate(TODAY.minusDays(30), null));
        }

        @Test
        @DisplayName("Old dates are not refreshed")
        void oldDates() {
            assertFalse(policy.shouldRefreshDate(TODAY.minusDays(200), null));
        }

        @Test
        @DisplayName("A close moving more than one percent suggests an adjustment")
        void adjustmentDetection() {
            assertFalse(RefreshPolicy.detectAdjustmentNeeded(100.0, 100.5));
            assertTrue(RefreshPolicy.detectAdjustmentNeeded(100.0, 102.0));
            assertTrue(RefreshPolicy.detectAdjustmentNeeded(0.0, 50.0));
            assertFalse(RefreshPolicy.detectAdjustmentNeeded(100.0, 102.0, 0.05));
        }
    }
}
