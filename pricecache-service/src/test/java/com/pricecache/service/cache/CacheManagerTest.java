package com.pricecache.service.cache;

import com.pricecache.core.model.Bar;
import com.pricecache.core.model.DateRange;
import com.pricecache.service.config.CacheServiceConfig.RefreshSettings;
import com.pricecache.service.data.AuthorizationDeniedException;
import com.pricecache.service.data.RateLimitedException;
import com.pricecache.service.data.UpstreamException;
import com.pricecache.service.data.sqlite.SqliteBarStore;
import com.pricecache.service.data.sqlite.SqliteConnection;
import com.pricecache.service.testing.FakeBarFetcher;
import com.pricecache.service.testing.FakeBarFetcher.Call;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheManagerTest {

    private static final Instant NOW = Instant.parse("2024-09-02T12:00:00Z");
    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JUN_30 = LocalDate.of(2024, 6, 30);
    private static final LocalDate DEC_1_2023 = LocalDate.of(2023, 12, 1);
    private static final LocalDate AUG_31 = LocalDate.of(2024, 8, 31);

    @TempDir
    Path tempDir;

    private SqliteConnection conn;
    private SqliteBarStore store;
    private FakeBarFetcher fetcher;
    private CacheManager cacheManager;

    @BeforeEach
    void setUp() throws Exception {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        conn = new SqliteConnection(tempDir.resolve("cache.db"));
        store = new SqliteBarStore(conn, clock);
        fetcher = new FakeBarFetcher();
        cacheManager = new CacheManager(fetcher, store, new RangeReconciler(store),
            new RefreshPolicy(RefreshSettings.defaults(), clock), "test-key", Duration.ZERO, clock);
    }

    @AfterEach
    void tearDown() {
        conn.close();
    }

    private void cacheFirstHalfOf2024() throws Exception {
        store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JUN_30));
    }

    @Nested
    @DisplayName("getBars")
    class GetBarsTests {

        @Test
        @DisplayName("A miss fetches once and a repeat is served from the store")
        void missThenHit() throws Exception {
            // When
            List<Bar> first = cacheManager.getBars("AAPL", JAN_1, LocalDate.of(2024, 1, 31));
            List<Bar> second = cacheManager.getBars("aapl", JAN_1, LocalDate.of(2024, 1, 31));

            // Then
            assertEquals(31, first.size());
            assertEquals(first, second);
            assertEquals(1, fetcher.calls().size());
        }

        @Test
        @DisplayName("Only the uncached edges are fetched")
        void fetchesOnlyMissingEdges() throws Exception {
            // Given Jan-Jun 2024 cached
            cacheFirstHalfOf2024();

            // When asking Dec 2023 to Aug 2024
            List<Bar> bars = cacheManager.getBars("AAPL", DEC_1_2023, AUG_31);

            // Then two fetches cover the prefix and suffix
            assertEquals(List.of(
                new Call("AAPL", DEC_1_2023, LocalDate.of(2023, 12, 31)),
                new Call("AAPL", LocalDate.of(2024, 7, 1), AUG_31)
            ), fetcher.calls());
            assertEquals(DEC_1_2023, bars.get(0).date());
            assertEquals(AUG_31, bars.get(bars.size() - 1).date());
            assertEquals(275, bars.size());
        }

        @Test
        @DisplayName("Force refresh re-fetches a span at the cached edge")
        void forceRefreshAtEdge() throws Exception {
            cacheFirstHalfOf2024();

            List<Bar> bars = cacheManager.getBars("AAPL", LocalDate.of(2024, 6, 1), JUN_30, true);

            assertEquals(List.of(new Call("AAPL", LocalDate.of(2024, 6, 1), JUN_30)), fetcher.calls());
            assertEquals(30, bars.size());
        }

        @Test
        @DisplayName("Force refresh inside the cached span leaves a hole that is not backfilled")
        void forceRefreshInteriorGap() throws Exception {
            // Given Jan-Jun cached
            cacheFirstHalfOf2024();

            // When forcing March, bars go but the span still reads Jan-Jun
            List<Bar> bars = cacheManager.getBars("AAPL", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), true);

            // Then nothing is fetched and March comes back empty
            assertTrue(fetcher.calls().isEmpty());
            assertTrue(bars.isEmpty());
            assertEquals(151, store.status("AAPL").orElseThrow().totalBars());
        }

        @Test
        @DisplayName("Upstream errors other than authorization propagate")
        void upstreamErrorPropagates() {
            fetcher.failWhen(call -> new UpstreamException("API error: 500", 500));

            assertThrows(UpstreamException.class, () -> cacheManager.getBars("AAPL", JAN_1, JUN_30));
        }

        @Test
        @DisplayName("Rate limiting propagates to the caller")
        void rateLimitPropagates() {
            fetcher.failWhen(call -> new RateLimitedException("slow down", 1000));

            RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> cacheManager.getBars("AAPL", JAN_1, JUN_30));
            assertEquals(1000, e.getRetryAfterMs());
        }
    }

    @Nested
    @DisplayName("Authorization fallback")
    class AuthorizationFallbackTests {

        @Test
        @DisplayName("A refused slice is retried once as the full requested range")
        void fullRangeRetry() throws Exception {
            // Given Jan-Jun cached and an upstream that only accepts the full span
            cacheFirstHalfOf2024();
            DateRange full = DateRange.of(DEC_1_2023, AUG_31);
            fetcher.failWhen(call -> call.start().equals(full.start()) && call.end().equals(full.end())
                ? null : new AuthorizationDeniedException("NOT_AUTHORIZED", 403));

            // When
            List<Bar> bars = cacheManager.getBars("AAPL", DEC_1_2023, AUG_31);

            // Then the suffix is covered by the full fetch, not requested separately
            assertEquals(List.of(
                new Call("AAPL", DEC_1_2023, LocalDate.of(2023, 12, 31)),
                new Call("AAPL", DEC_1_2023, AUG_31)
            ), fetcher.calls());
            assertEquals(275, bars.size());
        }

        @Test
        @DisplayName("When the retry also fails the cached bars are served")
        void servesCachedWhenRetryFails() throws Exception {
            cacheFirstHalfOf2024();
            fetcher.failWhen(call -> new AuthorizationDeniedException("Forbidden", 403));

            List<Bar> bars = cacheManager.getBars("AAPL", DEC_1_2023, AUG_31);

            assertEquals(182, bars.size());
            assertEquals(JAN_1, bars.get(0).date());
            // Prefix, full-range retry, then the suffix once more
            assertEquals(3, fetcher.calls().size());
        }
    }

    @Nested
    @DisplayName("refresh")
    class RefreshTests {

        @Test
        @DisplayName("Full refresh re-fetches everything and records the time")
        void fullRefresh() throws Exception {
            cacheFirstHalfOf2024();

            List<Bar> bars = cacheManager.refresh("AAPL", JAN_1, JUN_30, RefreshStrategy.FULL_REFRESH);

            assertEquals(182, bars.size());
            assertEquals(List.of(new Call("AAPL", JAN_1, JUN_30)), fetcher.calls());
            assertEquals(NOW, store.status("AAPL").orElseThrow().lastFullRefresh());
        }

        @Test
        @DisplayName("Append-only refresh fetches from the day after the cached end")
        void appendRefresh() throws Exception {
            cacheFirstHalfOf2024();

            cacheManager.refresh("AAPL", JAN_1, AUG_31, RefreshStrategy.APPEND_ONLY);

            assertEquals(List.of(new Call("AAPL", LocalDate.of(2024, 7, 1), AUG_31)), fetcher.calls());
            assertEquals(AUG_31, store.status("AAPL").orElseThrow().lastDate());
            assertNull(store.status("AAPL").orElseThrow().lastFullRefresh());
        }

        @Test
        @DisplayName("Symbols never fully refreshed are refresh candidates until they are")
        void refreshCandidates() throws Exception {
            cacheFirstHalfOf2024();
            store.store("MSFT", FakeBarFetcher.barsFor("MSFT", JAN_1, JUN_30));
            cacheManager.refresh("MSFT", JAN_1, JUN_30, RefreshStrategy.FULL_REFRESH);

            assertEquals(List.of("AAPL"),
                cacheManager.getPolicy().symbolsNeedingRefresh(store, RefreshPolicy.DEFAULT_REFRESH_LIMIT));
        }

        @Test
        @DisplayName("Invalidating a ticker clears its status")
        void invalidateTicker() throws Exception {
            cacheFirstHalfOf2024();

            assertEquals(182, cacheManager.invalidateTicker("AAPL"));
            assertTrue(cacheManager.getCacheStatus("AAPL").isEmpty());
        }
    }
}
