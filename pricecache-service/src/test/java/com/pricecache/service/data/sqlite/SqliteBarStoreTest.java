package com.pricecache.service.data.sqlite;

import com.pricecache.core.model.Bar;
import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.service.testing.FakeBarFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SqliteBarStoreTest {

    private static final Instant NOW = Instant.parse("2024-07-01T00:00:00Z");
    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_31 = LocalDate.of(2024, 1, 31);

    @TempDir
    Path tempDir;

    private SqliteConnection conn;
    private SqliteBarStore store;

    @BeforeEach
    void setUp() throws Exception {
        conn = new SqliteConnection(tempDir.resolve("cache.db"));
        store = new SqliteBarStore(conn, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        conn.close();
    }

    @Nested
    @DisplayName("Storing bars")
    class StoreTests {

        @Test
        @DisplayName("Stored bars update coverage metadata")
        void storeUpdatesMetadata() throws Exception {
            // Given / When
            int written = store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));

            // Then
            assertEquals(31, written);
            CoverageMetadata meta = store.status("AAPL").orElseThrow();
            assertEquals(JAN_1, meta.firstDate());
            assertEquals(JAN_31, meta.lastDate());
            assertEquals(31, meta.totalBars());
            assertEquals(NOW, meta.lastUpdated());
            assertNull(meta.lastFullRefresh());
        }

        @Test
        @DisplayName("Storing the same dates twice replaces instead of duplicating")
        void storeIsIdempotent() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));
            Bar revised = new Bar("AAPL", JAN_1, 1, 2, 0.5, 1.5, 42);

            store.store("AAPL", List.of(revised));

            assertEquals(31, store.status("AAPL").orElseThrow().totalBars());
            Bar stored = store.read("AAPL", JAN_1, JAN_1).get(0);
            assertEquals(1.5, stored.close(), 1e-9);
            assertEquals(42, stored.volume(), 1e-9);
        }

        @Test
        @DisplayName("Symbols are keyed case-insensitively")
        void symbolNormalized() throws Exception {
            store.store(" aapl ", FakeBarFetcher.barsFor("aapl", JAN_1, JAN_1.plusDays(4)));

            assertEquals(5, store.read("AAPL", JAN_1, JAN_31).size());
            assertEquals("AAPL", store.read("aapl", JAN_1, JAN_31).get(0).symbol());
        }

        @Test
        @DisplayName("An empty batch writes nothing")
        void emptyBatch() throws Exception {
            assertEquals(0, store.store("AAPL", List.of()));
            assertTrue(store.status("AAPL").isEmpty());
        }

        @Test
        @DisplayName("Reads are ordered and inclusive")
        void readOrderedInclusive() throws Exception {
            store.store("MSFT", FakeBarFetcher.barsFor("MSFT", JAN_1, JAN_31));

            List<Bar> bars = store.read("MSFT", LocalDate.of(2024, 1, 10), LocalDate.of(2024, 1, 12));

            assertEquals(List.of(LocalDate.of(2024, 1, 10), LocalDate.of(2024, 1, 11), LocalDate.of(2024, 1, 12)),
                bars.stream().map(Bar::date).toList());
        }

        @Test
        @DisplayName("Data survives reopening the database")
        void persistsAcrossConnections() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));
            conn.close();

            SqliteConnection reopened = new SqliteConnection(tempDir.resolve("cache.db"));
            try {
                SqliteBarStore again = new SqliteBarStore(reopened);
                assertEquals(31, again.read("AAPL", JAN_1, JAN_31).size());
            } finally {
                reopened.close();
            }
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class InvalidateTests {

        @Test
        @DisplayName("Invalidating a symbol removes bars and status")
        void invalidateAll() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));

            assertEquals(31, store.invalidate("aapl"));

            assertTrue(store.status("AAPL").isEmpty());
            assertTrue(store.read("AAPL", JAN_1, JAN_31).isEmpty());
        }

        @Test
        @DisplayName("Invalidating an unknown symbol removes nothing")
        void invalidateUnknown() throws Exception {
            assertEquals(0, store.invalidate("NOPE"));
        }

        @Test
        @DisplayName("Ranged invalidation recomputes the span")
        void invalidateRange() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));

            int removed = store.invalidate("AAPL", JAN_1, LocalDate.of(2024, 1, 10));

            assertEquals(10, removed);
            CoverageMetadata meta = store.status("AAPL").orElseThrow();
            assertEquals(LocalDate.of(2024, 1, 11), meta.firstDate());
            assertEquals(21, meta.totalBars());
        }

        @Test
        @DisplayName("Ranged invalidation of every bar drops the status")
        void invalidateWholeRange() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));

            store.invalidate("AAPL", JAN_1, JAN_31);

            assertTrue(store.status("AAPL").isEmpty());
        }
    }

    @Nested
    @DisplayName("Universe flags and stats")
    class UniverseTests {

        @Test
        @DisplayName("Flagging an uncached symbol does not make it cached")
        void markUniverseWithoutBars() throws Exception {
            store.markUniverse(List.of("AAPL", "MSFT"));
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));

            assertTrue(store.status("MSFT").isEmpty());
            assertTrue(store.status("AAPL").orElseThrow().inUniverse());
            assertEquals(List.of("AAPL"), store.allCachedSymbols());
            assertEquals(1, store.universeMetadata().size());
        }

        @Test
        @DisplayName("Syncing flags clears members no longer listed")
        void syncUniverseFlags() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));
            store.store("IBM", FakeBarFetcher.barsFor("IBM", JAN_1, JAN_31));
            store.markUniverse(List.of("AAPL", "IBM"));

            store.syncUniverseFlags(List.of("IBM"));

            assertFalse(store.status("AAPL").orElseThrow().inUniverse());
            assertTrue(store.status("IBM").orElseThrow().inUniverse());
        }

        @Test
        @DisplayName("Stats count symbols, bars and cached universe members")
        void stats() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));
            store.store("IBM", FakeBarFetcher.barsFor("IBM", JAN_1, LocalDate.of(2024, 1, 9)));
            store.markUniverse(List.of("IBM", "XOM"));

            SqliteBarStore.StoreStats stats = store.stats();

            assertEquals(2, stats.totalSymbols());
            assertEquals(40, stats.totalBars());
            assertEquals(1, stats.universeCached());
            assertTrue(stats.databaseSizeMb() >= 0.0);
        }

        @Test
        @DisplayName("Full refresh timestamp is recorded")
        void markFullRefresh() throws Exception {
            store.store("AAPL", FakeBarFetcher.barsFor("AAPL", JAN_1, JAN_31));

            store.markFullRefresh("AAPL", NOW);

            Optional<CoverageMetadata> meta = store.status("AAPL");
            assertEquals(NOW, meta.orElseThrow().lastFullRefresh());
        }
    }
}
