package com.pricecache.service.data.sqlite;

import com.pricecache.core.model.Bar;
import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.service.data.sqlite.dao.BarDao;
import com.pricecache.service.data.sqlite.dao.SymbolMetadataDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store for daily bars and per-symbol coverage metadata.
 *
 * Every write recomputes the symbol's metadata from the bars table in the same
 * transaction, so total_bars always matches the stored row count. SQL failures
 * surface as IOException naming the operation.
 */
public class SqliteBarStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteBarStore.class);

    private final SqliteConnection conn;
    private final BarDao bars;
    private final SymbolMetadataDao metadata;
    private final Clock clock;

    public SqliteBarStore(SqliteConnection conn) throws IOException {
        this(conn, Clock.systemUTC());
    }

    public SqliteBarStore(SqliteConnection conn, Clock clock) throws IOException {
        this.conn = conn;
        this.clock = clock;
        this.bars = new BarDao(conn);
        this.metadata = new SymbolMetadataDao(conn);
        try {
            conn.runInTransaction(SqliteSchema::initialize);
        } catch (SQLException e) {
            throw new IOException("SQLite error initializing schema: " + e.getMessage(), e);
        }
    }

    public static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    // ========== Bars ==========

    /**
     * Upsert bars for a symbol and recompute its metadata.
     *
     * @return number of bars written
     */
    public int store(String symbol, List<Bar> newBars) throws IOException {
        if (newBars.isEmpty()) {
            return 0;
        }
        String key = normalize(symbol);
        List<Bar> keyed = new ArrayList<>(newBars.size());
        for (Bar bar : newBars) {
            keyed.add(key.equals(bar.symbol()) ? bar : bar.withSymbol(key));
        }

        try {
            int written = conn.executeInTransaction(c -> {
                int count = bars.insertBatch(keyed);
                metadata.recompute(key, clock.instant());
                return count;
            });
            log.info("Stored {} bars for {}", written, key);
            return written;
        } catch (SQLException e) {
            throw new IOException("SQLite error storing bars: " + e.getMessage(), e);
        }
    }

    /**
     * Bars for a symbol in [start, end] inclusive, ordered by date.
     */
    public List<Bar> read(String symbol, LocalDate start, LocalDate end) throws IOException {
        String key = normalize(symbol);
        try {
            return conn.execute(c -> bars.query(key, start, end));
        } catch (SQLException e) {
            throw new IOException("SQLite error reading bars: " + e.getMessage(), e);
        }
    }

    /**
     * Remove every bar for a symbol. The metadata row goes with it.
     */
    public int invalidate(String symbol) throws IOException {
        String key = normalize(symbol);
        try {
            int removed = conn.executeInTransaction(c -> {
                int count = bars.deleteAll(key);
                metadata.delete(key);
                return count;
            });
            log.info("Invalidated {} bars for {}", removed, key);
            return removed;
        } catch (SQLException e) {
            throw new IOException("SQLite error invalidating bars: " + e.getMessage(), e);
        }
    }

    /**
     * Remove bars for a symbol in [start, end] and recompute metadata.
     */
    public int invalidate(String symbol, LocalDate start, LocalDate end) throws IOException {
        String key = normalize(symbol);
        try {
            int removed = conn.executeInTransaction(c -> {
                int count = bars.deleteRange(key, start, end);
                if (count > 0) {
                    metadata.recompute(key, clock.instant());
                }
                return count;
            });
            log.info("Invalidated {} bars for {} in {}..{}", removed, key, start, end);
            return removed;
        } catch (SQLException e) {
            throw new IOException("SQLite error invalidating bars: " + e.getMessage(), e);
        }
    }

    // ========== Metadata ==========

    /**
     * Coverage for a symbol; empty when nothing is cached.
     */
    public Optional<CoverageMetadata> status(String symbol) throws IOException {
        String key = normalize(symbol);
        try {
            CoverageMetadata meta = conn.execute(c -> metadata.get(key));
            if (meta == null || !meta.hasBars()) {
                return Optional.empty();
            }
            return Optional.of(meta);
        } catch (SQLException e) {
            throw new IOException("SQLite error reading metadata: " + e.getMessage(), e);
        }
    }

    public void markFullRefresh(String symbol, Instant when) throws IOException {
        String key = normalize(symbol);
        try {
            conn.execute(c -> {
                metadata.setLastFullRefresh(key, when);
                return null;
            });
        } catch (SQLException e) {
            throw new IOException("SQLite error marking full refresh: " + e.getMessage(), e);
        }
    }

    /**
     * Flag symbols as universe members without touching other rows.
     */
    public int markUniverse(Collection<String> symbols) throws IOException {
        Set<String> keys = normalizeAll(symbols);
        try {
            return conn.executeInTransaction(c -> metadata.markUniverse(keys));
        } catch (SQLException e) {
            throw new IOException("SQLite error marking universe: " + e.getMessage(), e);
        }
    }

    /**
     * Make the universe flag match exactly the given symbols.
     */
    public int syncUniverseFlags(Collection<String> symbols) throws IOException {
        Set<String> keys = normalizeAll(symbols);
        try {
            int flagged = conn.executeInTransaction(c -> {
                metadata.clearUniverse();
                return metadata.markUniverse(keys);
            });
            log.info("Synced universe flags for {} symbols", flagged);
            return flagged;
        } catch (SQLException e) {
            throw new IOException("SQLite error syncing universe flags: " + e.getMessage(), e);
        }
    }

    public List<String> allCachedSymbols() throws IOException {
        try {
            return conn.execute(c -> metadata.cachedSymbols());
        } catch (SQLException e) {
            throw new IOException("SQLite error listing cached symbols: " + e.getMessage(), e);
        }
    }

    /**
     * Metadata of universe members that hold bars.
     */
    public List<CoverageMetadata> universeMetadata() throws IOException {
        try {
            return conn.execute(c -> metadata.universeWithBars());
        } catch (SQLException e) {
            throw new IOException("SQLite error reading universe metadata: " + e.getMessage(), e);
        }
    }

    public List<String> staleUniverseSymbols(Instant cutoff) throws IOException {
        try {
            return conn.execute(c -> metadata.staleUniverseSymbols(cutoff));
        } catch (SQLException e) {
            throw new IOException("SQLite error listing stale symbols: " + e.getMessage(), e);
        }
    }

    public List<String> symbolsNeedingRefresh(Instant fullCutoff, Instant rollingCutoff, int limit)
            throws IOException {
        try {
            return conn.execute(c -> metadata.symbolsNeedingRefresh(fullCutoff, rollingCutoff, limit));
        } catch (SQLException e) {
            throw new IOException("SQLite error listing refresh candidates: " + e.getMessage(), e);
        }
    }

    // ========== Stats ==========

    public StoreStats stats() throws IOException {
        try {
            long[] totals = conn.execute(c -> bars.totals());
            long universeCached = conn.execute(c -> metadata.countUniverseWithBars());
            return new StoreStats(totals[1], totals[0], universeCached, databaseSizeMb());
        } catch (SQLException e) {
            throw new IOException("SQLite error reading stats: " + e.getMessage(), e);
        }
    }

    private double databaseSizeMb() {
        File dbFile = conn.getDbFile();
        if (!dbFile.exists()) {
            return 0.0;
        }
        return Math.round(dbFile.length() / (1024.0 * 1024.0) * 100.0) / 100.0;
    }

    private static Set<String> normalizeAll(Collection<String> symbols) {
        Set<String> keys = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol != null && !symbol.isBlank()) {
                keys.add(normalize(symbol));
            }
        }
        return keys;
    }

    public record StoreStats(long totalSymbols, long totalBars, long universeCached, double databaseSizeMb) {}
}
