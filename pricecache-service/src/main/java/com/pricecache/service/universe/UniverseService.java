package com.pricecache.service.universe;

import com.pricecache.service.data.sqlite.SqliteConnection;
import com.pricecache.service.data.sqlite.dao.ConstituentDao;
import com.pricecache.service.data.sqlite.dao.ConstituentDao.ListMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains the cached universe constituent list.
 *
 * The list is refreshed from a {@link ConstituentSource} at most every few
 * days. Readers fall back to the cached list, then to a bundled static list.
 */
public class UniverseService {

    private static final Logger log = LoggerFactory.getLogger(UniverseService.class);

    static final String FALLBACK_RESOURCE = "/universe-fallback.txt";

    private final SqliteConnection conn;
    private final ConstituentDao dao;
    private final ConstituentSource source;
    private final int refreshDays;
    private final Clock clock;

    public UniverseService(SqliteConnection conn, ConstituentSource source, int refreshDays, Clock clock) {
        this.conn = conn;
        this.dao = new ConstituentDao(conn);
        this.source = source;
        this.refreshDays = refreshDays;
        this.clock = clock;
    }

    /**
     * Pull a fresh list unless the cached one is younger than the refresh interval.
     * An empty or failed fetch keeps the existing list.
     */
    public RefreshResult refreshConstituents(boolean force) throws IOException {
        ListMetadata metadata = listMetadata();

        if (!force && metadata != null && metadata.lastRefreshed() != null) {
            long ageDays = Duration.between(metadata.lastRefreshed(), clock.instant()).toDays();
            if (ageDays < refreshDays) {
                log.info("Constituent list is fresh ({} days old), skipping refresh", ageDays);
                return RefreshResult.notNeeded(metadata.symbolCount(),
                    "List is " + ageDays + " days old, refresh not needed");
            }
        }

        List<Constituent> fetched = source.fetchConstituents();
        if (fetched.isEmpty()) {
            log.warn("{} returned no constituents, keeping existing list", source.getName());
            return RefreshResult.failed("No constituents returned by " + source.getName());
        }

        // Last occurrence of a duplicated symbol wins
        Map<String, Constituent> bySymbol = new LinkedHashMap<>();
        for (Constituent c : fetched) {
            bySymbol.put(c.symbol(), c);
        }
        List<Constituent> constituents = new ArrayList<>(bySymbol.values());

        Set<String> oldSymbols = new TreeSet<>(getCachedConstituents());
        Set<String> newSymbols = new TreeSet<>(bySymbol.keySet());
        List<String> added = new ArrayList<>(newSymbols);
        added.removeAll(oldSymbols);
        List<String> removed = new ArrayList<>(oldSymbols);
        removed.removeAll(newSymbols);

        try {
            dao.replaceAll(constituents, source.getName(), clock.instant());
        } catch (SQLException e) {
            throw new IOException("SQLite error replacing constituents: " + e.getMessage(), e);
        }

        if (!added.isEmpty()) {
            log.info("Universe additions: {}", added);
        }
        if (!removed.isEmpty()) {
            log.info("Universe removals: {}", removed);
        }
        return new RefreshResult(true, false, constituents.size(), added, removed, null);
    }

    /**
     * Current universe symbols: refresh if stale, then cached list, then bundled list.
     */
    public List<String> getConstituents() throws IOException {
        try {
            refreshConstituents(false);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to refresh constituent list: {}", e.getMessage());
        }

        List<String> cached = getCachedConstituents();
        if (!cached.isEmpty()) {
            return cached;
        }

        log.warn("No cached constituent list, using bundled fallback list");
        return fallbackConstituents();
    }

    public List<String> getCachedConstituents() throws IOException {
        try {
            return conn.execute(c -> dao.symbols());
        } catch (SQLException e) {
            throw new IOException("SQLite error reading constituents: " + e.getMessage(), e);
        }
    }

    public ListMetadata listMetadata() throws IOException {
        try {
            return conn.execute(c -> dao.getListMetadata());
        } catch (SQLException e) {
            throw new IOException("SQLite error reading constituent metadata: " + e.getMessage(), e);
        }
    }

    /**
     * The bundled static list, one symbol per line; '#' starts a comment.
     */
    public static List<String> fallbackConstituents() {
        InputStream in = UniverseService.class.getResourceAsStream(FALLBACK_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing bundled resource " + FALLBACK_RESOURCE);
        }
        List<String> symbols = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty() && !line.startsWith("#")) {
                    symbols.add(line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + FALLBACK_RESOURCE, e);
        }
        return symbols;
    }

    public record RefreshResult(
        boolean success,
        boolean skipped,
        int symbolCount,
        List<String> added,
        List<String> removed,
        String message
    ) {
        static RefreshResult notNeeded(int symbolCount, String message) {
            return new RefreshResult(true, true, symbolCount, List.of(), List.of(), message);
        }

        static RefreshResult failed(String message) {
            return new RefreshResult(false, false, 0, List.of(), List.of(), message);
        }
    }
}
