package com.pricecache.service.cache;

import com.pricecache.core.model.Bar;
import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.core.model.DateRange;
import com.pricecache.service.data.AuthorizationDeniedException;
import com.pricecache.service.data.BarFetcher;
import com.pricecache.service.data.sqlite.SqliteBarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Serves daily bars from the local store, fetching only what is missing.
 *
 * A request is reconciled against cached coverage; each missing range is
 * fetched and stored, then the full requested span is read back from the
 * store. When the provider refuses a narrow slice, the whole requested span
 * is tried once instead; if that also fails the caller gets whatever is
 * cached, with no indication that it is incomplete. Any other upstream
 * failure propagates.
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final BarFetcher fetcher;
    private final SqliteBarStore store;
    private final RangeReconciler reconciler;
    private final RefreshPolicy policy;
    private final String apiKey;
    private final long rateLimitDelayMs;
    private final Clock clock;

    // Rate limiting state
    private volatile long lastRequestTime = 0;
    private final Object rateLimitLock = new Object();

    public CacheManager(BarFetcher fetcher, SqliteBarStore store, RangeReconciler reconciler, RefreshPolicy policy,
                        String apiKey, Duration rateLimitDelay, Clock clock) {
        this.fetcher = fetcher;
        this.store = store;
        this.reconciler = reconciler;
        this.policy = policy;
        this.apiKey = apiKey;
        this.rateLimitDelayMs = rateLimitDelay.toMillis();
        this.clock = clock;
    }

    public List<Bar> getBars(String symbol, LocalDate start, LocalDate end) throws IOException {
        return getBars(symbol, start, end, false);
    }

    /**
     * Bars for [start, end] inclusive, ordered by date.
     *
     * @param forceRefresh drop cached bars in the span before reconciling
     */
    public List<Bar> getBars(String symbol, LocalDate start, LocalDate end, boolean forceRefresh)
            throws IOException {
        String key = SqliteBarStore.normalize(symbol);
        DateRange requested = DateRange.of(start, end);

        if (forceRefresh) {
            store.invalidate(key, start, end);
        }

        List<DateRange> missing = reconciler.missingRanges(key, start, end);
        if (missing.isEmpty()) {
            log.debug("Cache hit for {}: {}", key, requested);
        } else {
            log.info("Cache miss for {}: fetching {} range(s)", key, missing.size());
            fetchRanges(key, missing, requested);
        }

        return store.read(key, start, end);
    }

    /**
     * Re-fetch the window a refresh strategy calls for, overwriting revised
     * values, then serve the span. Partial windows go through getBars so
     * uncached edges are reconciled too.
     */
    public List<Bar> refresh(String symbol, LocalDate start, LocalDate end, RefreshStrategy strategy)
            throws IOException {
        String key = SqliteBarStore.normalize(symbol);
        DateRange requested = DateRange.of(start, end);
        LocalDate cachedLast = store.status(key).map(CoverageMetadata::lastDate).orElse(null);

        Optional<DateRange> window = policy.refreshRange(strategy, start, end, cachedLast);
        if (window.isPresent()) {
            log.info("{} refresh for {}: {}", strategy, key, window.get());
            boolean complete = fetchRanges(key, List.of(window.get()), requested);
            if (complete && strategy == RefreshStrategy.FULL_REFRESH) {
                store.markFullRefresh(key, clock.instant());
                // The window was the whole span; edges that came back empty are non-trading days
                return store.read(key, start, end);
            }
        } else {
            log.debug("{} refresh for {}: nothing to fetch", strategy, key);
        }

        return getBars(key, start, end);
    }

    public Optional<CoverageMetadata> getCacheStatus(String symbol) throws IOException {
        return store.status(symbol);
    }

    public int invalidateTicker(String symbol) throws IOException {
        return store.invalidate(symbol);
    }

    public RefreshPolicy getPolicy() {
        return policy;
    }

    public SqliteBarStore getStore() {
        return store;
    }

    /**
     * Fetch and store each range in order.
     *
     * @return false when an authorization failure left part of the span unfetched
     */
    private boolean fetchRanges(String symbol, List<DateRange> ranges, DateRange requested) throws IOException {
        boolean fallbackTried = false;
        boolean complete = true;

        for (DateRange range : ranges) {
            try {
                fetchAndStore(symbol, range);
            } catch (AuthorizationDeniedException e) {
                if (fallbackTried) {
                    log.warn("Fetch of {} {} refused again, serving cached data: {}", symbol, range, e.getMessage());
                    complete = false;
                    continue;
                }
                fallbackTried = true;
                log.warn("Partial fetch refused for {} {}, trying full range {}: {}",
                    symbol, range, requested, e.getMessage());
                try {
                    fetchAndStore(symbol, requested);
                    // The full span covers every remaining range
                    break;
                } catch (InterruptedIOException ie) {
                    throw ie;
                } catch (IOException retryError) {
                    log.error("Full range fetch also failed for {}: {}", symbol, retryError.getMessage());
                    complete = false;
                }
            }
        }
        return complete;
    }

    private int fetchAndStore(String symbol, DateRange range) throws IOException {
        waitForRateLimit();

        List<Bar> bars = fetcher.fetch(symbol, range.start(), range.end(), apiKey);
        if (bars.isEmpty()) {
            log.warn("No data returned for {} ({})", symbol, range);
            return 0;
        }

        return store.store(symbol, bars);
    }

    /**
     * Keep at least the configured delay between consecutive upstream calls.
     */
    private void waitForRateLimit() throws InterruptedIOException {
        if (rateLimitDelayMs <= 0) {
            return;
        }
        synchronized (rateLimitLock) {
            long sinceLast = System.currentTimeMillis() - lastRequestTime;
            if (sinceLast < rateLimitDelayMs) {
                long waitTime = rateLimitDelayMs - sinceLast;
                log.debug("Rate limiting: waiting {}ms", waitTime);
                try {
                    Thread.sleep(waitTime);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while rate limiting");
                }
            }
            lastRequestTime = System.currentTimeMillis();
        }
    }
}
