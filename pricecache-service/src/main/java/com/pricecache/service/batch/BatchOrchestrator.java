package com.pricecache.service.batch;

import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.service.cache.CacheManager;
import com.pricecache.service.cache.RefreshPolicy;
import com.pricecache.service.cache.RefreshStrategy;
import com.pricecache.service.data.RateLimitedException;
import com.pricecache.service.data.sqlite.SqliteBarStore;
import com.pricecache.service.universe.UniverseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Populates the cache for a whole symbol universe, one symbol at a time.
 *
 * Each symbol gets the refresh strategy its coverage calls for. A failing
 * symbol is recorded and skipped; a rate-limited one is retried once after a
 * fixed backoff. Nothing short of an error before the loop aborts a run.
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private static final int LOG_EVERY = 50;
    private static final int MISSING_SAMPLE = 20;
    private static final int STALE_LOOKBACK_DAYS = 30;

    private final CacheManager cacheManager;
    private final SqliteBarStore store;
    private final UniverseService universe;
    private final Duration rateLimitBackoff;
    private final Clock clock;

    public BatchOrchestrator(CacheManager cacheManager, UniverseService universe, Duration rateLimitBackoff,
                             Clock clock) {
        this.cacheManager = cacheManager;
        this.store = cacheManager.getStore();
        this.universe = universe;
        this.rateLimitBackoff = rateLimitBackoff;
        this.clock = clock;
    }

    /**
     * Bring every symbol up to date over [start, end].
     *
     * @param forceFull re-fetch the whole span for every symbol
     * @throws IOException only when the run cannot begin
     */
    public BatchResult cacheAll(List<String> symbols, LocalDate start, LocalDate end, boolean forceFull,
                                BatchProgressListener listener) throws IOException {
        long startedAt = System.currentTimeMillis();
        store.markUniverse(symbols);

        RefreshPolicy policy = cacheManager.getPolicy();
        int total = symbols.size();
        int success = 0;
        List<String> failed = new ArrayList<>();

        for (int i = 0; i < total; i++) {
            String symbol = symbols.get(i);
            if (processSymbol(policy, symbol, start, end, forceFull)) {
                success++;
            } else {
                failed.add(symbol);
            }

            listener.onProgress(i + 1, failed.size(), total, symbol);

            if ((i + 1) % LOG_EVERY == 0) {
                log.info("Universe caching progress: {}/{}", i + 1, total);
            }
        }

        double duration = Math.round((System.currentTimeMillis() - startedAt) / 10.0) / 100.0;
        log.info("Universe caching finished: {} succeeded, {} failed in {}s", success, failed.size(), duration);
        return new BatchResult(total, success, failed.size(), failed, duration);
    }

    /**
     * @return true when the symbol was brought up to date
     */
    private boolean processSymbol(RefreshPolicy policy, String symbol, LocalDate start, LocalDate end,
                                  boolean forceFull) throws InterruptedIOException {
        try {
            refreshSymbol(policy, symbol, start, end, forceFull);
            return true;
        } catch (RateLimitedException e) {
            log.info("Rate limited on {}, waiting {}s and retrying", symbol, rateLimitBackoff.toSeconds());
            sleepBackoff();
            try {
                refreshSymbol(policy, symbol, start, end, forceFull);
                return true;
            } catch (InterruptedIOException ie) {
                throw ie;
            } catch (IOException | RuntimeException retryError) {
                log.warn("Failed to cache {} after retry: {}", symbol, retryError.getMessage());
                return false;
            }
        } catch (InterruptedIOException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to cache {}: {}", symbol, e.getMessage());
            return false;
        }
    }

    private void refreshSymbol(RefreshPolicy policy, String symbol, LocalDate start, LocalDate end,
                               boolean forceFull) throws IOException {
        CoverageMetadata metadata = store.status(symbol).orElse(null);
        RefreshStrategy strategy = policy.decideStrategy(metadata, forceFull);
        cacheManager.refresh(symbol, start, end, strategy);
    }

    private void sleepBackoff() throws InterruptedIOException {
        if (rateLimitBackoff.isZero() || rateLimitBackoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(rateLimitBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during rate limit backoff");
        }
    }

    /**
     * Re-fetch the last month for universe symbols not updated within maxAgeDays.
     */
    public StaleUpdateResult updateStaleSymbols(int maxAgeDays) throws IOException {
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        List<String> stale = store.staleUniverseSymbols(cutoff);

        if (stale.isEmpty()) {
            log.info("No stale universe symbols to update");
            return new StaleUpdateResult(0, 0);
        }

        log.info("Updating {} stale universe symbols", stale.size());
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(STALE_LOOKBACK_DAYS);

        int updated = 0;
        int failed = 0;
        for (String symbol : stale) {
            try {
                cacheManager.getBars(symbol, from, today);
                updated++;
            } catch (InterruptedIOException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to update {}: {}", symbol, e.getMessage());
                failed++;
            }
        }
        return new StaleUpdateResult(updated, failed);
    }

    /**
     * Cache coverage of the current universe.
     */
    public CoverageReport coverageReport() throws IOException {
        List<String> symbols = universe.getConstituents();

        int cached = 0;
        List<String> missing = new ArrayList<>();
        LocalDate earliest = null;
        LocalDate latest = null;
        Instant oldestUpdate = null;

        for (String symbol : symbols) {
            CoverageMetadata meta = store.status(symbol).orElse(null);
            if (meta == null) {
                missing.add(symbol);
                continue;
            }
            cached++;
            if (earliest == null || meta.firstDate().isBefore(earliest)) {
                earliest = meta.firstDate();
            }
            if (latest == null || meta.lastDate().isAfter(latest)) {
                latest = meta.lastDate();
            }
            if (meta.lastUpdated() != null && (oldestUpdate == null || meta.lastUpdated().isBefore(oldestUpdate))) {
                oldestUpdate = meta.lastUpdated();
            }
        }

        int total = symbols.size();
        double pct = total == 0 ? 0.0 : Math.round(cached * 1000.0 / total) / 10.0;
        List<String> sample = missing.size() > MISSING_SAMPLE ? missing.subList(0, MISSING_SAMPLE) : missing;

        return new CoverageReport(total, cached, missing.size(), pct, earliest, latest, oldestUpdate,
            List.copyOf(sample));
    }

    public UniverseService getUniverse() {
        return universe;
    }

    public record StaleUpdateResult(int updatedCount, int failedCount) {}
}
