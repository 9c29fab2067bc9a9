package com.pricecache.service.cache;

import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.core.model.DateRange;
import com.pricecache.service.config.CacheServiceConfig.RefreshSettings;
import com.pricecache.service.data.sqlite.SqliteBarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Decides when and how cached prices are re-fetched.
 *
 * Upstream prices are split and dividend adjusted after the fact, so pure
 * append-only caching would serve stale values forever. Recent days are
 * always re-fetched, a rolling window is re-verified every few days, and the
 * whole history is re-fetched on a longer interval. Elapsed time is counted
 * in whole days, rounded down.
 */
public class RefreshPolicy {

    private static final Logger log = LoggerFactory.getLogger(RefreshPolicy.class);

    public static final double DEFAULT_ADJUSTMENT_TOLERANCE = 0.01;
    public static final int DEFAULT_REFRESH_LIMIT = 100;

    private final RefreshSettings settings;
    private final Clock clock;

    public RefreshPolicy(RefreshSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Pick the strategy for a symbol.
     *
     * @param metadata cached coverage, or null when nothing is cached
     */
    public RefreshStrategy decideStrategy(CoverageMetadata metadata, boolean forceFull) {
        if (forceFull || metadata == null) {
            return RefreshStrategy.FULL_REFRESH;
        }

        Instant now = clock.instant();

        if (metadata.lastFullRefresh() == null) {
            return RefreshStrategy.FULL_REFRESH;
        }
        long daysSinceFull = daysBetween(metadata.lastFullRefresh(), now);
        if (daysSinceFull >= settings.fullRefreshIntervalDays()) {
            log.debug("{}: full refresh due (last was {} days ago)", metadata.symbol(), daysSinceFull);
            return RefreshStrategy.FULL_REFRESH;
        }

        if (metadata.lastUpdated() != null) {
            long daysSinceUpdate = daysBetween(metadata.lastUpdated(), now);
            if (daysSinceUpdate >= settings.rollingRefreshIntervalDays()) {
                log.debug("{}: rolling refresh due (last update {} days ago)", metadata.symbol(), daysSinceUpdate);
                return RefreshStrategy.ROLLING_WINDOW;
            }
        }

        return RefreshStrategy.APPEND_ONLY;
    }

    /**
     * The window to fetch for a strategy, or empty when there is nothing to do.
     *
     * @param cachedLast last cached date, or null when nothing is cached
     */
    public Optional<DateRange> refreshRange(RefreshStrategy strategy, LocalDate reqStart, LocalDate reqEnd,
                                            LocalDate cachedLast) {
        LocalDate today = LocalDate.now(clock);

        return switch (strategy) {
            case FULL_REFRESH -> Optional.of(DateRange.of(reqStart, reqEnd));
            case ROLLING_WINDOW -> {
                LocalDate rollingStart = today.minusDays(settings.rollingWindowDays());
                LocalDate fetchStart = rollingStart.isAfter(reqStart) ? rollingStart : reqStart;
                yield windowUpTo(fetchStart, reqEnd);
            }
            case APPEND_ONLY -> {
                if (cachedLast == null) {
                    yield Optional.of(DateRange.of(reqStart, reqEnd));
                }
                // Always re-fetch the last few days, which may not be final yet
                LocalDate recentCutoff = today.minusDays(settings.alwaysFetchDays());
                LocalDate afterCached = cachedLast.plusDays(1);
                yield windowUpTo(recentCutoff.isBefore(afterCached) ? recentCutoff : afterCached, reqEnd);
            }
        };
    }

    private static Optional<DateRange> windowUpTo(LocalDate fetchStart, LocalDate reqEnd) {
        if (fetchStart.isAfter(reqEnd)) {
            return Optional.empty();
        }
        return Optional.of(DateRange.of(fetchStart, reqEnd));
    }

    /**
     * Whether a single cached date is due for re-verification.
     *
     * @param lastUpdated last store for the symbol, or null if never
     */
    public boolean shouldRefreshDate(LocalDate date, Instant lastUpdated) {
        long daysAgo = ChronoUnit.DAYS.between(date, LocalDate.now(clock));

        if (daysAgo <= settings.alwaysFetchDays()) {
            return true;
        }
        if (daysAgo <= settings.rollingWindowDays()) {
            if (lastUpdated == null) {
                return true;
            }
            return daysBetween(lastUpdated, clock.instant()) >= settings.rollingRefreshIntervalDays();
        }
        return false;
    }

    /**
     * Whether a fresh close differs enough from the cached one to suggest a
     * corporate action was applied upstream.
     */
    public static boolean detectAdjustmentNeeded(double cachedClose, double apiClose, double tolerance) {
        if (cachedClose == 0 || apiClose == 0) {
            return true;
        }
        return Math.abs(cachedClose - apiClose) / cachedClose > tolerance;
    }

    public static boolean detectAdjustmentNeeded(double cachedClose, double apiClose) {
        return detectAdjustmentNeeded(cachedClose, apiClose, DEFAULT_ADJUSTMENT_TOLERANCE);
    }

    /**
     * Cached symbols whose full or rolling refresh is due, oldest first.
     */
    public List<String> symbolsNeedingRefresh(SqliteBarStore store, int limit) throws IOException {
        Instant now = clock.instant();
        Instant fullCutoff = now.minus(Duration.ofDays(settings.fullRefreshIntervalDays()));
        Instant rollingCutoff = now.minus(Duration.ofDays(settings.rollingRefreshIntervalDays()));
        return store.symbolsNeedingRefresh(fullCutoff, rollingCutoff, limit);
    }

    private static long daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toDays();
    }
}
