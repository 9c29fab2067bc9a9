package com.pricecache.service;

import com.pricecache.service.batch.BatchResult;
import com.pricecache.service.config.CacheServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Operator tool: full re-fetch of the whole universe from the historical start date to today.
 * Runs in the foreground and prints progress to stdout.
 */
public class RefreshCacheTool {
    private static final Logger LOG = LoggerFactory.getLogger(RefreshCacheTool.class);

    private static final int FAILED_SHOWN = 20;

    public static void main(String[] args) {
        CacheServiceConfig config = CacheServiceConfig.load();
        if (!config.hasApiKey()) {
            System.err.println("Error: POLYGON_API_KEY is not set");
            System.exit(1);
        }

        PriceCacheApp.Services services;
        try {
            System.out.println("Initializing database...");
            services = PriceCacheApp.Services.create(config, Clock.systemDefaultZone());
        } catch (IOException | RuntimeException e) {
            LOG.error("Could not initialize the cache", e);
            System.exit(2);
            return;
        }

        int exitCode = refresh(services, config.getHistoricalStart(), config.getRateLimitDelay());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Re-fetch the universe over [start, today] and close the services afterwards.
     *
     * @return process exit code, 0 on success and 2 when the run failed
     */
    static int refresh(PriceCacheApp.Services services, LocalDate start, Duration rateLimitDelay) {
        try {
            LocalDate end = LocalDate.now(services.clock());
            List<String> symbols = services.universe().getConstituents();

            System.out.println();
            System.out.println("Cache refresh settings:");
            System.out.println("  Start date: " + start);
            System.out.println("  End date: " + end);
            System.out.println("  Rate limit delay: " + rateLimitDelay.toMillis() + "ms");
            System.out.println("  Symbols to cache: " + symbols.size());
            System.out.println();
            System.out.println("Starting cache refresh...");

            BatchResult result = services.orchestrator().cacheAll(symbols, start, end, true,
                (processed, failed, total, symbol) -> System.out.printf(
                    "\r  Progress: %d/%d (%.1f%%) - Last: %s    ",
                    processed, total, processed * 100.0 / total, symbol));

            System.out.println();
            System.out.println();
            System.out.println("Cache refresh complete!");
            System.out.println("  Successful: " + result.successCount());
            System.out.println("  Failed: " + result.failCount());
            System.out.printf("  Duration: %.1f seconds%n", result.durationSeconds());

            List<String> failed = result.failedSymbols();
            if (!failed.isEmpty()) {
                System.out.println("  Failed tickers: "
                    + String.join(", ", failed.subList(0, Math.min(FAILED_SHOWN, failed.size()))));
                if (failed.size() > FAILED_SHOWN) {
                    System.out.println("    ... and " + (failed.size() - FAILED_SHOWN) + " more");
                }
            }
            return 0;
        } catch (Exception e) {
            LOG.error("Cache refresh failed", e);
            return 2;
        } finally {
            services.close();
        }
    }
}
