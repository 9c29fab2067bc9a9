package com.pricecache.service.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Configuration for the price cache service.
 */
public class CacheServiceConfig {
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.pricecache";
    private static final int DEFAULT_PORT = 9820;
    private static final String DEFAULT_BASE_URL = "https://api.polygon.io";

    private final int port;
    private final Path dataDir;
    private final String apiKey;
    private final String apiBaseUrl;
    private final Duration rateLimitDelay;
    private final Duration rateLimitBackoff;
    private final LocalDate historicalStart;
    private final RefreshSettings refresh;
    private final int universeRefreshDays;

    public CacheServiceConfig(int port, Path dataDir, String apiKey, String apiBaseUrl,
                              Duration rateLimitDelay, Duration rateLimitBackoff, LocalDate historicalStart,
                              RefreshSettings refresh, int universeRefreshDays) {
        this.port = port;
        this.dataDir = dataDir;
        this.apiKey = apiKey;
        this.apiBaseUrl = apiBaseUrl;
        this.rateLimitDelay = rateLimitDelay;
        this.rateLimitBackoff = rateLimitBackoff;
        this.historicalStart = historicalStart;
        this.refresh = refresh;
        this.universeRefreshDays = universeRefreshDays;
    }

    public static CacheServiceConfig load() {
        // Load from system properties or environment, with sensible defaults
        int port = Integer.parseInt(setting("pricecache.port", "PRICECACHE_PORT", String.valueOf(DEFAULT_PORT)));
        Path dataDir = Paths.get(setting("pricecache.data.dir", "PRICECACHE_DATA_DIR", DEFAULT_DATA_DIR));
        String apiKey = setting("pricecache.api.key", "POLYGON_API_KEY", "");
        String baseUrl = setting("pricecache.api.base_url", "POLYGON_BASE_URL", DEFAULT_BASE_URL);

        long delayMs = Long.parseLong(setting("pricecache.rate_limit_delay_ms", "API_RATE_LIMIT_DELAY_MS", "250"));
        long backoffS = Long.parseLong(setting("pricecache.rate_limit_backoff_s", "API_RATE_LIMIT_BACKOFF_S", "60"));
        LocalDate historicalStart = LocalDate.parse(
            setting("pricecache.historical_start", "HISTORICAL_START_DATE", "2016-01-18"));

        RefreshSettings refresh = new RefreshSettings(
            Integer.parseInt(setting("pricecache.refresh.always_fetch_days", "CACHE_ALWAYS_FETCH_DAYS", "2")),
            Integer.parseInt(setting("pricecache.refresh.rolling_window_days", "CACHE_ROLLING_REFRESH_DAYS", "90")),
            Integer.parseInt(setting("pricecache.refresh.rolling_interval_days", "CACHE_ROLLING_INTERVAL_DAYS", "7")),
            Integer.parseInt(setting("pricecache.refresh.full_interval_days", "CACHE_FULL_REFRESH_INTERVAL", "30")));

        int universeRefreshDays = Integer.parseInt(setting("pricecache.universe.refresh_days", "UNIVERSE_REFRESH_DAYS", "7"));

        return new CacheServiceConfig(port, dataDir, apiKey, baseUrl, Duration.ofMillis(delayMs),
            Duration.ofSeconds(backoffS), historicalStart, refresh, universeRefreshDays);
    }

    private static String setting(String property, String env, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(env, defaultValue));
    }

    public int getPort() {
        return port;
    }

    public Path getDatabasePath() {
        return dataDir.resolve("data").resolve("price_cache.db");
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public Duration getRateLimitDelay() {
        return rateLimitDelay;
    }

    public Duration getRateLimitBackoff() {
        return rateLimitBackoff;
    }

    public LocalDate getHistoricalStart() {
        return historicalStart;
    }

    public RefreshSettings getRefresh() {
        return refresh;
    }

    public int getUniverseRefreshDays() {
        return universeRefreshDays;
    }

    /**
     * Tunables for the tiered refresh policy, all in days.
     */
    public record RefreshSettings(
        int alwaysFetchDays,            // Most recent days re-fetched on every update
        int rollingWindowDays,          // Size of the rolling re-verification window
        int rollingRefreshIntervalDays, // How often the rolling window is re-fetched
        int fullRefreshIntervalDays     // How often the whole history is re-fetched
    ) {
        public static RefreshSettings defaults() {
            return new RefreshSettings(2, 90, 7, 30);
        }
    }
}
