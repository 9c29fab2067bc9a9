package com.pricecache.service;

import com.pricecache.service.api.PriceCacheServer;
import com.pricecache.service.batch.BatchJobRegistry;
import com.pricecache.service.batch.BatchOrchestrator;
import com.pricecache.service.cache.CacheManager;
import com.pricecache.service.cache.RangeReconciler;
import com.pricecache.service.cache.RefreshPolicy;
import com.pricecache.service.config.CacheServiceConfig;
import com.pricecache.service.data.PolygonBarFetcher;
import com.pricecache.service.data.sqlite.SqliteBarStore;
import com.pricecache.service.data.sqlite.SqliteConnection;
import com.pricecache.service.universe.UniverseService;
import com.pricecache.service.universe.WikipediaConstituentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Price cache service - standalone daemon serving cached daily bars over HTTP.
 */
public class PriceCacheApp {
    private static final Logger LOG = LoggerFactory.getLogger(PriceCacheApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static Services services;
    private static PriceCacheServer server;
    private static ScheduledExecutorService scheduler;
    private static Instant startTime;

    public static void main(String[] args) {
        LOG.info("Starting price cache service...");
        startTime = Instant.now();

        try {
            CacheServiceConfig config = CacheServiceConfig.load();
            if (!config.hasApiKey()) {
                LOG.warn("POLYGON_API_KEY is not set; cache misses will fail upstream");
            }

            services = Services.create(config, Clock.systemDefaultZone());
            server = new PriceCacheServer(services.cacheManager(), services.registry(), services.orchestrator(),
                services.universe(), config.getHistoricalStart(), services.clock());

            scheduleMaintenance();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down price cache service...");
                cleanup();
                shutdownLatch.countDown();
            }));

            server.start(config.getPort());
            LOG.info("Price cache service started on port {} (database {})",
                config.getPort(), config.getDatabasePath());

            shutdownLatch.await();
        } catch (Exception e) {
            LOG.error("Failed to start price cache service", e);
            System.exit(1);
        }
    }

    private static synchronized void cleanup() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        if (server != null) {
            server.stop();
            server = null;
        }
        if (services != null) {
            services.close();
            services = null;
        }
    }

    /**
     * Daily constituent list refresh at 4 AM, plus a status heartbeat.
     */
    private static void scheduleMaintenance() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pricecache-scheduler");
            t.setDaemon(true);
            return t;
        });

        long delayMinutes = LocalTime.now().until(LocalTime.of(4, 0), ChronoUnit.MINUTES);
        if (delayMinutes < 0) {
            delayMinutes += 24 * 60;
        }

        UniverseService universe = services.universe();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                LOG.info("Running scheduled constituent refresh...");
                universe.refreshConstituents(false);
            } catch (Exception e) {
                LOG.error("Scheduled constituent refresh failed", e);
            }
        }, delayMinutes, 24 * 60, TimeUnit.MINUTES);
        LOG.info("Constituent refresh scheduled at 4 AM daily (first run in {} minutes)", delayMinutes);

        BatchJobRegistry registry = services.registry();
        SqliteBarStore store = services.store();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                SqliteBarStore.StoreStats stats = store.stats();
                long uptimeMin = Duration.between(startTime, Instant.now()).toMinutes();
                LOG.info("STATUS | uptime={}m | symbols={} | bars={} | dbMb={} | jobRunning={}",
                    uptimeMin, stats.totalSymbols(), stats.totalBars(), stats.databaseSizeMb(), registry.isRunning());
            } catch (Exception e) {
                LOG.debug("Status heartbeat error: {}", e.getMessage());
            }
        }, 1, 5, TimeUnit.MINUTES);
    }

    /**
     * The wired object graph shared by the daemon and the operator tool.
     */
    public record Services(
        Clock clock,
        SqliteConnection connection,
        SqliteBarStore store,
        CacheManager cacheManager,
        UniverseService universe,
        BatchOrchestrator orchestrator,
        BatchJobRegistry registry
    ) {
        public static Services create(CacheServiceConfig config, Clock clock) throws IOException {
            SqliteConnection connection = new SqliteConnection(config.getDatabasePath());
            SqliteBarStore store = new SqliteBarStore(connection, clock);
            LOG.info("Price cache store initialized at {}", config.getDatabasePath());

            RefreshPolicy policy = new RefreshPolicy(config.getRefresh(), clock);
            CacheManager cacheManager = new CacheManager(
                new PolygonBarFetcher(config.getApiBaseUrl()),
                store,
                new RangeReconciler(store),
                policy,
                config.getApiKey(),
                config.getRateLimitDelay(),
                clock);

            UniverseService universe = new UniverseService(connection, new WikipediaConstituentSource(),
                config.getUniverseRefreshDays(), clock);
            BatchOrchestrator orchestrator = new BatchOrchestrator(cacheManager, universe,
                config.getRateLimitBackoff(), clock);
            BatchJobRegistry registry = new BatchJobRegistry(connection, orchestrator, clock);

            return new Services(clock, connection, store, cacheManager, universe, orchestrator, registry);
        }

        public void close() {
            registry.shutdown();
            connection.close();
        }
    }
}
