package com.pricecache.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricecache.service.batch.BatchJobRegistry;
import com.pricecache.service.batch.BatchOrchestrator;
import com.pricecache.service.cache.CacheManager;
import com.pricecache.service.data.HttpClientFactory;
import com.pricecache.service.universe.UniverseService;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;

/**
 * HTTP server for the price cache API.
 */
public class PriceCacheServer {
    private static final Logger LOG = LoggerFactory.getLogger(PriceCacheServer.class);

    private final ObjectMapper objectMapper;
    private final BarsHandler barsHandler;
    private final JobHandler jobHandler;
    private final BatchJobRegistry registry;
    private Javalin app;

    public PriceCacheServer(CacheManager cacheManager, BatchJobRegistry registry, BatchOrchestrator orchestrator,
                            UniverseService universe, LocalDate historicalStart, Clock clock) {
        this.objectMapper = HttpClientFactory.getMapper();
        this.registry = registry;
        this.barsHandler = new BarsHandler(cacheManager);
        this.jobHandler = new JobHandler(registry, orchestrator, universe, historicalStart, clock);
    }

    /**
     * Start listening; port 0 picks a free port.
     *
     * @return the bound port
     */
    public int start(int port) {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
            javalinConfig.showJavalinBanner = false;
        });

        configureCacheRoutes();
        configureJobRoutes();
        configureHealthRoutes();

        app.start(port);
        LOG.info("Price cache API listening on port {}", app.port());
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
        }
    }

    private void configureCacheRoutes() {
        app.get("/bars", barsHandler::getBars);
        app.get("/cache/stats", barsHandler::getStats);
        app.get("/cache/status/{symbol}", barsHandler::getCacheStatus);
        app.delete("/cache/{symbol}", barsHandler::invalidate);
    }

    private void configureJobRoutes() {
        app.post("/jobs/universe", jobHandler::startUniverseJob);
        app.get("/jobs/status", jobHandler::getJobStatus);
        app.get("/coverage", jobHandler::getCoverage);
        app.post("/universe/refresh", jobHandler::refreshUniverse);
    }

    private void configureHealthRoutes() {
        app.get("/health", ctx -> ctx.json(new HealthResponse("ok", registry.isRunning())));
        app.get("/", ctx -> ctx.json(new ServiceInfo("pricecache", "1.0.0", app.port())));
    }

    // Response records
    public record HealthResponse(String status, boolean jobRunning) {}
    public record ServiceInfo(String name, String version, int port) {}
}
