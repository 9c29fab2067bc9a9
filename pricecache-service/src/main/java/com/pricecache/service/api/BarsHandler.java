package com.pricecache.service.api;

import com.pricecache.core.model.Bar;
import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.service.cache.CacheManager;
import com.pricecache.service.data.RateLimitedException;
import com.pricecache.service.data.UpstreamException;
import com.pricecache.service.data.sqlite.SqliteBarStore;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Handler for bar reads and per-symbol cache maintenance.
 */
public class BarsHandler {
    private static final Logger LOG = LoggerFactory.getLogger(BarsHandler.class);

    private final CacheManager cacheManager;

    public BarsHandler(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    /**
     * GET /bars?symbol=X&start=YYYY-MM-DD&end=YYYY-MM-DD&forceRefresh=false
     */
    public void getBars(Context ctx) {
        try {
            String symbol = ctx.queryParam("symbol");
            String start = ctx.queryParam("start");
            String end = ctx.queryParam("end");

            if (symbol == null || symbol.isBlank() || start == null || end == null) {
                ctx.status(400).json(new ErrorResponse("symbol, start and end are required"));
                return;
            }

            LocalDate startDate = LocalDate.parse(start);
            LocalDate endDate = LocalDate.parse(end);
            if (startDate.isAfter(endDate)) {
                ctx.status(400).json(new ErrorResponse("start must not be after end"));
                return;
            }
            boolean forceRefresh = Boolean.parseBoolean(ctx.queryParam("forceRefresh"));

            List<Bar> bars = cacheManager.getBars(symbol, startDate, endDate, forceRefresh);
            ctx.json(new BarsResponse(SqliteBarStore.normalize(symbol), startDate, endDate, bars.size(), bars));
        } catch (DateTimeParseException e) {
            ctx.status(400).json(new ErrorResponse("Dates must be YYYY-MM-DD: " + e.getParsedString()));
        } catch (RateLimitedException e) {
            ctx.status(429).json(new ErrorResponse(e.getMessage()));
        } catch (UpstreamException e) {
            LOG.warn("Upstream error serving bars: {}", e.getMessage());
            ctx.status(502).json(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            LOG.error("Failed to get bars", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * GET /cache/status/{symbol}
     */
    public void getCacheStatus(Context ctx) {
        try {
            String symbol = ctx.pathParam("symbol");
            Optional<CoverageMetadata> status = cacheManager.getCacheStatus(symbol);
            if (status.isEmpty()) {
                ctx.status(404).json(new ErrorResponse("No cached data for " + SqliteBarStore.normalize(symbol)));
                return;
            }
            ctx.json(status.get());
        } catch (Exception e) {
            LOG.error("Failed to get cache status", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * DELETE /cache/{symbol}
     */
    public void invalidate(Context ctx) {
        try {
            String symbol = SqliteBarStore.normalize(ctx.pathParam("symbol"));
            int removed = cacheManager.invalidateTicker(symbol);
            ctx.json(new InvalidateResponse(symbol, removed));
        } catch (Exception e) {
            LOG.error("Failed to invalidate cache", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * GET /cache/stats
     */
    public void getStats(Context ctx) {
        try {
            ctx.json(cacheManager.getStore().stats());
        } catch (Exception e) {
            LOG.error("Failed to get cache stats", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    // Response records
    public record BarsResponse(String symbol, LocalDate start, LocalDate end, int count, List<Bar> bars) {}

    public record InvalidateResponse(String symbol, int barsRemoved) {}

    public record ErrorResponse(String error) {}
}
