package com.pricecache.service.api;

import com.pricecache.core.model.BatchJob;
import com.pricecache.service.batch.BatchJobRegistry;
import com.pricecache.service.batch.BatchOrchestrator;
import com.pricecache.service.batch.JobStartResult;
import com.pricecache.service.universe.UniverseService;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Handler for universe jobs, coverage and the constituent list.
 */
public class JobHandler {
    private static final Logger LOG = LoggerFactory.getLogger(JobHandler.class);

    private final BatchJobRegistry registry;
    private final BatchOrchestrator orchestrator;
    private final UniverseService universe;
    private final LocalDate historicalStart;
    private final Clock clock;

    public JobHandler(BatchJobRegistry registry, BatchOrchestrator orchestrator, UniverseService universe,
                      LocalDate historicalStart, Clock clock) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.universe = universe;
        this.historicalStart = historicalStart;
        this.clock = clock;
    }

    /**
     * POST /jobs/universe?start=YYYY-MM-DD&end=YYYY-MM-DD&forceFull=false
     * 202 when started, 409 with the running job's id otherwise.
     */
    public void startUniverseJob(Context ctx) {
        try {
            String start = ctx.queryParam("start");
            String end = ctx.queryParam("end");
            LocalDate startDate = start != null ? LocalDate.parse(start) : historicalStart;
            LocalDate endDate = end != null ? LocalDate.parse(end) : LocalDate.now(clock);
            if (startDate.isAfter(endDate)) {
                ctx.status(400).json(new ErrorResponse("start must not be after end"));
                return;
            }
            boolean forceFull = Boolean.parseBoolean(ctx.queryParam("forceFull"));

            JobStartResult result = registry.startUniverseJob(startDate, endDate, forceFull);
            ctx.status(result.started() ? 202 : 409).json(result);
        } catch (DateTimeParseException e) {
            ctx.status(400).json(new ErrorResponse("Dates must be YYYY-MM-DD: " + e.getParsedString()));
        } catch (Exception e) {
            LOG.error("Failed to start universe job", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * GET /jobs/status?jobId=N (most recent job when omitted)
     */
    public void getJobStatus(Context ctx) {
        try {
            String jobIdParam = ctx.queryParam("jobId");
            Long jobId = jobIdParam != null ? Long.valueOf(jobIdParam) : null;

            Optional<BatchJob> job = registry.getJobStatus(jobId);
            if (job.isEmpty()) {
                ctx.status(404).json(new ErrorResponse(jobId != null ? "Job " + jobId + " not found" : "No jobs found"));
                return;
            }
            ctx.json(job.get());
        } catch (NumberFormatException e) {
            ctx.status(400).json(new ErrorResponse("jobId must be a number"));
        } catch (Exception e) {
            LOG.error("Failed to get job status", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * GET /coverage
     */
    public void getCoverage(Context ctx) {
        try {
            ctx.json(orchestrator.coverageReport());
        } catch (Exception e) {
            LOG.error("Failed to build coverage report", e);
            ctx.status(500).json(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * POST /universe/refresh?force=false
     */
    public void refreshUniverse(Context ctx) {
        try {
            boolean force = Boolean.parseBoolean(ctx.queryParam("force"));
            UniverseService.RefreshResult result = universe.refreshConstituents(force);
            ctx.status(result.success() ? 200 : 502).json(result);
        } catch (Exception e) {
            LOG.error("Failed to refresh universe", e);
            ctx.status(502).json(new ErrorResponse(e.getMessage()));
        }
    }

    public record ErrorResponse(String error) {}
}
