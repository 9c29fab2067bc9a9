package com.pricecache.service.batch;

import com.pricecache.core.model.BatchJob;
import com.pricecache.core.model.JobStatus;
import com.pricecache.service.data.sqlite.SqliteConnection;
import com.pricecache.service.data.sqlite.dao.BatchJobDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts and tracks universe caching jobs.
 *
 * At most one job runs at a time, on a single background worker. Asking for
 * another while one runs returns a conflict with the running job's id; no
 * second row is created and nothing is queued. Running jobs cannot be
 * cancelled.
 */
public class BatchJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(BatchJobRegistry.class);

    public static final String JOB_TYPE = "universe_cache";
    static final String INTERRUPTED_REASON = "interrupted by restart";
    private static final int PROGRESS_FLUSH_EVERY = 5;

    private final SqliteConnection conn;
    private final BatchJobDao dao;
    private final BatchOrchestrator orchestrator;
    private final Clock clock;

    // Claiming the slot, creating the row and publishing its id happen under startLock
    private final Object startLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long activeJobId = -1;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "universe-cache-worker");
        t.setDaemon(true);
        return t;
    });

    public BatchJobRegistry(SqliteConnection conn, BatchOrchestrator orchestrator, Clock clock) throws IOException {
        this.conn = conn;
        this.dao = new BatchJobDao(conn);
        this.orchestrator = orchestrator;
        this.clock = clock;

        try {
            int closed = conn.execute(c -> dao.failRunning(INTERRUPTED_REASON, clock.instant()));
            if (closed > 0) {
                log.warn("Marked {} job(s) left running by a previous process as failed", closed);
            }
        } catch (SQLException e) {
            throw new IOException("SQLite error recovering jobs: " + e.getMessage(), e);
        }
    }

    /**
     * Start caching the current universe over [start, end] in the background.
     *
     * The constituent list is loaded before the running slot is claimed, so a
     * slow universe refresh never leaves the slot held without a job id.
     */
    public JobStartResult startUniverseJob(LocalDate start, LocalDate end, boolean forceFull) throws IOException {
        synchronized (startLock) {
            if (running.get()) {
                return conflict();
            }
        }

        List<String> symbols = orchestrator.getUniverse().getConstituents();

        long jobId;
        synchronized (startLock) {
            if (running.get()) {
                return conflict();
            }
            try {
                jobId = conn.execute(c -> dao.createRunning(JOB_TYPE, symbols.size(), clock.instant()));
            } catch (SQLException e) {
                throw new IOException("SQLite error creating job: " + e.getMessage(), e);
            }
            activeJobId = jobId;
            running.set(true);
        }

        log.info("Started universe job {} for {} symbols ({}..{}, forceFull={})",
            jobId, symbols.size(), start, end, forceFull);
        try {
            worker.submit(() -> runJob(jobId, symbols, start, end, forceFull));
        } catch (RuntimeException e) {
            finish(jobId, JobStatus.FAILED, "Could not schedule job: " + e.getMessage());
            release();
            throw e;
        }
        return JobStartResult.launched(jobId, symbols.size());
    }

    // Caller holds startLock
    private JobStartResult conflict() {
        log.info("Universe job already running ({}), not starting another", activeJobId);
        return JobStartResult.conflict(activeJobId);
    }

    private void release() {
        synchronized (startLock) {
            running.set(false);
        }
    }

    private void runJob(long jobId, List<String> symbols, LocalDate start, LocalDate end, boolean forceFull) {
        try {
            BatchResult result = orchestrator.cacheAll(symbols, start, end, forceFull,
                (processed, failed, total, symbol) -> {
                    if (processed % PROGRESS_FLUSH_EVERY == 0 || processed == total) {
                        saveProgress(jobId, processed, failed);
                    }
                });

            saveProgress(jobId, result.processed(), result.failCount());
            if (result.failCount() > 0) {
                finish(jobId, JobStatus.COMPLETED_WITH_ERRORS, result.failureSummary());
            } else {
                finish(jobId, JobStatus.COMPLETED, null);
            }
            log.info("Universe job {} finished: {} succeeded, {} failed",
                jobId, result.successCount(), result.failCount());
        } catch (Exception e) {
            log.error("Universe job {} failed: {}", jobId, e.getMessage(), e);
            finish(jobId, JobStatus.FAILED, e.getMessage());
        } finally {
            release();
        }
    }

    private void saveProgress(long jobId, int processed, int failed) {
        try {
            conn.execute(c -> {
                dao.updateProgress(jobId, processed, failed);
                return null;
            });
        } catch (SQLException e) {
            log.warn("Could not save progress for job {}: {}", jobId, e.getMessage());
        }
    }

    private void finish(long jobId, JobStatus status, String summary) {
        try {
            conn.execute(c -> dao.complete(jobId, status, summary, clock.instant()));
        } catch (SQLException e) {
            log.error("Could not record {} for job {}: {}", status.value(), jobId, e.getMessage());
        }
    }

    /**
     * A specific job, or the most recent one when jobId is null.
     */
    public Optional<BatchJob> getJobStatus(Long jobId) throws IOException {
        try {
            BatchJob job = conn.execute(c -> jobId != null ? dao.get(jobId) : dao.latest());
            return Optional.ofNullable(job);
        } catch (SQLException e) {
            throw new IOException("SQLite error reading job: " + e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stop accepting work and wait briefly for the current job to drain.
     */
    public void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Universe job still running at shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
