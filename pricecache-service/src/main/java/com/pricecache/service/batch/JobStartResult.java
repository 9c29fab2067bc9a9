package com.pricecache.service.batch;

/**
 * Result of asking for a new universe job: either started, or refused
 * because another job is already running.
 */
public record JobStartResult(boolean started, long jobId, int tickersTotal, String message) {

    static JobStartResult launched(long jobId, int tickersTotal) {
        return new JobStartResult(true, jobId, tickersTotal,
            "Started caching " + tickersTotal + " symbols in background");
    }

    static JobStartResult conflict(long existingJobId) {
        return new JobStartResult(false, existingJobId, 0, "A caching job is already running");
    }

    public boolean isConflict() {
        return !started;
    }
}
