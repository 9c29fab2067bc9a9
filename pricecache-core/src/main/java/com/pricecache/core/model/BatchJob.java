package com.pricecache.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A tracked background population run over a symbol universe.
 * Counters only grow while running; status changes once, to a terminal value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchJob(
    long id,
    String jobType,             // e.g., "universe_cache"
    JobStatus status,
    int tickersTotal,           // Fixed when the job is created
    int tickersProcessed,
    int tickersFailed,
    Instant startedAt,
    Instant completedAt,        // Null until terminal
    String errorSummary
) {
    /**
     * Percentage of the universe processed so far, one decimal place.
     */
    @JsonProperty("progressPct")
    public double progressPct() {
        if (tickersTotal <= 0) return 0.0;
        return Math.round(tickersProcessed * 1000.0 / tickersTotal) / 10.0;
    }
}
