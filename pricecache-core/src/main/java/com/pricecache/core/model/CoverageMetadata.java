package com.pricecache.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-symbol summary of what the local cache holds.
 * totalBars always equals the number of stored bars for the symbol; it is
 * recomputed in the same transaction as every store or delete.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoverageMetadata(
    String symbol,
    LocalDate firstDate,        // Earliest cached trading date
    LocalDate lastDate,         // Latest cached trading date
    Instant lastUpdated,        // Last store for this symbol
    Instant lastFullRefresh,    // Last full re-fetch, null if never
    long totalBars,
    boolean inUniverse,
    String status
) {
    public static final String STATUS_ACTIVE = "active";

    @JsonIgnore
    public boolean hasBars() {
        return totalBars > 0 && firstDate != null && lastDate != null;
    }
}
