package com.pricecache.service.batch;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * How much of the universe is cached, with a sample of what is missing.
 */
public record CoverageReport(
    int totalUniverse,
    int cachedCount,
    int missingCount,
    double coveragePct,         // One decimal place
    LocalDate earliestDate,     // Earliest first date across cached symbols
    LocalDate latestDate,       // Latest last date across cached symbols
    Instant oldestCacheUpdate,  // Least recent store across cached symbols
    List<String> sampleMissing  // At most 20 symbols
) {}
