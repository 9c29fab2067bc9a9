package com.pricecache.service.cache;

import com.pricecache.core.model.CoverageMetadata;
import com.pricecache.core.model.DateRange;
import com.pricecache.service.data.sqlite.SqliteBarStore;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Works out which parts of a requested span are not yet cached.
 *
 * Coverage is tracked as one contiguous [first, last] span per symbol, so only
 * the part before the span and the part after it are ever reported. Holes
 * inside the span, e.g. left by a ranged invalidate, are not detected.
 */
public class RangeReconciler {

    private final SqliteBarStore store;

    public RangeReconciler(SqliteBarStore store) {
        this.store = store;
    }

    public List<DateRange> missingRanges(String symbol, LocalDate reqStart, LocalDate reqEnd) throws IOException {
        return rangesToFetch(store.status(symbol).orElse(null), reqStart, reqEnd);
    }

    /**
     * Ranges still to fetch given known coverage; empty means a full cache hit.
     *
     * @param metadata cached coverage, or null on a full miss
     */
    public static List<DateRange> rangesToFetch(CoverageMetadata metadata, LocalDate reqStart, LocalDate reqEnd) {
        List<DateRange> ranges = new ArrayList<>(2);

        if (metadata == null || !metadata.hasBars()) {
            ranges.add(DateRange.of(reqStart, reqEnd));
            return ranges;
        }

        if (reqStart.isBefore(metadata.firstDate())) {
            ranges.add(DateRange.of(reqStart, metadata.firstDate().minusDays(1)));
        }
        if (reqEnd.isAfter(metadata.lastDate())) {
            ranges.add(DateRange.of(metadata.lastDate().plusDays(1), reqEnd));
        }
        return ranges;
    }
}
