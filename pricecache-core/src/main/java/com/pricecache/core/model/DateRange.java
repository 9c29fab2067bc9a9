package com.pricecache.core.model;

import java.time.LocalDate;

/**
 * Inclusive span of trading dates.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Range bounds are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
