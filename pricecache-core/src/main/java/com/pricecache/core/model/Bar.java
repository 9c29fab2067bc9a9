package com.pricecache.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * One trading day of OHLCV data for a symbol.
 * Unique per (symbol, date); storing the same pair again replaces the values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bar(
    String symbol,      // e.g., "AAPL"
    LocalDate date,     // Trading date (exchange local)
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Bar {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Bar symbol is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("Bar date is required");
        }
    }

    /**
     * Copy of this bar under a different symbol key (used when normalising case).
     */
    public Bar withSymbol(String newSymbol) {
        return new Bar(newSymbol, date, open, high, low, close, volume);
    }
}
