package com.pricecache.service.batch;

import java.util.List;

/**
 * Outcome of one pass over a symbol universe.
 */
public record BatchResult(
    int total,
    int successCount,
    int failCount,
    List<String> failedSymbols,
    double durationSeconds
) {
    private static final int SUMMARY_LIMIT = 10;

    public int processed() {
        return successCount + failCount;
    }

    /**
     * Bounded description of the failures, or null when nothing failed.
     */
    public String failureSummary() {
        if (failedSymbols.isEmpty()) {
            return null;
        }
        int shown = Math.min(SUMMARY_LIMIT, failedSymbols.size());
        StringBuilder sb = new StringBuilder("Failed tickers: ")
            .append(String.join(", ", failedSymbols.subList(0, shown)));
        if (failedSymbols.size() > shown) {
            sb.append(" and ").append(failedSymbols.size() - shown).append(" more");
        }
        return sb.toString();
    }
}
