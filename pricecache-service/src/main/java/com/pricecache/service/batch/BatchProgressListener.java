package com.pricecache.service.batch;

/**
 * Receives progress after each symbol of a batch run.
 */
@FunctionalInterface
public interface BatchProgressListener {

    void onProgress(int processed, int failed, int total, String symbol);

    BatchProgressListener NONE = (processed, failed, total, symbol) -> { };
}
