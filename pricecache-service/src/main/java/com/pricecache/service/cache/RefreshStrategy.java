package com.pricecache.service.cache;

/**
 * Shape of the upstream fetch window chosen for a symbol.
 */
public enum RefreshStrategy {
    /** Only new dates, plus the most recent few days which may not be final. */
    APPEND_ONLY,
    /** Re-fetch a recent window to pick up retroactive adjustments. */
    ROLLING_WINDOW,
    /** Re-fetch the whole requested history. */
    FULL_REFRESH
}
