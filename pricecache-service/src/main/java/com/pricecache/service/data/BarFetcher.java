package com.pricecache.service.data;

import com.pricecache.core.model.Bar;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of daily bars from the upstream provider.
 * Implementations resolve pagination before returning.
 */
public interface BarFetcher {

    /**
     * Fetch daily bars for symbol over [start, end] inclusive, ordered by date.
     *
     * @throws RateLimitedException when the provider throttles the caller
     * @throws AuthorizationDeniedException when the provider refuses the request
     * @throws IOException for any other failure
     */
    List<Bar> fetch(String symbol, LocalDate start, LocalDate end, String apiKey) throws IOException;
}
