package com.pricecache.service.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricecache.core.model.Bar;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily aggregate bars from the Polygon.io REST API.
 *
 * Follows next_url pagination until exhausted. Timestamps are session starts in
 * epoch millis and are mapped to the New York trading date.
 */
public class PolygonBarFetcher implements BarFetcher {

    private static final Logger log = LoggerFactory.getLogger(PolygonBarFetcher.class);

    private static final ZoneId MARKET_ZONE = ZoneId.of("America/New_York");
    private static final int PAGE_LIMIT = 50000;
    private static final long DEFAULT_RETRY_AFTER_MS = 60_000;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public PolygonBarFetcher(String baseUrl) {
        this(HttpClientFactory.getClient(), HttpClientFactory.getMapper(), baseUrl);
    }

    public PolygonBarFetcher(OkHttpClient client, ObjectMapper mapper, String baseUrl) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<Bar> fetch(String symbol, LocalDate start, LocalDate end, String apiKey) throws IOException {
        HttpUrl first = HttpUrl.parse(baseUrl + "/v2/aggs/ticker/" + symbol + "/range/1/day/" + start + "/" + end);
        if (first == null) {
            throw new UpstreamException("Invalid upstream URL for " + symbol + ": " + baseUrl);
        }
        HttpUrl url = first.newBuilder()
            .addQueryParameter("adjusted", "true")
            .addQueryParameter("sort", "asc")
            .addQueryParameter("limit", String.valueOf(PAGE_LIMIT))
            .addQueryParameter("apiKey", apiKey)
            .build();

        List<Bar> bars = new ArrayList<>();
        int pages = 0;

        while (url != null) {
            JsonNode page = executeRequest(symbol, url);
            pages++;

            JsonNode results = page.get("results");
            if (results != null && results.isArray()) {
                for (JsonNode result : results) {
                    Bar bar = toBar(symbol, result);
                    if (bar != null) {
                        bars.add(bar);
                    }
                }
            }

            url = nextPage(page, apiKey);
        }

        log.debug("Fetched {} bars for {} {}..{} in {} page(s)", bars.size(), symbol, start, end, pages);
        return bars;
    }

    private JsonNode executeRequest(String symbol, HttpUrl url) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .get()
            .build();

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (response.code() == 429) {
                long retryAfterMs = parseRetryAfter(response.header("Retry-After"));
                throw new RateLimitedException("Rate limited fetching " + symbol, retryAfterMs);
            }
            if (response.code() == 401 || response.code() == 403 || body.contains("NOT_AUTHORIZED")) {
                throw new AuthorizationDeniedException(
                    "Not authorized for " + symbol + ": " + response.code() + " - " + abbreviate(body),
                    response.code());
            }
            if (!response.isSuccessful()) {
                throw new UpstreamException(
                    "API error for " + symbol + ": " + response.code() + " - " + abbreviate(body),
                    response.code());
            }

            return mapper.readTree(body);
        } catch (UpstreamException e) {
            throw e;
        } catch (IOException e) {
            // Connection failures, timeouts and unparseable bodies
            throw new UpstreamException("Request failed for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private HttpUrl nextPage(JsonNode page, String apiKey) {
        JsonNode next = page.get("next_url");
        if (next == null || next.isNull() || next.asText().isBlank()) {
            return null;
        }
        HttpUrl nextUrl = HttpUrl.parse(next.asText());
        if (nextUrl == null) {
            log.warn("Ignoring malformed next_url: {}", next.asText());
            return null;
        }
        // The continuation link does not carry the credential
        return nextUrl.newBuilder().setQueryParameter("apiKey", apiKey).build();
    }

    /**
     * Convert one aggregate result, or null when a required field is missing.
     */
    private Bar toBar(String symbol, JsonNode result) {
        if (!result.hasNonNull("t") || !result.hasNonNull("o") || !result.hasNonNull("h")
                || !result.hasNonNull("l") || !result.hasNonNull("c")) {
            return null;
        }
        LocalDate date = Instant.ofEpochMilli(result.get("t").asLong()).atZone(MARKET_ZONE).toLocalDate();
        return new Bar(
            symbol,
            date,
            result.get("o").asDouble(),
            result.get("h").asDouble(),
            result.get("l").asDouble(),
            result.get("c").asDouble(),
            result.path("v").asDouble(0.0)
        );
    }

    private static long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return DEFAULT_RETRY_AFTER_MS;
        }
        try {
            return Long.parseLong(header.trim()) * 1000L;
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_MS;
        }
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
