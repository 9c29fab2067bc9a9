package com.pricecache.service.data;

public class RateLimitedException extends UpstreamException {

    private final long retryAfterMs;

    public RateLimitedException(String message, long retryAfterMs) {
        super(message, 429);
        this.retryAfterMs = retryAfterMs;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
