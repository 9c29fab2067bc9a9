package com.pricecache.service.data;

import java.io.IOException;

/**
 * Generic failure talking to the market data provider.
 */
public class UpstreamException extends IOException {

    private final int httpStatus;

    public UpstreamException(String message) {
        this(message, -1);
    }

    public UpstreamException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
    }

    /**
     * HTTP status of the failed response, or -1 when none was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
