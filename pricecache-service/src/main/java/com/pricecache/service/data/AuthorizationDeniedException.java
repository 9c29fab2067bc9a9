package com.pricecache.service.data;

/**
 * The provider refused the request for this symbol or date span.
 * Narrow slices near plan boundaries are sometimes refused while the full range is accepted.
 */
public class AuthorizationDeniedException extends UpstreamException {

    public AuthorizationDeniedException(String message, int httpStatus) {
        super(message, httpStatus);
    }
}
