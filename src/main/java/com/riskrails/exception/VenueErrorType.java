package com.riskrails.exception;

/**
 * Classification of a venue failure. Only the first two are worth retrying.
 */
public enum VenueErrorType {
    /** Venue asked us to slow down (HTTP 429 style). */
    RATE_LIMITED(true),
    /** Venue banned the client for a short period (HTTP 418 style). */
    TEMPORARILY_BANNED(true),
    /** Venue refused the order outright. */
    REJECTED(false),
    /** Venue does not offer the requested primitive (e.g. notional market orders). */
    UNSUPPORTED(false),
    /** Connectivity or server-side failure. */
    UNAVAILABLE(false);

    private final boolean retryable;

    VenueErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
