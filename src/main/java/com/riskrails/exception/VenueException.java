package com.riskrails.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Unchecked wrapper for any failure reported by a venue client. Carries the venue's
 * status code and raw body so callers can surface them verbatim.
 */
@Getter
public class VenueException extends BaseException {

    private final String venue;
    private final VenueErrorType type;
    private final int statusCode;
    private final String body;

    public VenueException(String venue, VenueErrorType type, int statusCode, String body) {
        this(venue, type, statusCode, body, null);
    }

    public VenueException(String venue, VenueErrorType type, int statusCode, String body, Throwable cause) {
        super(
                ErrorCode.VENUE_ERROR,
                String.format("%s %s (status=%d): %s", venue, type, statusCode, body),
                details(venue, type, statusCode, body),
                cause);
        this.venue = venue;
        this.type = type;
        this.statusCode = statusCode;
        this.body = body;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }

    private static Map<String, Object> details(String venue, VenueErrorType type, int statusCode, String body) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("venue", venue);
        details.put("type", type.name());
        details.put("statusCode", statusCode);
        details.put("body", body != null ? body : "");
        return details;
    }
}
