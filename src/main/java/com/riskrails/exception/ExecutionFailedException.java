package com.riskrails.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Thrown by the execution router when a venue call fails terminally: a non-retryable error,
 * or a retryable one that persisted through every attempt.
 */
@Getter
public class ExecutionFailedException extends BaseException {

    private final String venue;
    private final int statusCode;
    private final String body;
    private final int attempts;

    public ExecutionFailedException(VenueException cause, int attempts) {
        super(
                ErrorCode.VENUE_ERROR,
                String.format(
                        "Execution failed on %s after %d attempt(s): status=%d body=%s",
                        cause.getVenue(), attempts, cause.getStatusCode(), cause.getBody()),
                Map.of("venue", cause.getVenue(), "statusCode", cause.getStatusCode(), "attempts", attempts),
                cause);
        this.venue = cause.getVenue();
        this.statusCode = cause.getStatusCode();
        this.body = cause.getBody();
        this.attempts = attempts;
    }
}
