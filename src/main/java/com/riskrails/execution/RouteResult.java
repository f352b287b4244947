package com.riskrails.execution;

import com.riskrails.domain.model.FillResult;
import com.riskrails.risk.RejectionCode;
import lombok.Getter;

/**
 * Result of routing one intent. Accepted results carry the venue outcome; rejected results
 * carry the sizing or routing reason and mean nothing was sent to the venue.
 */
@Getter
public class RouteResult {

    private final boolean accepted;
    private final FillResult fill;
    private final RejectionCode rejectionCode;
    private final String message;

    private RouteResult(boolean accepted, FillResult fill, RejectionCode rejectionCode, String message) {
        this.accepted = accepted;
        this.fill = fill;
        this.rejectionCode = rejectionCode;
        this.message = message;
    }

    public static RouteResult accepted(FillResult fill) {
        return new RouteResult(true, fill, null, null);
    }

    public static RouteResult accepted(FillResult fill, String message) {
        return new RouteResult(true, fill, null, message);
    }

    public static RouteResult rejected(RejectionCode code, String message) {
        return new RouteResult(false, null, code, message);
    }

    public boolean isRejected() {
        return !accepted;
    }
}
