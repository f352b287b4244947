package com.riskrails.domain.enums;

/**
 * Outcome of a single call to the execution facade.
 */
public enum ExecutionStatus {
    /** Order reached the venue and was acknowledged (fully or partially filled). */
    SUBMITTED,
    /** Refused before reaching the venue, or the venue failed terminally. */
    REJECTED,
    /** Passed admission but was not sent because dry-run mode was active. */
    DRY_RUN,
    /** Served from the idempotency cache; no new venue call was made. */
    REPLAYED
}
