package com.riskrails.risk;

/**
 * Receives the outcome of every venue call so the venue-error breaker can track a rolling
 * error rate. Implemented by {@link AdmissionController}.
 */
public interface VenueHealthMonitor {

    void recordResult(boolean success);
}
