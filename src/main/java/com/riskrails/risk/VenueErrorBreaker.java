package com.riskrails.risk;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling venue error-rate breaker. Every venue call outcome is recorded; the breaker is
 * tripped while the error percentage over the window is at or above the threshold and
 * clears by itself once enough failures age out. Not thread-safe.
 */
class VenueErrorBreaker {

    private record Outcome(Instant at, boolean success) {}

    private final Deque<Outcome> outcomes = new ArrayDeque<>();
    private final Clock clock;

    private boolean tripped;
    private double errorPct;

    VenueErrorBreaker(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return true if this call changed the tripped state
     */
    boolean record(boolean success, Duration window, Double thresholdPct) {
        Instant now = clock.instant();
        outcomes.addLast(new Outcome(now, success));
        return recompute(now, window, thresholdPct);
    }

    /** Re-evaluates after pruning, so an idle breaker heals as failures age out. */
    boolean refresh(Duration window, Double thresholdPct) {
        return recompute(clock.instant(), window, thresholdPct);
    }

    boolean isTripped() {
        return tripped;
    }

    double errorPct() {
        return errorPct;
    }

    int samples() {
        return outcomes.size();
    }

    private boolean recompute(Instant now, Duration window, Double thresholdPct) {
        Instant cutoff = now.minus(window);
        while (!outcomes.isEmpty() && outcomes.peekFirst().at().isBefore(cutoff)) {
            outcomes.removeFirst();
        }
        long errors = outcomes.stream().filter(o -> !o.success()).count();
        errorPct = outcomes.isEmpty() ? 0.0 : 100.0 * errors / outcomes.size();

        boolean wasTripped = tripped;
        tripped = thresholdPct != null && !outcomes.isEmpty() && errorPct >= thresholdPct;
        return wasTripped != tripped;
    }
}
