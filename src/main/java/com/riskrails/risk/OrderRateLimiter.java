package com.riskrails.risk;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding 60-second window of accepted-order timestamps. Not thread-safe; the
 * {@link AdmissionController} calls it under its own lock.
 */
class OrderRateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final Deque<Instant> accepted = new ArrayDeque<>();
    private final Clock clock;

    OrderRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records an order if the window has room.
     *
     * @return false when {@code maxPerMinute} orders were already accepted in the last 60 seconds
     */
    boolean tryAcquire(int maxPerMinute) {
        Instant now = clock.instant();
        prune(now);
        if (accepted.size() >= maxPerMinute) {
            return false;
        }
        accepted.addLast(now);
        return true;
    }

    int inWindow() {
        prune(clock.instant());
        return accepted.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!accepted.isEmpty() && !accepted.peekFirst().isAfter(cutoff)) {
            accepted.removeFirst();
        }
    }
}
