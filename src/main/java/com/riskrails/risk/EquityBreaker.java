package com.riskrails.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Trips when equity falls below the floor or draws down too far from its peak, then holds
 * for the cooldown even if equity recovers. Not thread-safe.
 */
class EquityBreaker {

    private final Clock clock;

    private BigDecimal peakEquity;
    private Instant openUntil = Instant.MIN;
    private String lastReason;

    EquityBreaker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Feeds the latest equity reading.
     *
     * @return the breach reason if this reading breaches the floor or drawdown limit, else null
     */
    String evaluate(BigDecimal equity, BigDecimal floor, Double drawdownLimitPct, Duration cooldown) {
        if (equity == null) {
            return null;
        }
        if (peakEquity == null || equity.compareTo(peakEquity) > 0) {
            peakEquity = equity;
        }

        String reason = null;
        if (floor != null && equity.compareTo(floor) < 0) {
            reason = String.format("equity %s below floor %s", equity.toPlainString(), floor.toPlainString());
        } else if (drawdownLimitPct != null && drawdownPct(equity) >= drawdownLimitPct) {
            reason = String.format("drawdown %.2f%% >= limit %.2f%%", drawdownPct(equity), drawdownLimitPct);
        }

        if (reason != null) {
            Instant until = clock.instant().plus(cooldown);
            if (until.isAfter(openUntil)) {
                openUntil = until;
            }
            lastReason = reason;
        }
        return reason;
    }

    boolean isOpen() {
        return clock.instant().isBefore(openUntil);
    }

    Duration remainingCooldown() {
        Duration remaining = Duration.between(clock.instant(), openUntil);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    double drawdownPct(BigDecimal equity) {
        if (peakEquity == null || peakEquity.signum() <= 0) {
            return 0.0;
        }
        return peakEquity.subtract(equity)
                .multiply(BigDecimal.valueOf(100))
                .divide(peakEquity, 6, RoundingMode.HALF_UP)
                .max(BigDecimal.ZERO)
                .doubleValue();
    }

    String lastReason() {
        return lastReason;
    }
}
