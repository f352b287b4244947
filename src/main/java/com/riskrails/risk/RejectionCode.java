package com.riskrails.risk;

/**
 * Machine-readable reasons an order is refused before or at the venue.
 */
public enum RejectionCode {
    // Admission
    TRADING_DISABLED,
    SYMBOL_NOT_ALLOWED,
    ORDER_SHAPE_INVALID,
    NOTIONAL_TOO_SMALL,
    NOTIONAL_TOO_LARGE,
    PRICE_UNAVAILABLE,
    EXPOSURE_SYMBOL_CAP,
    EXPOSURE_VENUE_CAP,
    EXPOSURE_TOTAL_CAP,
    ORDER_RATE_EXCEEDED,
    VENUE_BREAKER_OPEN,
    EQUITY_BREAKER_OPEN,

    // Routing and sizing
    VENUE_NOT_REGISTERED,
    SPEC_MISSING,
    QTY_TOO_SMALL,
    MIN_NOTIONAL,
    MAX_NOTIONAL,
    SLIPPAGE_COOLDOWN,

    // Facade
    IDEMPOTENCY_PENDING,
    VENUE_FAILURE,
    INTERNAL_ERROR
}
