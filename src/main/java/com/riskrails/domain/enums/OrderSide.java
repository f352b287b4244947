package com.riskrails.domain.enums;

/**
 * Direction of an order. SELL reduces (or shorts) a position, BUY increases it.
 */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL. Used to turn unsigned quantities into signed position deltas. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
