package com.riskrails.domain.enums;

/**
 * Lifetime of a resting limit order at the venue.
 */
public enum TimeInForce {
    /** Good-till-cancelled: rests on the book until filled or cancelled. */
    GTC,
    /** Immediate-or-cancel: any unfilled remainder is cancelled by the venue. */
    IOC
}
