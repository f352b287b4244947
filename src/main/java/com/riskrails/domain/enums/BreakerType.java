package com.riskrails.domain.enums;

public enum BreakerType {
    VENUE_ERROR_RATE,
    EQUITY
}
