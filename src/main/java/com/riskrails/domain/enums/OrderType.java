package com.riskrails.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
