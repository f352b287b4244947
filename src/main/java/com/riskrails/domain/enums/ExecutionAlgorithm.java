package com.riskrails.domain.enums;

public enum ExecutionAlgorithm {
    MARKET,
    LIMIT,
    LIMIT_CHASE,
    TWAP
}
