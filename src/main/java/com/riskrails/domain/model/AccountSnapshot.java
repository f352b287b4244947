package com.riskrails.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Balances reported by a venue for the trading account. */
@Value
@Builder
public class AccountSnapshot {

    String venue;
    Map<String, BigDecimal> balances;
    BigDecimal equity;
    Instant takenAt;
}
