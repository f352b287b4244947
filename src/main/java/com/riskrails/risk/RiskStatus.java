package com.riskrails.risk;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view of the admission controller's switches, breakers and windows. */
@Value
@Builder
public class RiskStatus {

    boolean tradingEnabled;
    boolean configTradingEnabled;
    boolean runtimeTradingEnabled;
    boolean venueBreakerTripped;
    double venueErrorPct;
    int venueErrorSamples;
    boolean equityBreakerOpen;
    String equityBreakerReason;
    Duration equityCooldownRemaining;
    int ordersInWindow;
    Integer maxOrdersPerMinute;
}
