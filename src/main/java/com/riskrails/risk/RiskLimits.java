package com.riskrails.risk;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * Pre-trade limits enforced by the {@link AdmissionController}.
 *
 * <p>Null values mean the check is disabled. An empty {@code tradeSymbols} set, or one
 * containing {@code *}, allows every symbol.
 *
 * <p>Loaded from application.properties ({@code riskrails.risk.*}) by
 * {@link com.riskrails.config.RiskConfig}.
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Trading gate ====================

    /** Master switch from configuration. The runtime switch on the controller must also be on. */
    @Builder.Default
    private boolean tradingEnabled = true;

    /** Upper-case base symbols allowed to trade. */
    @Builder.Default
    private Set<String> tradeSymbols = Set.of();

    // ==================== Order size ====================

    /** Smallest quote-mode notional accepted. */
    private BigDecimal minNotional;

    /** Largest quote-mode notional accepted. */
    private BigDecimal maxNotional;

    /** Accepted orders allowed in any trailing 60 second window. */
    private Integer maxOrdersPerMinute;

    // ==================== Exposure ====================

    private BigDecimal exposureCapSymbol;
    private BigDecimal exposureCapVenue;
    private BigDecimal exposureCapTotal;

    // ==================== Breakers ====================

    /** Error percentage (0-100) over the window at or above which the venue breaker trips. */
    private Double venueErrorBreakerPct;

    @Builder.Default
    private Duration venueErrorWindow = Duration.ofSeconds(60);

    /** Equity below this trips the equity breaker. */
    private BigDecimal equityFloor;

    /** Drawdown from peak equity, in percent, at or above which the equity breaker trips. */
    private Double equityDrawdownLimitPct;

    @Builder.Default
    private Duration equityCooldown = Duration.ofMinutes(15);

    public boolean allowsSymbol(String baseSymbol) {
        if (tradeSymbols == null || tradeSymbols.isEmpty() || tradeSymbols.contains("*")) {
            return true;
        }
        return tradeSymbols.contains(baseSymbol.toUpperCase(Locale.ROOT));
    }
}
