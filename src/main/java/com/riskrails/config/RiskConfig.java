package com.riskrails.config;

import com.riskrails.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean from application.properties.
 *
 * <p>Caps default to null (check skipped) so only what is configured is enforced.
 *
 * <p>Properties prefix: {@code riskrails.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${riskrails.risk.trading-enabled:true}") boolean tradingEnabled,
            @Value("${riskrails.risk.trade-symbols:}") List<String> tradeSymbols,
            @Value("${riskrails.risk.min-notional:#{null}}") BigDecimal minNotional,
            @Value("${riskrails.risk.max-notional:#{null}}") BigDecimal maxNotional,
            @Value("${riskrails.risk.max-orders-per-minute:#{null}}") Integer maxOrdersPerMinute,
            @Value("${riskrails.risk.exposure-cap-symbol:#{null}}") BigDecimal exposureCapSymbol,
            @Value("${riskrails.risk.exposure-cap-venue:#{null}}") BigDecimal exposureCapVenue,
            @Value("${riskrails.risk.exposure-cap-total:#{null}}") BigDecimal exposureCapTotal,
            @Value("${riskrails.risk.venue-error-breaker-pct:#{null}}") Double venueErrorBreakerPct,
            @Value("${riskrails.risk.venue-error-window:PT60S}") Duration venueErrorWindow,
            @Value("${riskrails.risk.equity-floor:#{null}}") BigDecimal equityFloor,
            @Value("${riskrails.risk.equity-drawdown-limit-pct:#{null}}") Double equityDrawdownLimitPct,
            @Value("${riskrails.risk.equity-cooldown:PT15M}") Duration equityCooldown) {
        Set<String> symbols = tradeSymbols.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return RiskLimits.builder()
                .tradingEnabled(tradingEnabled)
                .tradeSymbols(symbols)
                .minNotional(minNotional)
                .maxNotional(maxNotional)
                .maxOrdersPerMinute(maxOrdersPerMinute)
                .exposureCapSymbol(exposureCapSymbol)
                .exposureCapVenue(exposureCapVenue)
                .exposureCapTotal(exposureCapTotal)
                .venueErrorBreakerPct(venueErrorBreakerPct)
                .venueErrorWindow(venueErrorWindow)
                .equityFloor(equityFloor)
                .equityDrawdownLimitPct(equityDrawdownLimitPct)
                .equityCooldown(equityCooldown)
                .build();
    }
}
