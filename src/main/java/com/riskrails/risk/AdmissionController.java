package com.riskrails.risk;

import com.riskrails.domain.enums.BreakerType;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.model.PortfolioSnapshot;
import com.riskrails.event.EventPublisherHelper;
import com.riskrails.exception.VenueException;
import com.riskrails.ledger.PositionLedger;
import com.riskrails.venue.ResolvedSymbol;
import com.riskrails.venue.SymbolResolver;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade risk rails. Every order passes {@link #checkOrder} before it is routed, and every
 * venue call reports back through {@link #recordResult}.
 *
 * <p>Checks run in this order and stop at the first failure:
 * <ol>
 *   <li>Venue-error breaker, then equity breaker cooldown</li>
 *   <li>Trading flag (configuration AND runtime switch)</li>
 *   <li>Symbol allow-list, on the base symbol</li>
 *   <li>Order shape: exactly one positive quote or quantity</li>
 *   <li>Notional bounds (quote mode)</li>
 *   <li>Post-trade exposure per symbol, per venue and in total, from one ledger snapshot;
 *       the same snapshot feeds the equity breaker. A quantity-mode order is priced from the
 *       ledger's last price, else from the venue; no price is needed when no cap is set</li>
 *   <li>Order-rate window; only an order that passes everything consumes a slot</li>
 * </ol>
 *
 * <p>All state lives behind this object's monitor, so a check observes one consistent view of
 * the rate window, the error window and the ledger snapshot. Rejections are values, never
 * exceptions, and admission never retries.
 */
@Service
public class AdmissionController implements VenueHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final RiskLimits riskLimits;
    private final PositionLedger positionLedger;
    private final SymbolResolver symbolResolver;
    private final VenueRegistry venueRegistry;
    private final EventPublisherHelper eventPublisherHelper;

    private final OrderRateLimiter rateLimiter;
    private final VenueErrorBreaker venueErrorBreaker;
    private final EquityBreaker equityBreaker;

    /** Operator kill switch layered over the configured flag. */
    private final AtomicBoolean runtimeTradingEnabled = new AtomicBoolean(true);

    public AdmissionController(
            RiskLimits riskLimits,
            PositionLedger positionLedger,
            SymbolResolver symbolResolver,
            VenueRegistry venueRegistry,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.riskLimits = riskLimits;
        this.positionLedger = positionLedger;
        this.symbolResolver = symbolResolver;
        this.venueRegistry = venueRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.rateLimiter = new OrderRateLimiter(clock);
        this.venueErrorBreaker = new VenueErrorBreaker(clock);
        this.equityBreaker = new EquityBreaker(clock);
    }

    public AdmissionDecision checkOrder(
            String symbol, OrderSide side, BigDecimal quote, BigDecimal quantity, String market) {
        AdmissionDecision decision;
        synchronized (this) {
            decision = evaluate(symbol, side, quote, quantity, market);
        }
        if (decision.isRejected()) {
            log.warn("Order rejected by admission: symbol={}, side={}, reason={}", symbol, side, decision);
        }
        return decision;
    }

    @Override
    public void recordResult(boolean success) {
        synchronized (this) {
            boolean changed = venueErrorBreaker.record(
                    success, riskLimits.getVenueErrorWindow(), riskLimits.getVenueErrorBreakerPct());
            if (changed) {
                announceVenueBreaker();
            }
        }
    }

    public void setTradingEnabled(boolean enabled, String reason) {
        boolean previous = runtimeTradingEnabled.getAndSet(enabled);
        if (previous == enabled) {
            return;
        }
        if (enabled) {
            log.info("Trading switch ENABLED: reason={}", reason);
        } else {
            log.warn("Trading switch DISABLED: reason={}", reason);
        }
        eventPublisherHelper.publishDecision(
                this, "SYSTEM", "Trading " + (enabled ? "enabled" : "disabled") + ": " + reason);
    }

    public boolean isTradingEnabled() {
        return riskLimits.isTradingEnabled() && runtimeTradingEnabled.get();
    }

    public synchronized RiskStatus status() {
        if (venueErrorBreaker.refresh(riskLimits.getVenueErrorWindow(), riskLimits.getVenueErrorBreakerPct())) {
            announceVenueBreaker();
        }
        return RiskStatus.builder()
                .tradingEnabled(isTradingEnabled())
                .configTradingEnabled(riskLimits.isTradingEnabled())
                .runtimeTradingEnabled(runtimeTradingEnabled.get())
                .venueBreakerTripped(venueErrorBreaker.isTripped())
                .venueErrorPct(venueErrorBreaker.errorPct())
                .venueErrorSamples(venueErrorBreaker.samples())
                .equityBreakerOpen(equityBreaker.isOpen())
                .equityBreakerReason(equityBreaker.lastReason())
                .equityCooldownRemaining(equityBreaker.remainingCooldown())
                .ordersInWindow(rateLimiter.inWindow())
                .maxOrdersPerMinute(riskLimits.getMaxOrdersPerMinute())
                .build();
    }

    // ==================== Checks ====================

    private AdmissionDecision evaluate(
            String symbol, OrderSide side, BigDecimal quote, BigDecimal quantity, String market) {
        if (venueErrorBreaker.refresh(riskLimits.getVenueErrorWindow(), riskLimits.getVenueErrorBreakerPct())) {
            announceVenueBreaker();
        }
        if (venueErrorBreaker.isTripped()) {
            return AdmissionDecision.rejected(
                    RejectionCode.VENUE_BREAKER_OPEN,
                    String.format("Venue error rate %.1f%% >= %.1f%%", venueErrorBreaker.errorPct(),
                            riskLimits.getVenueErrorBreakerPct()));
        }
        if (equityBreaker.isOpen()) {
            return AdmissionDecision.rejected(
                    RejectionCode.EQUITY_BREAKER_OPEN,
                    "Equity breaker cooling down for " + equityBreaker.remainingCooldown().toSeconds() + "s");
        }

        if (!isTradingEnabled()) {
            return AdmissionDecision.rejected(RejectionCode.TRADING_DISABLED, "Trading is disabled");
        }

        if (symbol == null || symbol.isBlank()) {
            return AdmissionDecision.rejected(RejectionCode.ORDER_SHAPE_INVALID, "Symbol is required");
        }
        ResolvedSymbol resolved = symbolResolver.resolve(symbol, market);
        if (!riskLimits.allowsSymbol(resolved.getBase())) {
            return AdmissionDecision.rejected(
                    RejectionCode.SYMBOL_NOT_ALLOWED, resolved.getBase() + " is not in the trade allow-list");
        }

        AdmissionDecision shape = checkShape(side, quote, quantity);
        if (shape.isRejected()) {
            return shape;
        }

        if (quote != null) {
            if (riskLimits.getMinNotional() != null && quote.compareTo(riskLimits.getMinNotional()) < 0) {
                return AdmissionDecision.rejected(
                        RejectionCode.NOTIONAL_TOO_SMALL,
                        "Notional " + quote.toPlainString() + " < min " + riskLimits.getMinNotional().toPlainString());
            }
            if (riskLimits.getMaxNotional() != null && quote.compareTo(riskLimits.getMaxNotional()) > 0) {
                return AdmissionDecision.rejected(
                        RejectionCode.NOTIONAL_TOO_LARGE,
                        "Notional " + quote.toPlainString() + " > max " + riskLimits.getMaxNotional().toPlainString());
            }
        }

        PortfolioSnapshot snapshot = positionLedger.snapshot();
        AdmissionDecision exposure = checkExposure(resolved, side, quote, quantity, snapshot);
        if (exposure.isRejected()) {
            return exposure;
        }

        String equityBreach = equityBreaker.evaluate(
                snapshot.getEquity(),
                riskLimits.getEquityFloor(),
                riskLimits.getEquityDrawdownLimitPct(),
                riskLimits.getEquityCooldown());
        if (equityBreach != null) {
            log.warn("Equity breaker OPEN: {} (cooldown {})", equityBreach, riskLimits.getEquityCooldown());
            eventPublisherHelper.publishBreakerOpened(this, BreakerType.EQUITY, equityBreach);
            return AdmissionDecision.rejected(RejectionCode.EQUITY_BREAKER_OPEN, equityBreach);
        }

        Integer maxPerMinute = riskLimits.getMaxOrdersPerMinute();
        if (maxPerMinute != null && !rateLimiter.tryAcquire(maxPerMinute)) {
            return AdmissionDecision.rejected(
                    RejectionCode.ORDER_RATE_EXCEEDED, "Max " + maxPerMinute + " orders/min exceeded");
        }
        return AdmissionDecision.allowed();
    }

    private AdmissionDecision checkShape(OrderSide side, BigDecimal quote, BigDecimal quantity) {
        if (side == null) {
            return AdmissionDecision.rejected(RejectionCode.ORDER_SHAPE_INVALID, "Side is required");
        }
        if ((quote == null) == (quantity == null)) {
            return AdmissionDecision.rejected(
                    RejectionCode.ORDER_SHAPE_INVALID, "Exactly one of quote or quantity must be given");
        }
        BigDecimal amount = quote != null ? quote : quantity;
        if (amount.signum() <= 0) {
            return AdmissionDecision.rejected(
                    RejectionCode.ORDER_SHAPE_INVALID, "Order amount must be positive: " + amount.toPlainString());
        }
        return AdmissionDecision.allowed();
    }

    private AdmissionDecision checkExposure(
            ResolvedSymbol resolved,
            OrderSide side,
            BigDecimal quote,
            BigDecimal quantity,
            PortfolioSnapshot snapshot) {
        if (riskLimits.getExposureCapSymbol() == null
                && riskLimits.getExposureCapVenue() == null
                && riskLimits.getExposureCapTotal() == null) {
            return AdmissionDecision.allowed();
        }
        BigDecimal notional;
        if (quote != null) {
            notional = quote;
        } else {
            Optional<BigDecimal> price = referencePrice(resolved);
            if (price.isEmpty()) {
                return AdmissionDecision.rejected(
                        RejectionCode.PRICE_UNAVAILABLE,
                        "No known price for " + resolved.getBase() + " on " + resolved.getVenue());
            }
            notional = quantity.multiply(price.get());
        }
        BigDecimal delta = side == OrderSide.BUY ? notional : notional.negate();

        BigDecimal symbolAfter = snapshot.symbolExposure(resolved.getBase()).add(delta).abs();
        if (exceeds(symbolAfter, riskLimits.getExposureCapSymbol())) {
            return capRejection(RejectionCode.EXPOSURE_SYMBOL_CAP, "Symbol", symbolAfter, riskLimits.getExposureCapSymbol());
        }
        BigDecimal venueAfter = snapshot.venueExposure(resolved.getVenue()).add(delta).abs();
        if (exceeds(venueAfter, riskLimits.getExposureCapVenue())) {
            return capRejection(RejectionCode.EXPOSURE_VENUE_CAP, "Venue", venueAfter, riskLimits.getExposureCapVenue());
        }
        BigDecimal totalAfter = snapshot.totalExposure().add(delta).abs();
        if (exceeds(totalAfter, riskLimits.getExposureCapTotal())) {
            return capRejection(RejectionCode.EXPOSURE_TOTAL_CAP, "Total", totalAfter, riskLimits.getExposureCapTotal());
        }
        return AdmissionDecision.allowed();
    }

    private Optional<BigDecimal> referencePrice(ResolvedSymbol resolved) {
        Optional<BigDecimal> cached = positionLedger.lastPrice(resolved.getVenue(), resolved.getBase());
        if (cached.isPresent()) {
            return cached;
        }
        Optional<VenueClient> venue = venueRegistry.find(resolved.getVenue());
        if (venue.isEmpty()) {
            return Optional.empty();
        }
        try {
            return venue.get().lastPrice(resolved.getBase()).filter(price -> price.signum() > 0);
        } catch (VenueException e) {
            log.warn("Venue price lookup failed: venue={}, symbol={}, type={}, status={}",
                    resolved.getVenue(), resolved.getBase(), e.getType(), e.getStatusCode());
            return Optional.empty();
        }
    }

    private static boolean exceeds(BigDecimal value, BigDecimal cap) {
        return cap != null && value.compareTo(cap) > 0;
    }

    private static AdmissionDecision capRejection(RejectionCode code, String scope, BigDecimal after, BigDecimal cap) {
        return AdmissionDecision.rejected(
                code,
                String.format("%s exposure after trade %s > cap %s", scope, after.toPlainString(), cap.toPlainString()));
    }

    private void announceVenueBreaker() {
        String reason = String.format(
                "error rate %.1f%% over %d calls in %s",
                venueErrorBreaker.errorPct(), venueErrorBreaker.samples(), riskLimits.getVenueErrorWindow());
        if (venueErrorBreaker.isTripped()) {
            log.warn("Venue error breaker TRIPPED: {}", reason);
            eventPublisherHelper.publishBreakerOpened(this, BreakerType.VENUE_ERROR_RATE, reason);
        } else {
            log.info("Venue error breaker RESET: {}", reason);
            eventPublisherHelper.publishBreakerClosed(this, BreakerType.VENUE_ERROR_RATE, reason);
        }
    }
}
