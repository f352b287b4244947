package com.riskrails.observability;

import com.riskrails.domain.model.FillResult;
import com.riskrails.event.BreakerEvent;
import com.riskrails.event.DecisionEvent;
import com.riskrails.event.FillEvent;
import com.riskrails.ledger.PositionLedger;
import com.riskrails.risk.AdmissionController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the execution core.
 *
 * <ul>
 *   <li><b>riskrails.executions</b> (counter, tags status and reason): one per facade call</li>
 *   <li><b>riskrails.fills</b> (counter, tag venue): fills booked into the ledger</li>
 *   <li><b>riskrails.fill.slippage.bps</b> (summary, tag venue): realized slippage per fill</li>
 *   <li><b>riskrails.breaker.trips</b> (counter, tag type): breaker openings</li>
 *   <li><b>riskrails.portfolio.equity</b> (gauge): ledger equity</li>
 *   <li><b>riskrails.trading.enabled</b> (gauge 0/1): effective trading flag</li>
 * </ul>
 *
 * <p>Counters are fed by Spring events; gauges are polled by Micrometer on scrape.
 */
@Service
public class ExecutionMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMetricsService.class);

    private final MeterRegistry meterRegistry;

    public ExecutionMetricsService(
            MeterRegistry meterRegistry, PositionLedger positionLedger, AdmissionController admissionController) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("riskrails.portfolio.equity", positionLedger, ledger -> ledger.snapshot()
                .getEquity()
                .doubleValue());
        meterRegistry.gauge(
                "riskrails.trading.enabled", admissionController, controller -> controller.isTradingEnabled() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onDecisionEvent(DecisionEvent event) {
        if (!"EXECUTION".equals(event.getCategory())) {
            return;
        }
        Object status = event.getContext().getOrDefault("status", "UNKNOWN");
        Object reason = event.getContext().getOrDefault("reasonCode", "none");
        Counter.builder("riskrails.executions")
                .description("Execution facade outcomes")
                .tag("status", status.toString())
                .tag("reason", reason.toString())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onFillEvent(FillEvent event) {
        FillResult fill = event.getFill();
        String venue = fill.getVenue() != null ? fill.getVenue() : "UNKNOWN";
        Counter.builder("riskrails.fills")
                .description("Fills booked into the position ledger")
                .tag("venue", venue)
                .register(meterRegistry)
                .increment();
        if (fill.getSlippageBps() != null) {
            DistributionSummary.builder("riskrails.fill.slippage.bps")
                    .description("Realized slippage against the reference price")
                    .tag("venue", venue)
                    .register(meterRegistry)
                    .record(fill.getSlippageBps().doubleValue());
        }
    }

    @EventListener
    @Order(20)
    public void onBreakerEvent(BreakerEvent event) {
        if (!event.isOpen()) {
            return;
        }
        Counter.builder("riskrails.breaker.trips")
                .description("Circuit breaker openings")
                .tag("type", event.getBreakerType().name())
                .register(meterRegistry)
                .increment();
        log.debug("Breaker trip counted: type={}, reason={}", event.getBreakerType(), event.getReason());
    }
}
