package com.riskrails.execution;

import com.riskrails.config.ExecutionProperties;
import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.exception.ExecutionFailedException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * TWAP: splits an intent into equal slices sent as market orders at a fixed interval.
 *
 * <p>Each slice goes through {@link ExecutionRouter#submit}, so it is sized, validated and
 * retried like a standalone order. A slice that is rejected or fails at the venue is logged
 * and skipped; the plan carries on. The result aggregates filled quantity, VWAP and fees.
 * If no slice fills, the last failure is reported: a venue failure is rethrown, a sizing
 * rejection is returned as a rejection.
 */
@Component
public class TimeSlicedExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeSlicedExecutor.class);

    private final ExecutionRouter executionRouter;
    private final ExecutionProperties.Twap settings;
    private final Sleeper sleeper;

    public TimeSlicedExecutor(ExecutionRouter executionRouter, ExecutionProperties executionProperties, Sleeper sleeper) {
        this.executionRouter = executionRouter;
        this.settings = executionProperties.getTwap();
        this.sleeper = sleeper;
    }

    public RouteResult execute(OrderIntent intent) {
        int slices = intent.getSlices() != null && intent.getSlices() > 0 ? intent.getSlices() : settings.getDefaultSlices();
        Duration interval = intent.getSliceInterval() != null ? intent.getSliceInterval() : settings.getDefaultInterval();
        return execute(intent, slices, interval);
    }

    public RouteResult execute(OrderIntent intent, int slices, Duration interval) {
        OrderIntent sliceIntent = intent.toBuilder()
                .quote(split(intent.getQuote(), slices))
                .quantity(split(intent.getQuantity(), slices))
                .build();

        List<FillResult> fills = new ArrayList<>();
        RouteResult lastRejection = null;
        ExecutionFailedException lastFailure = null;
        int failed = 0;

        for (int slice = 1; slice <= slices; slice++) {
            try {
                RouteResult result = executionRouter.submit(sliceIntent);
                if (result.isRejected()) {
                    failed++;
                    lastRejection = result;
                    log.warn("TWAP slice {}/{} rejected: code={}, reason={}", slice, slices,
                            result.getRejectionCode(), result.getMessage());
                } else if (result.getFill().hasFill()) {
                    fills.add(result.getFill());
                }
            } catch (ExecutionFailedException e) {
                failed++;
                lastFailure = e;
                log.warn("TWAP slice {}/{} failed at venue: {}", slice, slices, e.getMessage());
            }

            if (slice < slices && !pause(interval)) {
                log.warn("TWAP interrupted after slice {}/{}", slice, slices);
                break;
            }
        }

        if (fills.isEmpty()) {
            if (lastFailure != null) {
                throw lastFailure;
            }
            if (lastRejection != null) {
                return lastRejection;
            }
        }

        FillResult aggregate = aggregate(intent, fills);
        String note = String.format("%d/%d slices filled, %d failed", fills.size(), slices, failed);
        log.info("TWAP complete: symbol={}, {}, filledQty={}, vwap={}",
                intent.getSymbol(), note, aggregate.getFilledQuantity(), aggregate.getAverageFillPrice());
        return RouteResult.accepted(aggregate, note);
    }

    private static BigDecimal split(BigDecimal amount, int slices) {
        return amount == null ? null : amount.divide(BigDecimal.valueOf(slices), 18, RoundingMode.DOWN);
    }

    private boolean pause(Duration interval) {
        try {
            sleeper.pause(interval);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static FillResult aggregate(OrderIntent intent, List<FillResult> fills) {
        BigDecimal requested = BigDecimal.ZERO;
        BigDecimal filled = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        BigDecimal referenceNotional = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        int attempts = 0;
        for (FillResult fill : fills) {
            requested = requested.add(fill.getRequestedQuantity());
            filled = filled.add(fill.getFilledQuantity());
            notional = notional.add(fill.getNotional());
            referenceNotional = referenceNotional.add(fill.getFilledQuantity().multiply(fill.getReferencePrice()));
            fees = fees.add(fill.getFee());
            attempts += fill.getAttempts();
        }
        FillResult first = fills.isEmpty() ? null : fills.get(0);
        BigDecimal vwap = filled.signum() > 0 ? notional.divide(filled, 8, RoundingMode.HALF_UP) : null;
        BigDecimal referenceVwap = filled.signum() > 0 ? referenceNotional.divide(filled, 8, RoundingMode.HALF_UP) : null;
        return FillResult.builder()
                .venue(first != null ? first.getVenue() : null)
                .symbol(first != null ? first.getSymbol() : intent.getSymbol())
                .side(intent.getSide())
                .orderType(OrderType.MARKET)
                .algorithm(ExecutionAlgorithm.TWAP)
                .requestedQuantity(requested)
                .filledQuantity(filled)
                .averageFillPrice(vwap)
                .referencePrice(referenceVwap)
                .notional(notional)
                .fee(fees)
                .feeBps(first != null ? first.getFeeBps() : null)
                .slippageBps(vwap != null ? FillRecorder.slippageBps(vwap, referenceVwap) : null)
                .attempts(attempts)
                .state(filled.signum() > 0 ? OrderLifecycleState.FILLED : OrderLifecycleState.REJECTED)
                .build();
    }
}
