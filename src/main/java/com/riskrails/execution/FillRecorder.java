package com.riskrails.execution;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.Position;
import com.riskrails.event.EventPublisherHelper;
import com.riskrails.ledger.FeeSchedule;
import com.riskrails.ledger.PositionLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Books a confirmed venue fill: fee from the {@link FeeSchedule}, slippage against the
 * reference price, position update in the {@link PositionLedger}, a sample for the
 * {@link SlippageGuard}, and a fill event. Runs synchronously before the router returns.
 */
@Component
public class FillRecorder {

    private static final Logger log = LoggerFactory.getLogger(FillRecorder.class);

    private static final BigDecimal BPS = new BigDecimal("10000");

    private final PositionLedger positionLedger;
    private final FeeSchedule feeSchedule;
    private final SlippageGuard slippageGuard;
    private final EventPublisherHelper eventPublisherHelper;

    public FillRecorder(
            PositionLedger positionLedger,
            FeeSchedule feeSchedule,
            SlippageGuard slippageGuard,
            EventPublisherHelper eventPublisherHelper) {
        this.positionLedger = positionLedger;
        this.feeSchedule = feeSchedule;
        this.slippageGuard = slippageGuard;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public FillResult record(
            PreparedOrder order,
            OrderType orderType,
            ExecutionAlgorithm algorithm,
            BigDecimal requestedQuantity,
            BigDecimal filledQuantity,
            BigDecimal averagePrice,
            String venueOrderId,
            int attempts) {
        String venue = order.venueName();
        String symbol = order.symbol();
        BigDecimal referencePrice = order.getReferencePrice();
        BigDecimal price = averagePrice != null && averagePrice.signum() > 0 ? averagePrice : referencePrice;

        BigDecimal notional = filledQuantity.multiply(price);
        BigDecimal fee = feeSchedule.feeFor(venue, notional);
        BigDecimal slippageBps = slippageBps(price, referencePrice);

        Position position = positionLedger.applyFill(
                venue, symbol, order.getIntent().getSide(), filledQuantity, price, fee);
        slippageGuard.record(symbol, slippageBps);

        FillResult fill = FillResult.builder()
                .venue(venue)
                .symbol(symbol)
                .side(order.getIntent().getSide())
                .orderType(orderType)
                .algorithm(algorithm)
                .requestedQuantity(requestedQuantity)
                .filledQuantity(filledQuantity)
                .averageFillPrice(price)
                .referencePrice(referencePrice)
                .notional(notional)
                .fee(fee)
                .feeBps(feeSchedule.feeBps(venue))
                .slippageBps(slippageBps)
                .venueOrderId(venueOrderId)
                .attempts(attempts)
                .state(OrderLifecycleState.FILLED)
                .build();

        eventPublisherHelper.publishFill(this, fill, position);
        log.info(
                "Order FILLED: venue={}, symbol={}, side={}, qty={}, avgPx={}, fee={}, slippageBps={}, attempts={}",
                venue, symbol, fill.getSide(), filledQuantity, price, fee, slippageBps, attempts);
        return fill;
    }

    static BigDecimal slippageBps(BigDecimal fillPrice, BigDecimal referencePrice) {
        if (referencePrice == null || referencePrice.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return fillPrice.subtract(referencePrice).abs().multiply(BPS).divide(referencePrice, 4, RoundingMode.HALF_UP);
    }
}
