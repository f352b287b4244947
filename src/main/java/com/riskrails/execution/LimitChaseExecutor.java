package com.riskrails.execution;

import com.riskrails.config.ExecutionProperties;
import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.enums.TimeInForce;
import com.riskrails.domain.model.BookTicker;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.exception.ExecutionFailedException;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueOrderRequest;
import com.riskrails.venue.VenueOrderResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Works an order passively at the touch before paying the spread.
 *
 * <p>Each round posts a GTC limit for the remaining quantity at the best bid (buys) or best
 * ask (sells), waits one interval, polls the order, then cancels whatever is still resting.
 * Fills confirmed by the poll or the cancel are booked immediately. After {@code maxChases}
 * rounds any remainder that still meets the venue minimum goes out as a market order.
 *
 * <p>A resting order is always cancelled before the round ends, including when the poll
 * fails. Once anything has filled, or an order could not be cancelled, a later venue failure
 * ends the chase with an accepted partial result that carries the failure as its message;
 * only a chase with nothing filled and nothing resting fails outright.
 */
@Component
public class LimitChaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(LimitChaseExecutor.class);

    private final ExecutionRouter executionRouter;
    private final VenueCallExecutor venueCallExecutor;
    private final FillRecorder fillRecorder;
    private final ExecutionProperties.Chase settings;
    private final Sleeper sleeper;

    public LimitChaseExecutor(
            ExecutionRouter executionRouter,
            VenueCallExecutor venueCallExecutor,
            FillRecorder fillRecorder,
            ExecutionProperties executionProperties,
            Sleeper sleeper) {
        this.executionRouter = executionRouter;
        this.venueCallExecutor = venueCallExecutor;
        this.fillRecorder = fillRecorder;
        this.settings = executionProperties.getChase();
        this.sleeper = sleeper;
    }

    public RouteResult execute(OrderIntent intent) {
        PreparedOrder order = executionRouter.prepare(intent);
        if (order.isRejected()) {
            return order.toRejection();
        }

        VenueClient venue = order.getVenue();
        String symbol = order.symbol();
        OrderSide side = intent.getSide();
        List<FillResult> fills = new ArrayList<>();
        BigDecimal remaining = order.getQuantity();
        int attempts = 0;
        int rounds = 0;
        boolean interrupted = false;
        String unresolvedOrderId = null;

        try {
            while (remaining.signum() > 0 && rounds < settings.getMaxChases()) {
                rounds++;
                BookTicker book =
                        venueCallExecutor.call(venue.name(), "bookTicker", () -> venue.bookTicker(symbol)).value();
                BigDecimal touch = side == OrderSide.BUY ? book.getBidPrice() : book.getAskPrice();
                BigDecimal price = OrderSizer.roundToTick(touch, order.getSpec().getPriceTick(), side);

                VenueOrderRequest request = VenueOrderRequest.builder()
                        .clientOrderId("rr-" + UUID.randomUUID().toString().substring(0, 12))
                        .symbol(symbol)
                        .side(side)
                        .type(OrderType.LIMIT)
                        .quantity(remaining)
                        .price(price)
                        .timeInForce(TimeInForce.GTC)
                        .market(order.getResolved().getMarket())
                        .build();
                VenueCallExecutor.Attempted<VenueOrderResponse> posted = executionRouter.send(order, request);
                attempts += posted.attempts();
                String orderId = posted.value().getVenueOrderId();
                BigDecimal booked = bookDelta(order, remaining, BigDecimal.ZERO, posted.value(), attempts, fills);
                log.info("Chase round {}/{}: {} {} {} @ {} id={}",
                        rounds, settings.getMaxChases(), side, remaining, symbol, price, orderId);

                if (posted.value().getStatus().isOpen()) {
                    unresolvedOrderId = orderId;
                    boolean open = true;
                    try {
                        if (pause()) {
                            VenueOrderResponse polled = venueCallExecutor
                                    .call(venue.name(), "orderStatus", () -> venue.orderStatus(symbol, orderId))
                                    .value();
                            booked = bookDelta(order, remaining, booked, polled, attempts, fills);
                            open = polled.getStatus().isOpen();
                        } else {
                            interrupted = true;
                        }
                    } finally {
                        if (open) {
                            booked = bookDelta(order, remaining, booked, cancel(venue, symbol, orderId), attempts, fills);
                        }
                        unresolvedOrderId = null;
                    }
                }
                remaining = remaining.subtract(booked);
                if (interrupted) {
                    break;
                }
            }

            if (remaining.signum() > 0 && !interrupted) {
                attempts += fallBackToMarket(order, remaining, rounds, fills);
            }
        } catch (ExecutionFailedException e) {
            if (fills.isEmpty() && unresolvedOrderId == null) {
                throw e;
            }
            attempts += e.getAttempts();
            FillResult partial = aggregate(order, fills, attempts);
            String note;
            if (unresolvedOrderId != null) {
                note = "Chase stopped by venue failure; order " + unresolvedOrderId
                        + " could not be cancelled and may still be resting: " + e.getMessage();
                partial = partial.toBuilder().state(OrderLifecycleState.FAILED).build();
                log.error("Chase stopped with order possibly live: symbol={}, orderId={}, filled={}",
                        symbol, unresolvedOrderId, partial.getFilledQuantity());
            } else {
                note = "Chase stopped by venue failure with fills booked: " + e.getMessage();
                log.error("Chase stopped with fills booked: symbol={}, filled={}, remaining={}",
                        symbol, partial.getFilledQuantity(), remaining);
            }
            return RouteResult.accepted(partial, note);
        }

        return RouteResult.accepted(aggregate(order, fills, attempts));
    }

    /** @return venue attempts spent by the market order */
    private int fallBackToMarket(PreparedOrder order, BigDecimal remaining, int rounds, List<FillResult> fills) {
        BigDecimal marketQty = OrderSizer.roundToStep(remaining, order.getSpec().getQuantityStep(), false);
        if (marketQty.compareTo(order.getSpec().getMinQuantity()) < 0 || marketQty.signum() <= 0) {
            log.info("Chase remainder below venue minimum, leaving unfilled: symbol={}, remaining={}",
                    order.symbol(), remaining);
            return 0;
        }
        log.info("Chase exhausted after {} rounds, falling back to market: symbol={}, qty={}",
                rounds, order.symbol(), marketQty);
        RouteResult market = executionRouter.submitMarket(order, marketQty, ExecutionAlgorithm.LIMIT_CHASE, false);
        if (market.getFill() == null) {
            return 0;
        }
        if (market.getFill().hasFill()) {
            fills.add(market.getFill());
        }
        return market.getFill().getAttempts();
    }

    private VenueOrderResponse cancel(VenueClient venue, String symbol, String orderId) {
        return venueCallExecutor.call(venue.name(), "cancelOrder", () -> venue.cancelOrder(symbol, orderId)).value();
    }

    /**
     * Books the part of {@code response.executedQuantity} not yet booked for this venue order.
     *
     * @return the total booked so far for this venue order
     */
    private BigDecimal bookDelta(
            PreparedOrder order,
            BigDecimal requested,
            BigDecimal alreadyBooked,
            VenueOrderResponse response,
            int attempts,
            List<FillResult> fills) {
        BigDecimal executed = response.getExecutedQuantity() != null ? response.getExecutedQuantity() : BigDecimal.ZERO;
        BigDecimal delta = executed.subtract(alreadyBooked);
        if (delta.signum() <= 0) {
            return alreadyBooked;
        }
        BigDecimal price = response.getAveragePrice() != null ? response.getAveragePrice() : response.getPrice();
        fills.add(fillRecorder.record(
                order, OrderType.LIMIT, ExecutionAlgorithm.LIMIT_CHASE, requested, delta, price,
                response.getVenueOrderId(), attempts));
        return executed;
    }

    private boolean pause() {
        try {
            sleeper.pause(settings.getInterval());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Limit chase interrupted, cancelling resting order");
            return false;
        }
    }

    static FillResult aggregate(PreparedOrder order, List<FillResult> fills, int attempts) {
        BigDecimal filled = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        for (FillResult fill : fills) {
            filled = filled.add(fill.getFilledQuantity());
            notional = notional.add(fill.getNotional());
            fees = fees.add(fill.getFee());
        }
        BigDecimal average = filled.signum() > 0 ? notional.divide(filled, 8, RoundingMode.HALF_UP) : null;
        return FillResult.builder()
                .venue(order.venueName())
                .symbol(order.symbol())
                .side(order.getIntent().getSide())
                .orderType(OrderType.LIMIT)
                .algorithm(ExecutionAlgorithm.LIMIT_CHASE)
                .requestedQuantity(order.getQuantity())
                .filledQuantity(filled)
                .averageFillPrice(average)
                .referencePrice(order.getReferencePrice())
                .notional(notional)
                .fee(fees)
                .slippageBps(average != null ? FillRecorder.slippageBps(average, order.getReferencePrice()) : null)
                .attempts(attempts)
                .state(filled.signum() > 0 ? OrderLifecycleState.FILLED : OrderLifecycleState.REJECTED)
                .build();
    }
}
