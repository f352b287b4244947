package com.riskrails.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.domain.model.Position;
import com.riskrails.exception.ExecutionFailedException;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import com.riskrails.execution.RouteResult;
import com.riskrails.risk.RejectionCode;
import com.riskrails.support.ExecutionFixture;
import com.riskrails.venue.VenueOrderRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LimitChaseExecutorTest {

    private ExecutionFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new ExecutionFixture();
        fixture.binance.setBook("ETHUSDT", new BigDecimal("2999"), new BigDecimal("3001"));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static OrderIntent chaseBuy(String quantity) {
        return OrderIntent.builder()
                .symbol("ETHUSDT")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal(quantity))
                .algorithm(ExecutionAlgorithm.LIMIT_CHASE)
                .build();
    }

    private static VenueException unavailable() {
        return new VenueException("BINANCE", VenueErrorType.UNAVAILABLE, 503, "service unavailable");
    }

    private List<VenueOrderRequest> sentOfType(OrderType type) {
        return fixture.binance.getSubmittedOrders().stream().filter(r -> r.getType() == type).toList();
    }

    @Test
    @DisplayName("Passive order filled while resting: one limit order, no market fallback")
    void fillsAtTouch() {
        fixture.onPause(duration -> fixture.binance.setBook("ETHUSDT", new BigDecimal("2998"), new BigDecimal("2999")));

        RouteResult result = fixture.limitChaseExecutor.execute(chaseBuy("0.01"));

        FillResult fill = result.getFill();
        assertThat(sentOfType(OrderType.LIMIT)).hasSize(1);
        assertThat(sentOfType(OrderType.MARKET)).isEmpty();
        assertThat(sentOfType(OrderType.LIMIT).get(0).getPrice()).isEqualByComparingTo("2999");
        assertThat(fill.getFilledQuantity()).isEqualByComparingTo("0.01");
        assertThat(fill.getAverageFillPrice()).isEqualByComparingTo("2999");
        assertThat(fill.getAlgorithm()).isEqualTo(ExecutionAlgorithm.LIMIT_CHASE);
        assertThat(fill.getState()).isEqualTo(OrderLifecycleState.FILLED);
    }

    @Test
    @DisplayName("Unfilled after every round: cancels each limit, then crosses with a market order")
    void exhausted_fallsBackToMarket() {
        AtomicInteger pauses = new AtomicInteger();
        fixture.onPause(duration -> pauses.incrementAndGet());

        RouteResult result = fixture.limitChaseExecutor.execute(chaseBuy("0.01"));

        assertThat(pauses.get()).isEqualTo(3);
        assertThat(sentOfType(OrderType.LIMIT)).hasSize(3);
        assertThat(sentOfType(OrderType.MARKET)).hasSize(1);
        assertThat(fixture.binance.getRestingOrderCount()).isZero();
        assertThat(result.getFill().getFilledQuantity()).isEqualByComparingTo("0.01");
        assertThat(result.getFill().getAverageFillPrice()).isEqualByComparingTo("3001");
    }

    @Test
    @DisplayName("Interrupted while waiting: resting order cancelled, nothing crossed")
    void interrupted_cancelsAndStops() {
        fixture.onPause(duration -> {
            throw new InterruptedException("shutdown");
        });

        RouteResult result = fixture.limitChaseExecutor.execute(chaseBuy("0.01"));

        assertThat(fixture.binance.getRestingOrderCount()).isZero();
        assertThat(sentOfType(OrderType.MARKET)).isEmpty();
        assertThat(result.getFill().hasFill()).isFalse();
        assertThat(result.getFill().getState()).isEqualTo(OrderLifecycleState.REJECTED);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("Status poll fails after the order filled: fill is booked and returned, nothing resent")
    void statusOutage_afterFill_keepsBookedFill() {
        fixture.onPause(duration -> fixture.binance.setBook("ETHUSDT", new BigDecimal("2998"), new BigDecimal("2999")));
        fixture.binance.failNextStatus(unavailable());

        RouteResult result = fixture.limitChaseExecutor.execute(chaseBuy("0.01"));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getMessage()).contains("venue failure").contains("503");
        assertThat(result.getFill().getFilledQuantity()).isEqualByComparingTo("0.01");
        assertThat(sentOfType(OrderType.LIMIT)).hasSize(1);
        assertThat(sentOfType(OrderType.MARKET)).isEmpty();
        assertThat(fixture.binance.getRestingOrderCount()).isZero();

        List<Position> positions = fixture.positionLedger.openPositions();
        assertThat(positions).hasSize(1);
        assertThat(positions.get(0).getSymbol()).isEqualTo("ETHUSDT");
        assertThat(positions.get(0).getQuantity()).isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("Status poll fails with nothing filled: resting order is cancelled, then the failure propagates")
    void statusOutage_nothingFilled_cancelsThenFails() {
        fixture.binance.failNextStatus(unavailable());

        assertThatThrownBy(() -> fixture.limitChaseExecutor.execute(chaseBuy("0.01")))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageContaining("503");

        assertThat(fixture.binance.getRestingOrderCount()).isZero();
        assertThat(sentOfType(OrderType.LIMIT)).hasSize(1);
        assertThat(fixture.positionLedger.openPositions()).isEmpty();
    }

    @Test
    @DisplayName("Poll and cancel both fail: result is accepted and flags the order that may still rest")
    void cancelOutage_reportsUnresolvedOrder() {
        fixture.binance.failNextStatus(unavailable());
        fixture.binance.failNextCancel(unavailable());

        RouteResult result = fixture.limitChaseExecutor.execute(chaseBuy("0.01"));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getMessage()).contains("may still be resting");
        assertThat(result.getFill().hasFill()).isFalse();
        assertThat(result.getFill().getState()).isEqualTo(OrderLifecycleState.FAILED);
        assertThat(fixture.binance.getRestingOrderCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Sizing rejection is returned without touching the venue")
    void sizingRejection() {
        RouteResult result = fixture.limitChaseExecutor.execute(chaseBuy("0.00001"));

        assertThat(result.getRejectionCode()).isEqualTo(RejectionCode.QTY_TOO_SMALL);
        assertThat(fixture.binance.getSubmittedOrders()).isEmpty();
    }
}
