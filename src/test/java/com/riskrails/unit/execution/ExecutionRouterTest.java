package com.riskrails.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.TimeInForce;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.domain.model.Position;
import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.exception.ExecutionFailedException;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import com.riskrails.execution.ExecutionRouter;
import com.riskrails.execution.OrderSizer;
import com.riskrails.execution.PreparedOrder;
import com.riskrails.execution.RouteResult;
import com.riskrails.risk.RejectionCode;
import com.riskrails.spec.StaticSpecCatalog;
import com.riskrails.spec.SymbolSpecRegistry;
import com.riskrails.support.ExecutionFixture;
import com.riskrails.venue.PaperVenueClient;
import com.riskrails.venue.SymbolResolver;
import com.riskrails.venue.VenueOrderRequest;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Routes intents through the real sizing, retry and booking stack against paper venues.
 */
class ExecutionRouterTest {

    private ExecutionFixture fixture;
    private ExecutionRouter router;

    @BeforeEach
    void setUp() {
        fixture = new ExecutionFixture();
        router = fixture.executionRouter;
    }

    private static OrderIntent buyQuote(String symbol, String quote) {
        return OrderIntent.builder().symbol(symbol).side(OrderSide.BUY).quote(new BigDecimal(quote)).build();
    }

    private static OrderIntent buyQuantity(String symbol, String quantity) {
        return OrderIntent.builder().symbol(symbol).side(OrderSide.BUY).quantity(new BigDecimal(quantity)).build();
    }

    private static VenueException rateLimited(String venue) {
        return new VenueException(venue, VenueErrorType.RATE_LIMITED, 429, "{\"code\":-1003}");
    }

    // ==============================
    // ORDER PRIMITIVES
    // ==============================

    @Nested
    @DisplayName("Order primitives")
    class Primitives {

        @Test
        @DisplayName("Quote-mode market order uses the notional primitive where supported")
        void notionalPrimitive_onBinance() {
            RouteResult result = router.submit(buyQuote("BTCUSDT", "15"));

            List<VenueOrderRequest> sent = fixture.binance.getSubmittedOrders();
            assertThat(sent).hasSize(1);
            assertThat(sent.get(0).getQuoteAmount()).isEqualByComparingTo("15");
            assertThat(sent.get(0).getQuantity()).isEqualByComparingTo("0.0003");

            FillResult fill = result.getFill();
            assertThat(result.isAccepted()).isTrue();
            assertThat(fill.getFilledQuantity()).isEqualByComparingTo("0.0003");
            assertThat(fill.getNotional()).isEqualByComparingTo("15");
            assertThat(fill.getAlgorithm()).isEqualTo(ExecutionAlgorithm.MARKET);
            assertThat(fill.getState()).isEqualTo(OrderLifecycleState.FILLED);
        }

        @Test
        @DisplayName("Venue without a notional primitive fills the sized quantity in one call")
        void notionalUnsupported_venueUsesQuantity() {
            RouteResult result = router.submit(buyQuote("AAPL", "1000"));

            List<VenueOrderRequest> sent = fixture.ibkr.getSubmittedOrders();
            assertThat(sent).hasSize(1);
            assertThat(sent.get(0).isNotional()).isTrue();
            assertThat(sent.get(0).getQuantity()).isEqualByComparingTo("5");
            assertThat(result.getFill().getFilledQuantity()).isEqualByComparingTo("5");
            assertThat(result.getFill().getNotional()).isEqualByComparingTo("950");
        }

        @Test
        @DisplayName("Round-up venues never use the notional primitive")
        void roundUpVenue_sendsQuantity() {
            RouteResult result = router.submit(buyQuote("SOLUSD.KRAKEN", "100"));

            List<VenueOrderRequest> sent = fixture.kraken.getSubmittedOrders();
            assertThat(sent).hasSize(1);
            assertThat(sent.get(0).isNotional()).isFalse();
            assertThat(sent.get(0).getQuantity()).isEqualByComparingTo("0.7");
            assertThat(result.getFill().getNotional()).isEqualByComparingTo("105");
        }

        @Test
        @DisplayName("Limit price is snapped to tick and a resting order books nothing")
        void limitOrder_rests() {
            RouteResult result = router.submitLimit(
                    buyQuantity("BTCUSDT", "0.001"), new BigDecimal("49999.999"), TimeInForce.GTC);

            VenueOrderRequest sent = fixture.binance.getSubmittedOrders().get(0);
            assertThat(sent.getPrice()).isEqualByComparingTo("49999.99");
            assertThat(result.getFill().getState()).isEqualTo(OrderLifecycleState.SUBMITTING);
            assertThat(result.getFill().hasFill()).isFalse();
            assertThat(fixture.binance.getRestingOrderCount()).isEqualTo(1);
            assertThat(fixture.positionLedger.snapshot().getPositions()).isEmpty();
        }
    }

    // ==============================
    // RETRY
    // ==============================

    @Nested
    @DisplayName("Venue retry")
    class RetryPolicy {

        @Test
        @DisplayName("Two rate-limit errors then success: three submissions, one fill")
        void retriesRateLimit() {
            fixture.binance.failNext(rateLimited("BINANCE"));
            fixture.binance.failNext(rateLimited("BINANCE"));

            RouteResult result = router.submit(buyQuantity("ETHUSDT", "0.01"));

            assertThat(fixture.binance.getSubmittedOrders()).hasSize(3);
            assertThat(result.getFill().getAttempts()).isEqualTo(3);
            assertThat(fixture.positionLedger.snapshot().position("BINANCE", "ETHUSDT"))
                    .map(Position::getQuantity)
                    .hasValueSatisfying(q -> assertThat(q).isEqualByComparingTo("0.01"));
        }

        @Test
        @DisplayName("Retryable error on every attempt surfaces status and attempts")
        void retriesExhausted() {
            for (int i = 0; i < 3; i++) {
                fixture.binance.failNext(rateLimited("BINANCE"));
            }

            assertThatThrownBy(() -> router.submit(buyQuantity("ETHUSDT", "0.01")))
                    .isInstanceOf(ExecutionFailedException.class)
                    .satisfies(e -> {
                        ExecutionFailedException failure = (ExecutionFailedException) e;
                        assertThat(failure.getAttempts()).isEqualTo(3);
                        assertThat(failure.getStatusCode()).isEqualTo(429);
                        assertThat(failure.getBody()).contains("-1003");
                    });
            assertThat(fixture.positionLedger.snapshot().getPositions()).isEmpty();
        }

        @Test
        @DisplayName("Non-retryable error fails on the first attempt")
        void nonRetryable_failsImmediately() {
            fixture.binance.failNext(new VenueException("BINANCE", VenueErrorType.UNAVAILABLE, 503, "down"));

            assertThatThrownBy(() -> router.submit(buyQuantity("ETHUSDT", "0.01")))
                    .isInstanceOf(ExecutionFailedException.class)
                    .hasMessageContaining("after 1 attempt");
            assertThat(fixture.binance.getSubmittedOrders()).hasSize(1);
        }
    }

    // ==============================
    // BOOKING
    // ==============================

    @Nested
    @DisplayName("Fee, slippage and ledger")
    class Booking {

        @Test
        @DisplayName("Fee is charged at the venue rate and debited from cash")
        void feeCharged() {
            RouteResult result = router.submit(buyQuote("BTCUSDT", "15"));

            assertThat(result.getFill().getFee()).isEqualByComparingTo("0.015");
            assertThat(result.getFill().getFeeBps()).isEqualByComparingTo("10");
            assertThat(fixture.positionLedger.snapshot().getCash()).isEqualByComparingTo("99999.985");
        }

        @Test
        @DisplayName("Slippage is measured against the reference price")
        void slippageMeasured() {
            fixture.binance.setBook("BTCUSDT", new BigDecimal("49990"), new BigDecimal("50010"));

            RouteResult result = router.submit(buyQuantity("BTCUSDT", "0.001"));

            FillResult fill = result.getFill();
            assertThat(fill.getReferencePrice()).isEqualByComparingTo("50000");
            assertThat(fill.getAverageFillPrice()).isEqualByComparingTo("50010");
            assertThat(fill.getSlippageBps()).isEqualByComparingTo("2");
            verify(fixture.eventPublisherHelper).publishFill(any(), any(), any());
        }

        @Test
        @DisplayName("Live lot constraints take precedence over the static catalog")
        void liveSpecPreferred() {
            fixture.binance.setLotConstraints("BTCUSDT", SymbolSpec.builder()
                    .minQuantity(new BigDecimal("0.001"))
                    .quantityStep(new BigDecimal("0.001"))
                    .minNotional(new BigDecimal("10"))
                    .build());

            PreparedOrder order = router.prepare(buyQuote("BTCUSDT", "120"));

            assertThat(order.getQuantity()).isEqualByComparingTo("0.002");
            assertThat(order.getNotional()).isEqualByComparingTo("100");
        }
    }

    // ==============================
    // PRE-SUBMIT REJECTIONS
    // ==============================

    @Nested
    @DisplayName("Rejections before any order is sent")
    class PreSubmit {

        @Test
        @DisplayName("Unknown venue suffix is VENUE_NOT_REGISTERED")
        void unknownVenue() {
            RouteResult result = router.submit(buyQuote("BTCUSDT.COINBASE", "15"));

            assertThat(result.getRejectionCode()).isEqualTo(RejectionCode.VENUE_NOT_REGISTERED);
            assertThat(fixture.binance.getSubmittedOrders()).isEmpty();
        }

        @Test
        @DisplayName("No price at the venue is PRICE_UNAVAILABLE")
        void noPrice() {
            RouteResult result = router.submit(buyQuote("DOGEUSDT", "15"));

            assertThat(result.getRejectionCode()).isEqualTo(RejectionCode.PRICE_UNAVAILABLE);
        }

        @Test
        @DisplayName("Quantity below the lot minimum is rejected at sizing")
        void sizingRejection() {
            RouteResult result = router.submit(buyQuote("BTCUSDT", "0.1"));

            assertThat(result.getRejectionCode()).isEqualTo(RejectionCode.QTY_TOO_SMALL);
            assertThat(fixture.binance.getSubmittedOrders()).isEmpty();
        }

        @Test
        @DisplayName("Venue with no live or static spec is SPEC_MISSING")
        void specMissing() {
            PaperVenueClient bybit = new PaperVenueClient("BYBIT", fixture.clock);
            bybit.setPrice("BTCUSDT", new BigDecimal("50000"));
            VenueRegistry registry = new VenueRegistry(List.of(fixture.binance, bybit));
            SymbolSpecRegistry specs = new SymbolSpecRegistry(
                    registry, new StaticSpecCatalog(""), fixture.admissionController, Duration.ofHours(1));
            ExecutionRouter bybitRouter = new ExecutionRouter(
                    new SymbolResolver(fixture.venueProperties, registry),
                    registry,
                    specs,
                    new OrderSizer(fixture.venueProperties),
                    fixture.slippageGuard,
                    fixture.venueCallExecutor,
                    fixture.fillRecorder);

            RouteResult result = bybitRouter.submit(buyQuote("BTCUSDT.BYBIT", "15"));

            assertThat(result.getRejectionCode()).isEqualTo(RejectionCode.SPEC_MISSING);
            assertThat(bybit.getSubmittedOrders()).isEmpty();
        }
    }
}
