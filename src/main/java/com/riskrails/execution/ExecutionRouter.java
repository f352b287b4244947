package com.riskrails.execution;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.enums.TimeInForce;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.exception.ExecutionFailedException;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import com.riskrails.risk.RejectionCode;
import com.riskrails.spec.SymbolSpecRegistry;
import com.riskrails.venue.ResolvedSymbol;
import com.riskrails.venue.SymbolResolver;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueOrderRequest;
import com.riskrails.venue.VenueOrderResponse;
import com.riskrails.venue.VenueOrderStatus;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an admitted intent into a venue order and books the outcome.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Resolve the venue from the symbol suffix, market hint or routing defaults</li>
 *   <li>Fetch the reference price and the symbol spec</li>
 *   <li>Size: apply the slippage cutback multiplier, convert quote to quantity, snap to step</li>
 *   <li>Validate against the symbol spec; every sizing rejection happens before any order is sent</li>
 *   <li>Submit under the venue retry policy. Quote-mode market orders carry both the notional
 *       and the sized quantity; venues without a notional primitive submit the quantity</li>
 *   <li>Book any fill into the ledger before returning</li>
 * </ol>
 *
 * <p>Expected refusals come back as {@link RouteResult#rejected}. Terminal venue failures
 * throw {@link ExecutionFailedException}.
 */
@Service
public class ExecutionRouter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    private final SymbolResolver symbolResolver;
    private final VenueRegistry venueRegistry;
    private final SymbolSpecRegistry symbolSpecRegistry;
    private final OrderSizer orderSizer;
    private final SlippageGuard slippageGuard;
    private final VenueCallExecutor venueCallExecutor;
    private final FillRecorder fillRecorder;

    public ExecutionRouter(
            SymbolResolver symbolResolver,
            VenueRegistry venueRegistry,
            SymbolSpecRegistry symbolSpecRegistry,
            OrderSizer orderSizer,
            SlippageGuard slippageGuard,
            VenueCallExecutor venueCallExecutor,
            FillRecorder fillRecorder) {
        this.symbolResolver = symbolResolver;
        this.venueRegistry = venueRegistry;
        this.symbolSpecRegistry = symbolSpecRegistry;
        this.orderSizer = orderSizer;
        this.slippageGuard = slippageGuard;
        this.venueCallExecutor = venueCallExecutor;
        this.fillRecorder = fillRecorder;
    }

    /** Routes an intent as a market order. */
    public RouteResult submit(OrderIntent intent) {
        PreparedOrder order = prepare(intent);
        if (order.isRejected()) {
            return order.toRejection();
        }
        return submitMarket(order, order.getQuantity(), ExecutionAlgorithm.MARKET, true);
    }

    /** Routes an intent as a limit order at {@code limitPrice}, snapped to the symbol's tick. */
    public RouteResult submitLimit(OrderIntent intent, BigDecimal limitPrice, TimeInForce timeInForce) {
        PreparedOrder order = prepare(intent);
        if (order.isRejected()) {
            return order.toRejection();
        }
        BigDecimal price = OrderSizer.roundToTick(limitPrice, order.getSpec().getPriceTick(), intent.getSide());
        VenueOrderRequest request = baseRequest(order)
                .type(OrderType.LIMIT)
                .quantity(order.getQuantity())
                .price(price)
                .timeInForce(timeInForce != null ? timeInForce : TimeInForce.GTC)
                .build();
        VenueCallExecutor.Attempted<VenueOrderResponse> response = send(order, request);
        return RouteResult.accepted(
                handleResponse(order, request, response, OrderType.LIMIT, ExecutionAlgorithm.LIMIT));
    }

    /**
     * Resolves, prices and sizes an intent without sending anything.
     */
    public PreparedOrder prepare(OrderIntent intent) {
        ResolvedSymbol resolved = symbolResolver.resolve(intent.getSymbol(), intent.getMarketHint());
        Optional<VenueClient> venue = venueRegistry.find(resolved.getVenue());
        if (venue.isEmpty()) {
            return PreparedOrder.rejected(
                    intent, RejectionCode.VENUE_NOT_REGISTERED, "No client registered for venue " + resolved.getVenue());
        }

        if (slippageGuard.isScalpTag(intent.getTag()) && slippageGuard.isScalpMuted(resolved.getBase())) {
            return PreparedOrder.rejected(
                    intent, RejectionCode.SLIPPAGE_COOLDOWN, "Scalp entries muted for " + resolved.getBase());
        }

        VenueClient client = venue.get();
        Optional<BigDecimal> price = venueCallExecutor
                .call(client.name(), "lastPrice", () -> client.lastPrice(resolved.getBase()))
                .value();
        if (price.isEmpty() || price.get().signum() <= 0) {
            return PreparedOrder.rejected(
                    intent, RejectionCode.PRICE_UNAVAILABLE, "No price for " + resolved.getBase() + " on " + client.name());
        }

        Optional<SymbolSpec> spec = symbolSpecRegistry.get(resolved.getVenue(), resolved.getBase());
        if (spec.isEmpty()) {
            return PreparedOrder.rejected(
                    intent, RejectionCode.SPEC_MISSING, "No symbol spec for " + resolved.getBase() + " on " + client.name());
        }

        BigDecimal multiplier = slippageGuard.sizeMultiplier(resolved.getBase());
        SizingResult sizing = orderSizer.size(
                resolved.getVenue(), intent.getQuote(), intent.getQuantity(), price.get(), spec.get(), multiplier);
        if (sizing.isRejected()) {
            log.warn("Order rejected at sizing: symbol={}, venue={}, code={}, reason={}",
                    resolved.getBase(), resolved.getVenue(), sizing.getRejectionCode(), sizing.getMessage());
            return PreparedOrder.rejected(intent, sizing.getRejectionCode(), sizing.getMessage());
        }

        log.info("Order SIZED: venue={}, symbol={}, side={}, qty={}, notional={}, refPx={}, multiplier={}",
                resolved.getVenue(), resolved.getBase(), intent.getSide(), sizing.getQuantity(),
                sizing.getNotional(), price.get(), multiplier);
        return PreparedOrder.builder()
                .intent(intent)
                .resolved(resolved)
                .venue(client)
                .spec(spec.get())
                .referencePrice(price.get())
                .quantity(sizing.getQuantity())
                .notional(sizing.getNotional())
                .sizeMultiplier(multiplier)
                .build();
    }

    /**
     * Sends a market order for {@code quantity} of a prepared order.
     *
     * @param allowNotional whether a quote-mode intent may ask for a notional order
     */
    public RouteResult submitMarket(
            PreparedOrder order, BigDecimal quantity, ExecutionAlgorithm algorithm, boolean allowNotional) {
        OrderIntent intent = order.getIntent();
        boolean notional = allowNotional && intent.isQuoteMode() && !orderSizer.roundsUp(order.venueName());

        VenueOrderRequest.VenueOrderRequestBuilder builder =
                baseRequest(order).type(OrderType.MARKET).quantity(quantity);
        if (notional) {
            builder.quoteAmount(intent.getQuote().multiply(order.getSizeMultiplier()));
        }
        VenueOrderRequest request = builder.build();
        VenueCallExecutor.Attempted<VenueOrderResponse> response = send(order, request);
        return RouteResult.accepted(handleResponse(order, request, response, OrderType.MARKET, algorithm));
    }

    VenueCallExecutor.Attempted<VenueOrderResponse> send(PreparedOrder order, VenueOrderRequest request) {
        log.info("Order SUBMITTING: venue={}, symbol={}, side={}, type={}, qty={}, quote={}, price={}",
                order.venueName(), request.getSymbol(), request.getSide(), request.getType(),
                request.getQuantity(), request.getQuoteAmount(), request.getPrice());
        VenueClient venue = order.getVenue();
        return venueCallExecutor.call(venue.name(), "submitOrder", () -> venue.submitOrder(request));
    }

    FillResult handleResponse(
            PreparedOrder order,
            VenueOrderRequest request,
            VenueCallExecutor.Attempted<VenueOrderResponse> attempted,
            OrderType orderType,
            ExecutionAlgorithm algorithm) {
        VenueOrderResponse response = attempted.value();
        if (response.getStatus() == VenueOrderStatus.REJECTED) {
            throw new ExecutionFailedException(
                    new VenueException(order.venueName(), VenueErrorType.REJECTED, 400,
                            "order " + response.getVenueOrderId() + " rejected"),
                    attempted.attempts());
        }

        BigDecimal requested = request.getQuantity() != null ? request.getQuantity() : order.getQuantity();
        if (response.hasFill()) {
            return fillRecorder.record(
                    order,
                    orderType,
                    algorithm,
                    requested,
                    response.getExecutedQuantity(),
                    response.getAveragePrice(),
                    response.getVenueOrderId(),
                    attempted.attempts());
        }

        OrderLifecycleState state = response.getStatus().isOpen()
                ? OrderLifecycleState.SUBMITTING
                : OrderLifecycleState.REJECTED;
        log.info("Order acknowledged without fill: venue={}, id={}, status={}",
                order.venueName(), response.getVenueOrderId(), response.getStatus());
        return FillResult.builder()
                .venue(order.venueName())
                .symbol(order.symbol())
                .side(order.getIntent().getSide())
                .orderType(orderType)
                .algorithm(algorithm)
                .requestedQuantity(requested)
                .filledQuantity(BigDecimal.ZERO)
                .referencePrice(order.getReferencePrice())
                .notional(BigDecimal.ZERO)
                .fee(BigDecimal.ZERO)
                .venueOrderId(response.getVenueOrderId())
                .attempts(attempted.attempts())
                .state(state)
                .build();
    }

    private static VenueOrderRequest.VenueOrderRequestBuilder baseRequest(PreparedOrder order) {
        return VenueOrderRequest.builder()
                .clientOrderId("rr-" + UUID.randomUUID().toString().substring(0, 12))
                .symbol(order.symbol())
                .side(order.getIntent().getSide())
                .market(order.getResolved().getMarket());
    }
}
