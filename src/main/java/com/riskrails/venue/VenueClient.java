package com.riskrails.venue;

import com.riskrails.domain.model.AccountSnapshot;
import com.riskrails.domain.model.BookTicker;
import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Capability set every trading venue must provide. The execution core talks to venues only
 * through this interface; concrete clients own their wire formats and authentication.
 *
 * <p>All methods signal failure with an unchecked {@link VenueException} whose
 * {@link VenueErrorType} decides whether the router retries.
 */
public interface VenueClient {

    /** Upper-case venue name used for routing, e.g. {@code BINANCE}. */
    String name();

    /**
     * Last traded (or mark) price for a base symbol.
     *
     * @return the price, or empty if the venue has no price for the symbol
     */
    Optional<BigDecimal> lastPrice(String symbol);

    /**
     * Lot constraints as published by the venue.
     *
     * @return the raw constraints, or empty if the venue does not publish them for this symbol
     */
    Optional<SymbolSpec> lotConstraints(String symbol);

    /**
     * Submits an order. A venue without a notional primitive must handle
     * {@link VenueOrderRequest#isNotional()} requests itself by submitting the request's
     * {@code quantity}.
     *
     * @return the venue acknowledgement, including any immediate fill
     */
    VenueOrderResponse submitOrder(VenueOrderRequest request);

    /** Current balances of the trading account. */
    AccountSnapshot accountSnapshot();

    /** Best bid/ask. Venues without a book feed quote the last price on both sides. */
    default BookTicker bookTicker(String symbol) {
        BigDecimal price = lastPrice(symbol)
                .orElseThrow(() -> new VenueException(name(), VenueErrorType.UNAVAILABLE, 404, "no price for " + symbol));
        return new BookTicker(price, price);
    }

    /** Polls an order previously returned by {@link #submitOrder}. */
    default VenueOrderResponse orderStatus(String symbol, String venueOrderId) {
        throw new VenueException(name(), VenueErrorType.UNSUPPORTED, 501, "order status not supported");
    }

    /** Cancels a resting order and returns its final state. */
    default VenueOrderResponse cancelOrder(String symbol, String venueOrderId) {
        throw new VenueException(name(), VenueErrorType.UNSUPPORTED, 501, "cancel not supported");
    }
}
