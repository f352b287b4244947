package com.riskrails.venue;

import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.enums.TimeInForce;
import com.riskrails.domain.model.AccountSnapshot;
import com.riskrails.domain.model.BookTicker;
import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory venue used for paper trading and tests.
 *
 * <p>Fill logic:
 * <ul>
 *   <li>MARKET BUY fills at ask + slippage, MARKET SELL at bid - slippage</li>
 *   <li>LIMIT orders that cross the touch fill immediately at the touch</li>
 *   <li>Non-crossing GTC limits rest until {@link #setPrice} or {@link #setBook} moves the
 *       book through them, then fill at the limit price</li>
 *   <li>Non-crossing IOC limits are cancelled with no fill</li>
 * </ul>
 *
 * <p>Without notional support a notional request is filled by its {@code quantity}.
 *
 * <p>Bid and ask are derived from the last price and {@code spreadBps} unless a book was set
 * explicitly. Failures can be scripted with {@link #failNext(VenueException)}; each scripted
 * failure is consumed by one {@link #submitOrder} call. {@link #failNextStatus} and
 * {@link #failNextCancel} do the same for {@link #orderStatus} and {@link #cancelOrder}.
 */
public class PaperVenueClient implements VenueClient {

    private static final Logger log = LoggerFactory.getLogger(PaperVenueClient.class);

    private static final BigDecimal BPS = new BigDecimal("10000");
    private static final int QTY_SCALE = 8;

    private final String name;
    private final BigDecimal slippageBps;
    private final BigDecimal spreadBps;
    private final boolean notionalOrdersSupported;
    private final Clock clock;

    private final Map<String, BigDecimal> prices = new HashMap<>();
    private final Map<String, BookTicker> books = new HashMap<>();
    private final Map<String, SymbolSpec> lotConstraints = new HashMap<>();
    private final Map<String, BigDecimal> holdings = new HashMap<>();
    private final Map<String, VenueOrderResponse> orders = new LinkedHashMap<>();
    private final Map<String, VenueOrderRequest> restingOrders = new LinkedHashMap<>();
    private final Deque<VenueException> scriptedFailures = new ArrayDeque<>();
    private final Deque<VenueException> scriptedStatusFailures = new ArrayDeque<>();
    private final Deque<VenueException> scriptedCancelFailures = new ArrayDeque<>();
    private final List<VenueOrderRequest> submittedOrders = new ArrayList<>();
    private final AtomicLong orderSequence = new AtomicLong();

    private BigDecimal cash;

    public PaperVenueClient(
            String name,
            BigDecimal slippageBps,
            BigDecimal spreadBps,
            boolean notionalOrdersSupported,
            BigDecimal startingCash,
            Clock clock) {
        this.name = name.toUpperCase(Locale.ROOT);
        this.slippageBps = slippageBps != null ? slippageBps : BigDecimal.ZERO;
        this.spreadBps = spreadBps != null ? spreadBps : BigDecimal.ZERO;
        this.notionalOrdersSupported = notionalOrdersSupported;
        this.cash = startingCash != null ? startingCash : BigDecimal.ZERO;
        this.clock = clock;
    }

    public PaperVenueClient(String name, Clock clock) {
        this(name, BigDecimal.ZERO, BigDecimal.ZERO, true, new BigDecimal("100000"), clock);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized Optional<BigDecimal> lastPrice(String symbol) {
        return Optional.ofNullable(prices.get(key(symbol)));
    }

    @Override
    public synchronized Optional<SymbolSpec> lotConstraints(String symbol) {
        return Optional.ofNullable(lotConstraints.get(key(symbol)));
    }

    @Override
    public synchronized BookTicker bookTicker(String symbol) {
        String key = key(symbol);
        BookTicker explicit = books.get(key);
        if (explicit != null) {
            return explicit;
        }
        BigDecimal price = prices.get(key);
        if (price == null) {
            throw new VenueException(name, VenueErrorType.UNAVAILABLE, 404, "no book for " + key);
        }
        BigDecimal halfSpread = price.multiply(spreadBps).divide(BPS.multiply(BigDecimal.valueOf(2)), 12, RoundingMode.HALF_UP);
        return new BookTicker(price.subtract(halfSpread), price.add(halfSpread));
    }

    @Override
    public synchronized VenueOrderResponse submitOrder(VenueOrderRequest request) {
        submittedOrders.add(request);

        raiseScripted(scriptedFailures);

        boolean notional = request.isNotional() && notionalOrdersSupported;
        if (request.isNotional() && !notionalOrdersSupported) {
            if (request.getQuantity() == null) {
                throw new VenueException(name, VenueErrorType.UNSUPPORTED, 400, "notional market orders not supported");
            }
            log.debug("Paper venue {} has no notional orders, using qty={}", name, request.getQuantity());
        }

        String symbol = key(request.getSymbol());
        if (!prices.containsKey(symbol) && !books.containsKey(symbol)) {
            throw new VenueException(name, VenueErrorType.REJECTED, 400, "unknown symbol " + symbol);
        }

        String venueOrderId = name + "-" + orderSequence.incrementAndGet();
        BookTicker book = bookTicker(symbol);

        if (request.getType() == OrderType.MARKET) {
            BigDecimal fillPrice = marketFillPrice(book, request.getSide());
            BigDecimal quantity = notional
                    ? request.getQuoteAmount().divide(fillPrice, QTY_SCALE, RoundingMode.DOWN)
                    : request.getQuantity();
            return record(fill(venueOrderId, request, quantity, fillPrice, notional));
        }

        BigDecimal touch = request.getSide() == OrderSide.BUY ? book.getAskPrice() : book.getBidPrice();
        if (crosses(request.getSide(), request.getPrice(), touch)) {
            return record(fill(venueOrderId, request, request.getQuantity(), touch, false));
        }
        if (request.getTimeInForce() == TimeInForce.IOC) {
            return record(open(venueOrderId, request, VenueOrderStatus.CANCELED));
        }
        restingOrders.put(venueOrderId, request);
        log.debug("Paper venue {} resting {} {} {} @ {}", name, venueOrderId, request.getSide(), symbol, request.getPrice());
        return record(open(venueOrderId, request, VenueOrderStatus.NEW));
    }

    @Override
    public synchronized VenueOrderResponse orderStatus(String symbol, String venueOrderId) {
        raiseScripted(scriptedStatusFailures);
        return knownOrder(venueOrderId);
    }

    @Override
    public synchronized VenueOrderResponse cancelOrder(String symbol, String venueOrderId) {
        raiseScripted(scriptedCancelFailures);
        VenueOrderResponse response = knownOrder(venueOrderId);
        if (restingOrders.remove(venueOrderId) == null) {
            return response;
        }
        return record(response.toBuilder().status(VenueOrderStatus.CANCELED).build());
    }

    @Override
    public synchronized AccountSnapshot accountSnapshot() {
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        balances.put("CASH", cash);
        BigDecimal equity = cash;
        for (Map.Entry<String, BigDecimal> holding : holdings.entrySet()) {
            balances.put(holding.getKey(), holding.getValue());
            BigDecimal price = prices.get(holding.getKey());
            if (price != null) {
                equity = equity.add(holding.getValue().multiply(price));
            }
        }
        return AccountSnapshot.builder()
                .venue(name)
                .balances(balances)
                .equity(equity)
                .takenAt(clock.instant())
                .build();
    }

    // ---- Simulation controls ----

    /** Sets the last price and fills any resting limit orders the new price crosses. */
    public synchronized void setPrice(String symbol, BigDecimal price) {
        String key = key(symbol);
        prices.put(key, price);
        books.remove(key);
        sweepRestingOrders(key);
    }

    /** Sets an explicit book; the last price becomes the mid. */
    public synchronized void setBook(String symbol, BigDecimal bid, BigDecimal ask) {
        String key = key(symbol);
        BookTicker book = new BookTicker(bid, ask);
        books.put(key, book);
        prices.put(key, book.mid());
        sweepRestingOrders(key);
    }

    public synchronized void setLotConstraints(String symbol, SymbolSpec spec) {
        lotConstraints.put(key(symbol), spec);
    }

    public synchronized void failNext(VenueException failure) {
        scriptedFailures.add(failure);
    }

    public synchronized void failNextStatus(VenueException failure) {
        scriptedStatusFailures.add(failure);
    }

    public synchronized void failNextCancel(VenueException failure) {
        scriptedCancelFailures.add(failure);
    }

    public synchronized List<VenueOrderRequest> getSubmittedOrders() {
        return List.copyOf(submittedOrders);
    }

    public synchronized int getRestingOrderCount() {
        return restingOrders.size();
    }

    // ---- Internals ----

    private void raiseScripted(Deque<VenueException> failures) {
        VenueException scripted = failures.poll();
        if (scripted != null) {
            log.debug("Paper venue {} raising scripted failure: {}", name, scripted.getType());
            throw scripted;
        }
    }

    private VenueOrderResponse knownOrder(String venueOrderId) {
        VenueOrderResponse response = orders.get(venueOrderId);
        if (response == null) {
            throw new VenueException(name, VenueErrorType.REJECTED, 404, "unknown order " + venueOrderId);
        }
        return response;
    }

    private void sweepRestingOrders(String symbol) {
        BookTicker book = bookTicker(symbol);
        List<String> filled = new ArrayList<>();
        for (Map.Entry<String, VenueOrderRequest> entry : restingOrders.entrySet()) {
            VenueOrderRequest request = entry.getValue();
            if (!key(request.getSymbol()).equals(symbol)) {
                continue;
            }
            BigDecimal touch = request.getSide() == OrderSide.BUY ? book.getAskPrice() : book.getBidPrice();
            if (crosses(request.getSide(), request.getPrice(), touch)) {
                record(fill(entry.getKey(), request, request.getQuantity(), request.getPrice(), false));
                filled.add(entry.getKey());
            }
        }
        filled.forEach(restingOrders::remove);
    }

    private boolean crosses(OrderSide side, BigDecimal limitPrice, BigDecimal touch) {
        return side == OrderSide.BUY ? limitPrice.compareTo(touch) >= 0 : limitPrice.compareTo(touch) <= 0;
    }

    private BigDecimal marketFillPrice(BookTicker book, OrderSide side) {
        BigDecimal touch = side == OrderSide.BUY ? book.getAskPrice() : book.getBidPrice();
        BigDecimal slip = touch.multiply(slippageBps).divide(BPS, 12, RoundingMode.HALF_UP);
        return side == OrderSide.BUY ? touch.add(slip) : touch.subtract(slip);
    }

    private VenueOrderResponse fill(
            String venueOrderId, VenueOrderRequest request, BigDecimal quantity, BigDecimal price, boolean notional) {
        String symbol = key(request.getSymbol());
        BigDecimal signed = request.getSide() == OrderSide.BUY ? quantity : quantity.negate();
        holdings.merge(symbol, signed, BigDecimal::add);
        cash = cash.subtract(signed.multiply(price));
        log.debug("Paper venue {} filled {} {} {} x {} @ {}", name, venueOrderId, request.getSide(), symbol, quantity, price);
        return VenueOrderResponse.builder()
                .venueOrderId(venueOrderId)
                .clientOrderId(request.getClientOrderId())
                .status(VenueOrderStatus.FILLED)
                .originalQuantity(notional || request.getQuantity() == null ? quantity : request.getQuantity())
                .executedQuantity(quantity)
                .averagePrice(price)
                .price(request.getPrice())
                .build();
    }

    private VenueOrderResponse open(String venueOrderId, VenueOrderRequest request, VenueOrderStatus status) {
        return VenueOrderResponse.builder()
                .venueOrderId(venueOrderId)
                .clientOrderId(request.getClientOrderId())
                .status(status)
                .originalQuantity(request.getQuantity())
                .executedQuantity(BigDecimal.ZERO)
                .price(request.getPrice())
                .build();
    }

    private VenueOrderResponse record(VenueOrderResponse response) {
        orders.put(response.getVenueOrderId(), response);
        return response;
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
