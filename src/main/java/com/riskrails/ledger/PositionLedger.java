package com.riskrails.ledger;

import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.model.PortfolioSnapshot;
import com.riskrails.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Net positions, cash and P&L across all venues.
 *
 * <p>The execution router is the only writer of fills ({@link #applyFill}); the background
 * mark refresher only moves last prices ({@link #updateMarkPrice}). Readers get immutable
 * {@link PortfolioSnapshot}s. A read/write lock keeps every snapshot consistent with a
 * whole number of fills.
 *
 * <p>Accounting model:
 * <ul>
 *   <li>Cash is debited by fees and credited/debited by realized P&L; notional is not moved.</li>
 *   <li>Adding to a position re-averages the entry price (VWAP).</li>
 *   <li>Reducing realizes {@code closedQty x (price - avg)} for longs, the mirror for shorts.</li>
 *   <li>Going flat resets the average to zero; flipping sets it to the fill price.</li>
 *   <li>Equity = cash + unrealized P&L.</li>
 * </ul>
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private static final int PRICE_SCALE = 8;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new HashMap<>();
    private final Clock clock;

    private BigDecimal cash;
    private BigDecimal fees = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public PositionLedger(@Value("${riskrails.ledger.starting-cash:100000}") BigDecimal startingCash, Clock clock) {
        this.cash = startingCash;
        this.clock = clock;
    }

    /**
     * Applies a confirmed fill. {@code quantity} is unsigned; {@code side} gives the direction.
     *
     * @return a copy of the position after the fill
     */
    public Position applyFill(
            String venue, String symbol, OrderSide side, BigDecimal quantity, BigDecimal price, BigDecimal fee) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive: " + quantity);
        }
        String key = key(venue, symbol);
        BigDecimal signedQty = side == OrderSide.BUY ? quantity : quantity.negate();
        BigDecimal feePaid = fee != null ? fee : BigDecimal.ZERO;

        lock.writeLock().lock();
        try {
            Position position = positions.computeIfAbsent(key, k -> emptyPosition(venue, symbol));
            BigDecimal previousQty = position.getQuantity();
            BigDecimal newQty = previousQty.add(signedQty);

            boolean closing = previousQty.signum() != 0 && previousQty.signum() != signedQty.signum();
            if (closing) {
                BigDecimal closedQty = previousQty.abs().min(signedQty.abs());
                BigDecimal perUnit = price.subtract(position.getAveragePrice());
                BigDecimal realized = previousQty.signum() > 0
                        ? perUnit.multiply(closedQty)
                        : perUnit.negate().multiply(closedQty);
                position.setRealizedPnl(position.getRealizedPnl().add(realized));
                realizedPnl = realizedPnl.add(realized);
                cash = cash.add(realized);
            }

            if (!closing) {
                BigDecimal cost = position.getAveragePrice().multiply(previousQty.abs()).add(price.multiply(signedQty.abs()));
                position.setAveragePrice(cost.divide(newQty.abs(), PRICE_SCALE, RoundingMode.HALF_UP));
            } else if (newQty.signum() == 0) {
                position.setAveragePrice(BigDecimal.ZERO);
            } else if (newQty.signum() != previousQty.signum()) {
                position.setAveragePrice(price);
            }

            cash = cash.subtract(feePaid);
            fees = fees.add(feePaid);

            position.setQuantity(newQty);
            position.setLastPrice(price);
            position.setUnrealizedPnl(unrealized(position));
            lastPrices.put(key, price);

            Position copy = position.toBuilder().build();
            if (newQty.signum() == 0) {
                positions.remove(key);
            }

            log.debug(
                    "Fill applied: venue={}, symbol={}, side={}, qty={}, price={}, fee={}, position={}",
                    venue, symbol, side, quantity, price, feePaid, newQty);
            return copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Moves the mark price for a symbol and re-marks its unrealized P&L. No position is created. */
    public void updateMarkPrice(String venue, String symbol, BigDecimal price) {
        String key = key(venue, symbol);
        lock.writeLock().lock();
        try {
            lastPrices.put(key, price);
            Position position = positions.get(key);
            if (position != null) {
                position.setLastPrice(price);
                position.setUnrealizedPnl(unrealized(position));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<BigDecimal> lastPrice(String venue, String symbol) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastPrices.get(key(venue, symbol)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** (venue, symbol) pairs with an open position, for the mark refresher. */
    public List<Position> openPositions() {
        lock.readLock().lock();
        try {
            return positions.values().stream().map(p -> p.toBuilder().build()).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public PortfolioSnapshot snapshot() {
        lock.readLock().lock();
        try {
            List<Position> copies = new ArrayList<>(positions.size());
            BigDecimal unrealized = BigDecimal.ZERO;
            for (Position position : positions.values()) {
                copies.add(position.toBuilder().build());
                unrealized = unrealized.add(position.getUnrealizedPnl());
            }
            return PortfolioSnapshot.builder()
                    .cash(cash)
                    .fees(fees)
                    .realizedPnl(realizedPnl)
                    .unrealizedPnl(unrealized)
                    .equity(cash.add(unrealized))
                    .positions(List.copyOf(copies))
                    .takenAt(clock.instant())
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static BigDecimal unrealized(Position position) {
        if (position.getLastPrice() == null || position.getQuantity().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return position.getLastPrice().subtract(position.getAveragePrice()).multiply(position.getQuantity());
    }

    private static Position emptyPosition(String venue, String symbol) {
        return Position.builder()
                .venue(venue.toUpperCase(Locale.ROOT))
                .symbol(symbol.toUpperCase(Locale.ROOT))
                .quantity(BigDecimal.ZERO)
                .averagePrice(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .build();
    }

    private static String key(String venue, String symbol) {
        return venue.toUpperCase(Locale.ROOT) + ":" + symbol.toUpperCase(Locale.ROOT);
    }
}
