package com.riskrails.ledger;

import com.riskrails.domain.model.Position;
import com.riskrails.exception.VenueException;
import com.riskrails.venue.ResolvedSymbol;
import com.riskrails.venue.SymbolResolver;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background task that keeps ledger mark prices fresh for open positions and for the
 * configured watch list ({@code riskrails.ledger.watch-symbols}, e.g. {@code BTCUSDT,AAPL.IBKR}).
 *
 * <p>It only ever calls {@link PositionLedger#updateMarkPrice}; equity and exposure
 * limits are evaluated by the admission controller on the next order, never from here.
 * A failed quote is logged and the symbol keeps its previous mark.
 */
@Component
public class MarkPriceRefresher {

    private static final Logger log = LoggerFactory.getLogger(MarkPriceRefresher.class);

    private final PositionLedger positionLedger;
    private final VenueRegistry venueRegistry;
    private final SymbolResolver symbolResolver;
    private final List<String> watchSymbols;

    public MarkPriceRefresher(
            PositionLedger positionLedger,
            VenueRegistry venueRegistry,
            SymbolResolver symbolResolver,
            @Value("${riskrails.ledger.watch-symbols:}") List<String> watchSymbols) {
        this.positionLedger = positionLedger;
        this.venueRegistry = venueRegistry;
        this.symbolResolver = symbolResolver;
        this.watchSymbols = watchSymbols;
    }

    @Scheduled(fixedDelayString = "${riskrails.ledger.mark-refresh-interval-ms:5000}")
    public void refresh() {
        Set<ResolvedSymbol> targets = new LinkedHashSet<>();
        for (Position position : positionLedger.openPositions()) {
            targets.add(new ResolvedSymbol(position.getSymbol(), position.getVenue(), null));
        }
        for (String symbol : watchSymbols) {
            if (!symbol.isBlank()) {
                targets.add(symbolResolver.resolve(symbol, null));
            }
        }

        int updated = 0;
        for (ResolvedSymbol target : targets) {
            if (refreshOne(target)) {
                updated++;
            }
        }
        log.debug("Mark refresh complete: targets={}, updated={}", targets.size(), updated);
    }

    private boolean refreshOne(ResolvedSymbol target) {
        Optional<VenueClient> client = venueRegistry.find(target.getVenue());
        if (client.isEmpty()) {
            return false;
        }
        try {
            Optional<BigDecimal> price = client.get().lastPrice(target.getBase());
            price.ifPresent(p -> positionLedger.updateMarkPrice(target.getVenue(), target.getBase(), p));
            return price.isPresent();
        } catch (VenueException e) {
            log.warn("Mark refresh failed: venue={}, symbol={}, error={}", target.getVenue(), target.getBase(), e.getMessage());
            return false;
        }
    }
}
