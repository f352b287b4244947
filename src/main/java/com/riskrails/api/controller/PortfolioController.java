package com.riskrails.api.controller;

import com.riskrails.domain.model.AccountSnapshot;
import com.riskrails.domain.model.PortfolioSnapshot;
import com.riskrails.exception.BusinessException;
import com.riskrails.exception.ErrorCode;
import com.riskrails.ledger.PositionLedger;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueRegistry;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the ledger and the venues' own account state.
 *
 * <ul>
 *   <li>GET /api/portfolio -- ledger snapshot: cash, fees, PnL, equity and open positions</li>
 *   <li>GET /api/portfolio/venues/{venue}/account -- account snapshot reported by the venue</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/portfolio")
public class PortfolioController {

    private final PositionLedger positionLedger;
    private final VenueRegistry venueRegistry;

    public PortfolioController(PositionLedger positionLedger, VenueRegistry venueRegistry) {
        this.positionLedger = positionLedger;
        this.venueRegistry = venueRegistry;
    }

    @GetMapping
    public ResponseEntity<PortfolioSnapshot> getPortfolio() {
        return ResponseEntity.ok(positionLedger.snapshot());
    }

    @GetMapping("/venues/{venue}/account")
    public ResponseEntity<AccountSnapshot> getVenueAccount(@PathVariable String venue) {
        String name = venue.toUpperCase(Locale.ROOT);
        VenueClient client = venueRegistry
                .find(name)
                .orElseThrow(() -> new BusinessException(
                        ErrorCode.NOT_FOUND, "Unknown venue: " + name, Map.of("venue", name)));
        return ResponseEntity.ok(client.accountSnapshot());
    }
}
