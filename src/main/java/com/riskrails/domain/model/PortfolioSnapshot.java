package com.riskrails.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of the position ledger at one instant. All exposure figures are signed
 * sums of {@code quantity x lastPrice}; callers take the absolute value when comparing to caps.
 */
@Value
@Builder
public class PortfolioSnapshot {

    BigDecimal cash;
    BigDecimal fees;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    BigDecimal equity;
    List<Position> positions;
    Instant takenAt;

    public BigDecimal symbolExposure(String symbol) {
        return positions.stream()
                .filter(p -> p.getSymbol().equalsIgnoreCase(symbol))
                .map(Position::signedExposure)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal venueExposure(String venue) {
        return positions.stream()
                .filter(p -> p.getVenue().equalsIgnoreCase(venue))
                .map(Position::signedExposure)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalExposure() {
        return positions.stream().map(Position::signedExposure).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Optional<Position> position(String venue, String symbol) {
        return positions.stream()
                .filter(p -> p.getVenue().equalsIgnoreCase(venue) && p.getSymbol().equalsIgnoreCase(symbol))
                .findFirst();
    }
}
