package com.riskrails.venue;

import com.riskrails.config.VenueProperties;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Splits {@code BASE.VENUE} symbols and picks a venue for unqualified ones.
 *
 * <p>Resolution order: an explicit {@code .VENUE} suffix, then a market hint that names a
 * registered venue, then the stablecoin-suffix rule (crypto venue), then the default venue.
 */
public class SymbolResolver {

    private final VenueProperties venueProperties;
    private final VenueRegistry venueRegistry;

    public SymbolResolver(VenueProperties venueProperties, VenueRegistry venueRegistry) {
        this.venueProperties = venueProperties;
        this.venueRegistry = venueRegistry;
    }

    public ResolvedSymbol resolve(String symbol, String marketHint) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        String base = normalized;
        String venue = null;

        int dot = normalized.indexOf('.');
        if (dot > 0 && dot < normalized.length() - 1) {
            base = normalized.substring(0, dot);
            venue = normalized.substring(dot + 1);
        }

        String market = marketHint;
        if (marketHint != null && venueRegistry.contains(marketHint)) {
            venue = marketHint.toUpperCase(Locale.ROOT);
            market = null;
        }

        if (venue == null) {
            venue = isCryptoPair(base) ? venueProperties.getCryptoVenue() : venueProperties.getDefaultVenue();
        }
        return new ResolvedSymbol(base, venue.toUpperCase(Locale.ROOT), market);
    }

    /** Base part of a symbol (everything before the first dot), upper-cased. */
    public static String baseOf(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        int dot = normalized.indexOf('.');
        return dot > 0 ? normalized.substring(0, dot) : normalized;
    }

    private boolean isCryptoPair(String base) {
        return venueProperties.getCryptoQuoteSuffixes().stream()
                .anyMatch(suffix -> base.endsWith(suffix.toUpperCase(Locale.ROOT)));
    }
}
