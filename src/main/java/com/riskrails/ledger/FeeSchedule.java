package com.riskrails.ledger;

import com.riskrails.config.VenueProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Taker fee rates per venue, in basis points of filled notional.
 */
@Component
public class FeeSchedule {

    private static final BigDecimal BPS = new BigDecimal("10000");

    private final Map<String, BigDecimal> feeBpsByVenue;

    public FeeSchedule(VenueProperties venueProperties) {
        this.feeBpsByVenue = venueProperties.getFeeBps().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toUpperCase(Locale.ROOT), Map.Entry::getValue));
    }

    public BigDecimal feeBps(String venue) {
        return feeBpsByVenue.getOrDefault(venue.toUpperCase(Locale.ROOT), BigDecimal.ZERO);
    }

    /** Fee charged for {@code notional} on {@code venue}, rounded to 8 decimals. */
    public BigDecimal feeFor(String venue, BigDecimal notional) {
        return notional.abs().multiply(feeBps(venue)).divide(BPS, 8, RoundingMode.HALF_UP);
    }
}
