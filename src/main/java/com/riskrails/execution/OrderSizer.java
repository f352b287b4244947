package com.riskrails.execution;

import com.riskrails.config.VenueProperties;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.risk.RejectionCode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Converts an intent's amount into a quantity the venue will accept.
 *
 * <p>Quote mode divides the notional by the reference price; quantity mode takes the amount
 * as given. Either way the result is snapped to the symbol's step: down by default, up on
 * venues listed in {@code riskrails.venues.round-up-venues}. The snapped quantity is then
 * validated against min quantity, min notional and max notional, so nothing below the
 * venue's minimums is ever submitted.
 */
@Component
public class OrderSizer {

    private static final int DIVISION_SCALE = 18;

    private final Set<String> roundUpVenues;

    public OrderSizer(VenueProperties venueProperties) {
        this.roundUpVenues = venueProperties.getRoundUpVenues().stream()
                .map(v -> v.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param quote          notional in quote currency, or null in quantity mode
     * @param quantity       base quantity, or null in quote mode
     * @param price          reference price used for conversion and notional checks
     * @param sizeMultiplier scale applied before rounding (1 unless slippage cutback is active)
     */
    public SizingResult size(
            String venue,
            BigDecimal quote,
            BigDecimal quantity,
            BigDecimal price,
            SymbolSpec spec,
            BigDecimal sizeMultiplier) {
        BigDecimal raw = quote != null
                ? quote.multiply(sizeMultiplier).divide(price, DIVISION_SCALE, RoundingMode.DOWN)
                : quantity.multiply(sizeMultiplier);

        BigDecimal rounded = roundToStep(raw, spec.getQuantityStep(), roundsUp(venue));

        if (rounded.signum() <= 0 || rounded.compareTo(spec.getMinQuantity()) < 0) {
            return SizingResult.rejected(
                    RejectionCode.QTY_TOO_SMALL,
                    "Quantity " + rounded.toPlainString() + " < min " + spec.getMinQuantity().toPlainString());
        }

        BigDecimal notional = rounded.multiply(price);
        if (notional.compareTo(spec.getMinNotional()) < 0) {
            return SizingResult.rejected(
                    RejectionCode.MIN_NOTIONAL,
                    "Notional " + notional.toPlainString() + " < venue min " + spec.getMinNotional().toPlainString());
        }
        if (spec.getMaxNotional() != null && notional.compareTo(spec.getMaxNotional()) > 0) {
            return SizingResult.rejected(
                    RejectionCode.MAX_NOTIONAL,
                    "Notional " + notional.toPlainString() + " > venue max " + spec.getMaxNotional().toPlainString());
        }
        return SizingResult.sized(rounded, notional);
    }

    public boolean roundsUp(String venue) {
        return roundUpVenues.contains(venue.toUpperCase(Locale.ROOT));
    }

    /** Snaps {@code value} to a whole number of steps. */
    public static BigDecimal roundToStep(BigDecimal value, BigDecimal step, boolean up) {
        BigDecimal steps = value.divide(step, 0, up ? RoundingMode.CEILING : RoundingMode.FLOOR);
        return steps.multiply(step);
    }

    /** Snaps a limit price to the tick: buys round down, sells round up. No tick means no rounding. */
    public static BigDecimal roundToTick(BigDecimal price, BigDecimal tick, OrderSide side) {
        if (tick == null) {
            return price;
        }
        return roundToStep(price, tick, side == OrderSide.SELL);
    }
}
