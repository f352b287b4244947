package com.riskrails.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Lot constraints for one symbol on one venue.
 *
 * <p>A normalized spec always has a positive {@code quantityStep}. A null
 * {@code maxNotional} means uncapped and a null {@code priceTick} means prices
 * are sent unrounded.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SymbolSpec {

    public static final BigDecimal DEFAULT_STEP = new BigDecimal("0.000001");

    BigDecimal minQuantity;
    BigDecimal quantityStep;
    BigDecimal minNotional;
    BigDecimal maxNotional;
    BigDecimal priceTick;

    /**
     * Returns a copy with invalid values repaired: a non-positive or missing step becomes
     * {@link #DEFAULT_STEP}, negative minimums become zero, and a non-positive max notional
     * or tick is dropped.
     */
    public SymbolSpec normalized() {
        return SymbolSpec.builder()
                .minQuantity(nonNegative(minQuantity))
                .quantityStep(isPositive(quantityStep) ? quantityStep : DEFAULT_STEP)
                .minNotional(nonNegative(minNotional))
                .maxNotional(isPositive(maxNotional) ? maxNotional : null)
                .priceTick(isPositive(priceTick) ? priceTick : null)
                .build();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value == null || value.signum() < 0 ? BigDecimal.ZERO : value;
    }
}
