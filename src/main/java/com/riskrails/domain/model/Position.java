package com.riskrails.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Net holding of one symbol on one venue. Quantity is signed: positive = long, negative = short.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;
    private String venue;
    private BigDecimal quantity;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;

    public boolean isFlat() {
        return quantity == null || quantity.signum() == 0;
    }

    /** Signed market value at the last known price, zero when no price is known. */
    public BigDecimal signedExposure() {
        if (quantity == null || lastPrice == null) {
            return BigDecimal.ZERO;
        }
        return quantity.multiply(lastPrice);
    }
}
