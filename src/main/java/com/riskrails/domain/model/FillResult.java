package com.riskrails.domain.model;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderLifecycleState;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What actually happened at the venue for one routed order (or an aggregated
 * multi-order algorithm such as TWAP). Quantities are unsigned.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FillResult {

    private String venue;
    private String symbol;
    private OrderSide side;
    private OrderType orderType;
    private ExecutionAlgorithm algorithm;
    private BigDecimal requestedQuantity;
    private BigDecimal filledQuantity;
    private BigDecimal averageFillPrice;
    private BigDecimal referencePrice;
    private BigDecimal notional;
    private BigDecimal fee;
    private BigDecimal feeBps;
    private BigDecimal slippageBps;
    private String venueOrderId;
    private int attempts;
    private OrderLifecycleState state;

    public boolean hasFill() {
        return filledQuantity != null && filledQuantity.signum() > 0;
    }
}
