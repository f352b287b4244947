package com.riskrails.venue;

import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.OrderType;
import com.riskrails.domain.enums.TimeInForce;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Order as handed to a venue client. {@code quoteAmount}, when set, asks the venue to size a
 * market order by notional itself; {@code quantity} then carries the step-rounded equivalent,
 * which adapters without a notional primitive submit instead.
 */
@Value
@Builder(toBuilder = true)
public class VenueOrderRequest {

    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal quantity;
    BigDecimal quoteAmount;
    BigDecimal price;
    TimeInForce timeInForce;
    String market;

    public boolean isNotional() {
        return quoteAmount != null;
    }
}
