package com.riskrails.venue;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Venue acknowledgement of an order, or its current state when polled. */
@Value
@Builder(toBuilder = true)
public class VenueOrderResponse {

    String venueOrderId;
    String clientOrderId;
    VenueOrderStatus status;
    BigDecimal originalQuantity;
    BigDecimal executedQuantity;
    BigDecimal averagePrice;
    BigDecimal price;

    public boolean hasFill() {
        return executedQuantity != null && executedQuantity.signum() > 0;
    }
}
