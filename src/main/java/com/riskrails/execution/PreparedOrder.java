package com.riskrails.execution;

import com.riskrails.domain.model.OrderIntent;
import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.risk.RejectionCode;
import com.riskrails.venue.ResolvedSymbol;
import com.riskrails.venue.VenueClient;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An intent after venue resolution, spec lookup and sizing; ready to be sent. When
 * {@code rejectionCode} is set the intent failed one of those steps and nothing else is populated
 * beyond the intent itself.
 */
@Value
@Builder
public class PreparedOrder {

    OrderIntent intent;
    ResolvedSymbol resolved;
    VenueClient venue;
    SymbolSpec spec;
    BigDecimal referencePrice;
    BigDecimal quantity;
    BigDecimal notional;
    BigDecimal sizeMultiplier;
    RejectionCode rejectionCode;
    String rejectionMessage;

    static PreparedOrder rejected(OrderIntent intent, RejectionCode code, String message) {
        return PreparedOrder.builder().intent(intent).rejectionCode(code).rejectionMessage(message).build();
    }

    public boolean isRejected() {
        return rejectionCode != null;
    }

    public String venueName() {
        return resolved.getVenue();
    }

    public String symbol() {
        return resolved.getBase();
    }

    public RouteResult toRejection() {
        return RouteResult.rejected(rejectionCode, rejectionMessage);
    }
}
