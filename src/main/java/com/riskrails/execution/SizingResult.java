package com.riskrails.execution;

import com.riskrails.risk.RejectionCode;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of {@link OrderSizer#size}: a venue-valid quantity and its notional, or a rejection.
 */
@Getter
public class SizingResult {

    private final BigDecimal quantity;
    private final BigDecimal notional;
    private final RejectionCode rejectionCode;
    private final String message;

    private SizingResult(BigDecimal quantity, BigDecimal notional, RejectionCode rejectionCode, String message) {
        this.quantity = quantity;
        this.notional = notional;
        this.rejectionCode = rejectionCode;
        this.message = message;
    }

    public static SizingResult sized(BigDecimal quantity, BigDecimal notional) {
        return new SizingResult(quantity, notional, null, null);
    }

    public static SizingResult rejected(RejectionCode code, String message) {
        return new SizingResult(null, null, code, message);
    }

    public boolean isRejected() {
        return rejectionCode != null;
    }
}
