package com.riskrails.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Value;

/** Best bid and offer for a symbol. */
@Value
public class BookTicker {

    BigDecimal bidPrice;
    BigDecimal askPrice;

    public BigDecimal mid() {
        return bidPrice.add(askPrice).divide(BigDecimal.valueOf(2), 12, RoundingMode.HALF_UP);
    }
}
