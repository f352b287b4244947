package com.riskrails.domain.model;

import com.riskrails.domain.enums.ExecutionStatus;
import com.riskrails.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response returned by the execution facade for every call. This is also the value stored
 * in the idempotency cache and replayed for repeated keys.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResult {

    private ExecutionStatus status;
    private String idempotencyKey;
    private String reasonCode;
    private String message;
    private String symbol;
    private OrderSide side;
    private BigDecimal quote;
    private BigDecimal quantity;
    private String tag;
    private String strategy;
    private FillResult fill;
    private Instant timestamp;
    private Instant replayedAt;
}
