package com.riskrails.audit;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.ExecutionStatus;
import com.riskrails.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the execution audit trail. Written for every facade call, including replays,
 * pending conflicts and dry runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecord {

    private Instant recordedAt;
    private String idempotencyKey;
    private ExecutionStatus status;
    private String reasonCode;
    private String message;

    private String symbol;
    private OrderSide side;
    private BigDecimal quote;
    private BigDecimal quantity;
    private String marketHint;
    private ExecutionAlgorithm algorithm;
    private String tag;
    private String strategy;
    private boolean dryRun;

    private String venue;
    private String venueOrderId;
    private BigDecimal filledQuantity;
    private BigDecimal averageFillPrice;
    private BigDecimal fee;
    private BigDecimal slippageBps;
    private Integer attempts;

    private Map<String, Object> metadata;
}
