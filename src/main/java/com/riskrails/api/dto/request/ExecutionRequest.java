package com.riskrails.api.dto.request;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.TimeInForce;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/executions}. Exactly one of {@code quote} and {@code quantity}
 * should be set; the admission check rejects any other shape with {@code ORDER_SHAPE_INVALID}.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRequest {

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Side is required")
    private OrderSide side;

    @DecimalMin(value = "0", inclusive = false, message = "Quote must be positive")
    private BigDecimal quote;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be positive")
    private BigDecimal quantity;

    private String market;
    private String tag;
    private String strategy;

    private ExecutionAlgorithm algorithm;

    @DecimalMin(value = "0", inclusive = false, message = "Limit price must be positive")
    private BigDecimal limitPrice;

    private TimeInForce timeInForce;

    @Min(value = 1, message = "Slices must be at least 1")
    private Integer slices;

    private Duration sliceInterval;

    private String idempotencyKey;
    private Boolean dryRun;
    private Map<String, Object> metadata;
}
