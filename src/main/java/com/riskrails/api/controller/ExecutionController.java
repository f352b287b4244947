package com.riskrails.api.controller;

import com.riskrails.api.dto.request.ExecutionRequest;
import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.model.ExecutionResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.oms.ExecutionFacade;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point to the execution facade.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/executions -- execute an intent; the {@code Idempotency-Key} header, when
 *       present, overrides the key in the body</li>
 * </ul>
 *
 * <p>Every facade outcome (submitted, rejected, dry run, replayed) is a 200 with the
 * {@link ExecutionResult}; callers branch on {@code status}.
 */
@RestController
@RequestMapping("/api/executions")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final ExecutionFacade executionFacade;
    private final Clock clock;

    public ExecutionController(ExecutionFacade executionFacade, Clock clock) {
        this.executionFacade = executionFacade;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<ExecutionResult> execute(
            @Valid @RequestBody ExecutionRequest request,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        log.info("Execution requested: {} {} quote={} qty={} algo={}",
                request.getSide(), request.getSymbol(), request.getQuote(), request.getQuantity(),
                request.getAlgorithm());

        String key = idempotencyKey != null ? idempotencyKey : request.getIdempotencyKey();
        ExecutionResult result = executionFacade.execute(toIntent(request), key, request.getDryRun());
        return ResponseEntity.ok(result);
    }

    private OrderIntent toIntent(ExecutionRequest request) {
        Map<String, Object> metadata = request.getMetadata() != null ? request.getMetadata() : Map.of();
        return OrderIntent.builder()
                .symbol(request.getSymbol())
                .side(request.getSide())
                .quote(request.getQuote())
                .quantity(request.getQuantity())
                .marketHint(request.getMarket())
                .tag(request.getTag())
                .strategy(request.getStrategy())
                .metadata(metadata)
                .algorithm(request.getAlgorithm() != null ? request.getAlgorithm() : ExecutionAlgorithm.MARKET)
                .limitPrice(request.getLimitPrice())
                .timeInForce(request.getTimeInForce())
                .slices(request.getSlices())
                .sliceInterval(request.getSliceInterval())
                .timestamp(clock.instant())
                .build();
    }
}
