package com.riskrails.oms;

import com.riskrails.audit.AuditService;
import com.riskrails.config.ExecutionProperties;
import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.ExecutionStatus;
import com.riskrails.domain.model.ExecutionResult;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import com.riskrails.event.EventPublisherHelper;
import com.riskrails.exception.ExecutionFailedException;
import com.riskrails.exception.IdempotencyConflictException;
import com.riskrails.execution.ExecutionRouter;
import com.riskrails.execution.LimitChaseExecutor;
import com.riskrails.execution.RouteResult;
import com.riskrails.execution.TimeSlicedExecutor;
import com.riskrails.risk.AdmissionController;
import com.riskrails.risk.AdmissionDecision;
import com.riskrails.risk.RejectionCode;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for executing an intent.
 *
 * <p>Flow:
 * <ol>
 *   <li>Resolve the idempotency key and reserve it. A completed key is replayed; a key in
 *       flight is rejected with {@code IDEMPOTENCY_PENDING}.</li>
 *   <li>Admission check. A rejection releases the claim.</li>
 *   <li>Dry run: the request override wins, then the intent's {@code dry_run} metadata, then
 *       {@code riskrails.execution.dry-run}. A dry run is stored and replayable.</li>
 *   <li>Route by algorithm. Accepted results are stored; sizing rejections and venue failures
 *       release the claim so the caller may retry.</li>
 * </ol>
 *
 * <p>Every call writes exactly one audit record and publishes one {@code DecisionEvent}.
 * Venue, risk and idempotency outcomes are returned as values. Any other runtime failure is
 * returned as {@code REJECTED} with {@code INTERNAL_ERROR} and stored under the key, so a
 * retry replays it instead of sending again.
 */
@Service
public class ExecutionFacade {

    private static final Logger log = LoggerFactory.getLogger(ExecutionFacade.class);

    private final IdempotencyKeyGenerator idempotencyKeyGenerator;
    private final IdempotencyGuard idempotencyGuard;
    private final AdmissionController admissionController;
    private final ExecutionRouter executionRouter;
    private final LimitChaseExecutor limitChaseExecutor;
    private final TimeSlicedExecutor timeSlicedExecutor;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final ExecutionProperties executionProperties;
    private final Clock clock;

    public ExecutionFacade(
            IdempotencyKeyGenerator idempotencyKeyGenerator,
            IdempotencyGuard idempotencyGuard,
            AdmissionController admissionController,
            ExecutionRouter executionRouter,
            LimitChaseExecutor limitChaseExecutor,
            TimeSlicedExecutor timeSlicedExecutor,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            ExecutionProperties executionProperties,
            Clock clock) {
        this.idempotencyKeyGenerator = idempotencyKeyGenerator;
        this.idempotencyGuard = idempotencyGuard;
        this.admissionController = admissionController;
        this.executionRouter = executionRouter;
        this.limitChaseExecutor = limitChaseExecutor;
        this.timeSlicedExecutor = timeSlicedExecutor;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.executionProperties = executionProperties;
        this.clock = clock;
    }

    public ExecutionResult execute(OrderIntent intent) {
        return execute(intent, null, null);
    }

    public ExecutionResult execute(OrderIntent intent, String idempotencyKeyOverride, Boolean dryRunOverride) {
        String key = idempotencyKeyGenerator.keyFor(intent, idempotencyKeyOverride);
        boolean dryRun = resolveDryRun(intent, dryRunOverride);

        try {
            idempotencyGuard.reserve(key);
        } catch (IdempotencyConflictException e) {
            return finish(intent, conflictResult(intent, e), dryRun);
        }

        ExecutionResult result;
        try {
            result = run(intent, key, dryRun);
        } catch (RuntimeException e) {
            log.error("Execution aborted by unexpected error: key={}, symbol={}", key, intent.getSymbol(), e);
            result = rejected(intent, key, RejectionCode.INTERNAL_ERROR.name(),
                    "Internal error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            holdAfterFailure(key, result);
        }
        return finish(intent, result, dryRun);
    }

    /**
     * Stores the internal-error result under the key, since a venue order may already have
     * been sent. Falls back to releasing the claim when the store itself fails.
     */
    private void holdAfterFailure(String key, ExecutionResult result) {
        try {
            idempotencyGuard.complete(key, result);
        } catch (RuntimeException storeFailure) {
            log.error("Could not store internal-error result, releasing key: key={}", key, storeFailure);
            try {
                idempotencyGuard.release(key);
            } catch (RuntimeException releaseFailure) {
                log.error("Could not release key after internal error: key={}", key, releaseFailure);
            }
        }
    }

    private ExecutionResult run(OrderIntent intent, String key, boolean dryRun) {
        ExecutionAlgorithm algorithm = algorithmOf(intent);
        if (algorithm == ExecutionAlgorithm.LIMIT
                && (intent.getLimitPrice() == null || intent.getLimitPrice().signum() <= 0)) {
            idempotencyGuard.release(key);
            return rejected(intent, key, RejectionCode.ORDER_SHAPE_INVALID.name(), "LIMIT requires a positive limit price");
        }

        AdmissionDecision decision = admissionController.checkOrder(
                intent.getSymbol(), intent.getSide(), intent.getQuote(), intent.getQuantity(), intent.getMarketHint());
        if (decision.isRejected()) {
            idempotencyGuard.release(key);
            return rejected(intent, key, decision.getCode().name(), decision.getMessage());
        }

        if (dryRun) {
            ExecutionResult result = base(intent, key)
                    .status(ExecutionStatus.DRY_RUN)
                    .message("Dry run: admitted, not sent")
                    .build();
            idempotencyGuard.complete(key, result);
            return result;
        }

        RouteResult routeResult;
        try {
            routeResult = route(intent, algorithm);
        } catch (ExecutionFailedException e) {
            idempotencyGuard.release(key);
            log.error("Venue failure: key={}, venue={}, status={}, attempts={}, body={}",
                    key, e.getVenue(), e.getStatusCode(), e.getAttempts(), e.getBody());
            return rejected(intent, key, RejectionCode.VENUE_FAILURE.name(), e.getMessage());
        }

        if (routeResult.isRejected()) {
            idempotencyGuard.release(key);
            return rejected(intent, key, routeResult.getRejectionCode().name(), routeResult.getMessage());
        }

        ExecutionResult result = base(intent, key)
                .status(ExecutionStatus.SUBMITTED)
                .message(routeResult.getMessage())
                .fill(routeResult.getFill())
                .build();
        idempotencyGuard.complete(key, result);
        return result;
    }

    private RouteResult route(OrderIntent intent, ExecutionAlgorithm algorithm) {
        return switch (algorithm) {
            case MARKET -> executionRouter.submit(intent);
            case LIMIT -> executionRouter.submitLimit(intent, intent.getLimitPrice(), intent.getTimeInForce());
            case LIMIT_CHASE -> limitChaseExecutor.execute(intent);
            case TWAP -> timeSlicedExecutor.execute(intent);
        };
    }

    private boolean resolveDryRun(OrderIntent intent, Boolean dryRunOverride) {
        if (dryRunOverride != null) {
            return dryRunOverride;
        }
        Boolean flag = intent.dryRunFlag();
        if (flag != null) {
            return flag;
        }
        return executionProperties.isDryRun();
    }

    private ExecutionResult conflictResult(OrderIntent intent, IdempotencyConflictException conflict) {
        if (conflict.getKind() == IdempotencyConflictException.Kind.REPLAYED) {
            return conflict.getStoredResult().toBuilder()
                    .status(ExecutionStatus.REPLAYED)
                    .replayedAt(clock.instant())
                    .build();
        }
        return rejected(intent, conflict.getKey(), RejectionCode.IDEMPOTENCY_PENDING.name(), conflict.getMessage());
    }

    private ExecutionResult finish(OrderIntent intent, ExecutionResult result, boolean dryRun) {
        auditService.recordExecution(intent, result, dryRun);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("status", result.getStatus().name());
        context.put("key", result.getIdempotencyKey());
        context.put("symbol", intent.getSymbol());
        context.put("side", String.valueOf(intent.getSide()));
        context.put("algorithm", algorithmOf(intent).name());
        if (result.getReasonCode() != null) {
            context.put("reasonCode", result.getReasonCode());
        }
        FillResult fill = result.getFill();
        if (fill != null && fill.getVenue() != null) {
            context.put("venue", fill.getVenue());
        }
        eventPublisherHelper.publishDecision(
                this, "EXECUTION", describe(intent, result), intent.getStrategy(), context);

        log.info("Execution {}: key={}, symbol={}, side={}, reason={}",
                result.getStatus(), result.getIdempotencyKey(), intent.getSymbol(), intent.getSide(),
                result.getReasonCode());
        return result;
    }

    private ExecutionResult rejected(OrderIntent intent, String key, String reasonCode, String message) {
        return base(intent, key)
                .status(ExecutionStatus.REJECTED)
                .reasonCode(reasonCode)
                .message(message)
                .build();
    }

    private ExecutionResult.ExecutionResultBuilder base(OrderIntent intent, String key) {
        return ExecutionResult.builder()
                .idempotencyKey(key)
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .quote(intent.getQuote())
                .quantity(intent.getQuantity())
                .tag(intent.getTag())
                .strategy(intent.getStrategy())
                .timestamp(clock.instant());
    }

    private static ExecutionAlgorithm algorithmOf(OrderIntent intent) {
        return intent.getAlgorithm() != null ? intent.getAlgorithm() : ExecutionAlgorithm.MARKET;
    }

    private static String describe(OrderIntent intent, ExecutionResult result) {
        String base = result.getStatus() + " " + intent.getSide() + " " + intent.getSymbol();
        return result.getReasonCode() != null ? base + " (" + result.getReasonCode() + ")" : base;
    }
}
