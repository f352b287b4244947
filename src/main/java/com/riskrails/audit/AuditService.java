package com.riskrails.audit;

import com.riskrails.domain.model.ExecutionResult;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.OrderIntent;
import java.time.Clock;
import org.springframework.stereotype.Service;

/**
 * Builds the audit record for a facade call from the intent and its result.
 */
@Service
public class AuditService {

    private final AuditSink auditSink;
    private final Clock clock;

    public AuditService(AuditSink auditSink, Clock clock) {
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public void recordExecution(OrderIntent intent, ExecutionResult result, boolean dryRun) {
        FillResult fill = result.getFill();
        AuditRecord.AuditRecordBuilder builder = AuditRecord.builder()
                .recordedAt(clock.instant())
                .idempotencyKey(result.getIdempotencyKey())
                .status(result.getStatus())
                .reasonCode(result.getReasonCode())
                .message(result.getMessage())
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .quote(intent.getQuote())
                .quantity(intent.getQuantity())
                .marketHint(intent.getMarketHint())
                .algorithm(intent.getAlgorithm())
                .tag(intent.getTag())
                .strategy(intent.getStrategy())
                .dryRun(dryRun)
                .metadata(intent.getMetadata());
        if (fill != null) {
            builder.venue(fill.getVenue())
                    .venueOrderId(fill.getVenueOrderId())
                    .filledQuantity(fill.getFilledQuantity())
                    .averageFillPrice(fill.getAverageFillPrice())
                    .fee(fill.getFee())
                    .slippageBps(fill.getSlippageBps())
                    .attempts(fill.getAttempts());
        }
        auditSink.append(builder.build());
    }
}
