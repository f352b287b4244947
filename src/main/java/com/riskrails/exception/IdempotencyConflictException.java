package com.riskrails.exception;

import com.riskrails.domain.model.ExecutionResult;
import java.util.Map;
import lombok.Getter;

/**
 * Raised by the idempotency guard when a key cannot be claimed. A {@link Kind#REPLAYED}
 * conflict carries the stored response for the completed request; a {@link Kind#PENDING}
 * conflict means another caller holds the claim right now.
 */
@Getter
public class IdempotencyConflictException extends BaseException {

    public enum Kind {
        REPLAYED,
        PENDING
    }

    private final Kind kind;
    private final String key;
    private final ExecutionResult storedResult;

    private IdempotencyConflictException(Kind kind, String key, ExecutionResult storedResult, String message) {
        super(ErrorCode.CONFLICT, message, Map.of("key", key, "kind", kind.name()));
        this.kind = kind;
        this.key = key;
        this.storedResult = storedResult;
    }

    public static IdempotencyConflictException replayed(String key, ExecutionResult storedResult) {
        return new IdempotencyConflictException(
                Kind.REPLAYED, key, storedResult, "Request already completed for key " + key);
    }

    public static IdempotencyConflictException pending(String key) {
        return new IdempotencyConflictException(Kind.PENDING, key, null, "Request in flight for key " + key);
    }
}
