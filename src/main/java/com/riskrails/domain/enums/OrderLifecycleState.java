package com.riskrails.domain.enums;

/**
 * States an order passes through inside the execution router.
 *
 * <pre>
 *   SIZED -> SUBMITTING -> (RETRYING -> SUBMITTING)* -> FILLED | REJECTED | FAILED
 * </pre>
 */
public enum OrderLifecycleState {
    SIZED,
    SUBMITTING,
    RETRYING,
    FILLED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == FAILED;
    }
}
