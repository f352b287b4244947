package com.riskrails.risk;

import lombok.Getter;

/**
 * Result of {@link AdmissionController#checkOrder}. Rejections carry a code and a message.
 */
@Getter
public class AdmissionDecision {

    private static final AdmissionDecision ALLOWED = new AdmissionDecision(true, null, null);

    private final boolean allowed;
    private final RejectionCode code;
    private final String message;

    private AdmissionDecision(boolean allowed, RejectionCode code, String message) {
        this.allowed = allowed;
        this.code = code;
        this.message = message;
    }

    public static AdmissionDecision allowed() {
        return ALLOWED;
    }

    public static AdmissionDecision rejected(RejectionCode code, String message) {
        return new AdmissionDecision(false, code, message);
    }

    public boolean isRejected() {
        return !allowed;
    }

    @Override
    public String toString() {
        return allowed ? "ALLOWED" : code + ": " + message;
    }
}
