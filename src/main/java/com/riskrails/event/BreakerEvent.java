package com.riskrails.event;

import com.riskrails.domain.enums.BreakerType;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a risk breaker opens or closes.
 */
public class BreakerEvent extends ApplicationEvent {

    private final BreakerType breakerType;
    private final boolean open;
    private final String reason;

    public BreakerEvent(Object source, BreakerType breakerType, boolean open, String reason) {
        super(source);
        this.breakerType = breakerType;
        this.open = open;
        this.reason = reason;
    }

    public BreakerType getBreakerType() {
        return breakerType;
    }

    public boolean isOpen() {
        return open;
    }

    public String getReason() {
        return reason;
    }
}
