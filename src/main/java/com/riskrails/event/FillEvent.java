package com.riskrails.event;

import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the execution router after a fill has been applied to the position ledger.
 */
public class FillEvent extends ApplicationEvent {

    private final FillResult fill;
    private final Position position;

    public FillEvent(Object source, FillResult fill, Position position) {
        super(source);
        this.fill = fill;
        this.position = position;
    }

    public FillResult getFill() {
        return fill;
    }

    /** Position after the fill was applied. */
    public Position getPosition() {
        return position;
    }
}
