package com.riskrails.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every execution decision (submitted, rejected, dry-run, replayed) and for
 * operator actions such as toggling the trading switch.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ExecutionMetricsService: counts outcomes by category and reason code</li>
 * </ul>
 */
public class DecisionEvent extends ApplicationEvent {

    private final String category;
    private final String message;
    private final String strategy;
    private final Map<String, Object> context;
    private final Instant occurredAt;

    /**
     * @param source   the component that made the decision
     * @param category classification, e.g. "EXECUTION" or "SYSTEM"
     * @param message  human-readable description
     * @param strategy the originating strategy, or null
     * @param context  structured data such as status, reason code and symbol
     */
    public DecisionEvent(Object source, String category, String message, String strategy, Map<String, Object> context) {
        super(source);
        this.category = category;
        this.message = message;
        this.strategy = strategy;
        this.context = context != null ? new HashMap<>(context) : new HashMap<>();
        this.occurredAt = Instant.now();
    }

    public DecisionEvent(Object source, String category, String message) {
        this(source, category, message, null, null);
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getStrategy() {
        return strategy;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
