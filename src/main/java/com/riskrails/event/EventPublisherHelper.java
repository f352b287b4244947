package com.riskrails.event;

import com.riskrails.domain.enums.BreakerType;
import com.riskrails.domain.model.FillResult;
import com.riskrails.domain.model.Position;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Listeners are synchronous {@code @EventListener}s, so publishing happens on the calling
 * thread and listener failures surface to the caller.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Fill ----

    public void publishFill(Object source, FillResult fill, Position position) {
        applicationEventPublisher.publishEvent(new FillEvent(source, fill, position));
    }

    // ---- Breaker ----

    public void publishBreakerOpened(Object source, BreakerType breakerType, String reason) {
        applicationEventPublisher.publishEvent(new BreakerEvent(source, breakerType, true, reason));
    }

    public void publishBreakerClosed(Object source, BreakerType breakerType, String reason) {
        applicationEventPublisher.publishEvent(new BreakerEvent(source, breakerType, false, reason));
    }

    // ---- Decision ----

    public void publishDecision(Object source, String category, String message) {
        applicationEventPublisher.publishEvent(new DecisionEvent(source, category, message));
    }

    public void publishDecision(
            Object source, String category, String message, String strategy, Map<String, Object> context) {
        applicationEventPublisher.publishEvent(new DecisionEvent(source, category, message, strategy, context));
    }
}
