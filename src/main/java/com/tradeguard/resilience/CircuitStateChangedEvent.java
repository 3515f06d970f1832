package com.tradeguard.resilience;

import java.time.Instant;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Published on every breaker state transition, including forced ones. */
@Getter
public class CircuitStateChangedEvent extends ApplicationEvent {

    private final String circuitName;
    private final CircuitState previousState;
    private final CircuitState newState;
    private final String reason;
    private final Instant occurredAt;

    public CircuitStateChangedEvent(
            Object source,
            String circuitName,
            CircuitState previousState,
            CircuitState newState,
            String reason,
            Instant occurredAt) {
        super(source);
        this.circuitName = circuitName;
        this.previousState = previousState;
        this.newState = newState;
        this.reason = reason;
        this.occurredAt = occurredAt;
    }
}
