package com.tradeguard.exception;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;

@Getter
public class CircuitOpenException extends CapacityException {

    private final String circuitName;

    public CircuitOpenException(String circuitName, Duration retryAfter) {
        super(
                ErrorCode.CIRCUIT_OPEN,
                "Circuit breaker " + circuitName + " is open",
                retryAfter,
                Map.of("circuit", circuitName));
        this.circuitName = circuitName;
    }
}
