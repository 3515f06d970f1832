package com.tradeguard.exception;

import com.tradeguard.resilience.CallPriority;
import java.time.Duration;
import java.util.Map;
import lombok.Getter;

@Getter
public class BackpressureException extends CapacityException {

    private final CallPriority priority;

    public BackpressureException(String message, CallPriority priority, Duration retryAfter) {
        super(ErrorCode.BACKPRESSURE, message, retryAfter, Map.of("priority", priority.name()));
        this.priority = priority;
    }
}
