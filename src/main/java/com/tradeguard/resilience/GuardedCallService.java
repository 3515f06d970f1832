package com.tradeguard.resilience;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Entry point for protected outbound calls: optional backpressure admission
 * around a named circuit breaker.
 *
 * <p>Breaker rejections and backpressure refusals propagate unchanged as
 * {@link com.tradeguard.exception.CircuitOpenException} and
 * {@link com.tradeguard.exception.BackpressureException}; nothing here retries.
 */
public class GuardedCallService {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final BackpressureManager backpressureManager;

    public GuardedCallService(CircuitBreakerRegistry circuitBreakerRegistry, BackpressureManager backpressureManager) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.backpressureManager = backpressureManager;
    }

    public <T> T call(String breakerName, Callable<T> operation, CallPriority priority, boolean useBackpressure)
            throws Exception {
        return call(breakerName, operation, priority, useBackpressure, backpressureManager.getConfig().getDefaultTimeout());
    }

    public <T> T call(
            String breakerName, Callable<T> operation, CallPriority priority, boolean useBackpressure, Duration timeout)
            throws Exception {
        CircuitBreaker breaker = circuitBreakerRegistry.get(breakerName);
        if (!useBackpressure) {
            return breaker.call(operation);
        }
        return backpressureManager.execute(() -> breaker.call(operation), priority, timeout);
    }

    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }

    public BackpressureManager getBackpressureManager() {
        return backpressureManager;
    }
}
