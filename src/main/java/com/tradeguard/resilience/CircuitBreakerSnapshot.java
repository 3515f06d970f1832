package com.tradeguard.resilience;

/**
 * Shareable breaker state, written to the key-value store so sibling processes
 * converge on the same view of a dependency.
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        int backoffMultiplier,
        long lastStateChangeMillis) {}
