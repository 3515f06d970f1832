package com.tradeguard.resilience;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CircuitBreakerStats {
    String name;
    CircuitState state;
    CircuitHealth health;
    int consecutiveFailures;
    int consecutiveSuccesses;
    int failuresInWindow;
    int backoffMultiplier;
    long currentTimeoutSeconds;
    long retryAfterSeconds;
    long totalCalls;
    long successfulCalls;
    long failedCalls;
    long timeoutCalls;
    long slowCalls;
    long rejectedCalls;
    long ignoredErrors;
    long stateChanges;
    double failureRate;
    double averageLatencyMs;
    long p50LatencyMs;
    long p95LatencyMs;
    long p99LatencyMs;
    long maxLatencyMs;
    Instant lastStateChange;
    Instant lastFailure;
}
