package com.tradeguard.resilience;

import com.tradeguard.exception.ConfigurationException;
import java.time.Duration;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable settings for one {@link CircuitBreaker}. Validated on construction,
 * so an invalid combination never reaches a running breaker.
 */
@Getter
@ToString
public final class CircuitBreakerConfig {

    /** Failures inside {@link #failureWindow} that open a closed circuit. */
    private final int failureThreshold;

    /** Consecutive probe successes needed to close a half-open circuit. */
    private final int successThreshold;

    /** Base recovery timeout before an open circuit admits a probe. */
    private final Duration timeout;

    /** Ceiling for the backed-off recovery timeout. */
    private final Duration maxTimeout;

    private final Duration failureWindow;

    /** Successful calls slower than this are counted as slow. */
    private final Duration slowCallThreshold;

    /** Upper bound for one guarded call. Zero disables the bound. */
    private final Duration callTimeout;

    /** Exception types that pass through without counting against the circuit. */
    private final Set<Class<? extends Throwable>> ignoredExceptions;

    @Builder(toBuilder = true)
    private CircuitBreakerConfig(
            int failureThreshold,
            int successThreshold,
            Duration timeout,
            Duration maxTimeout,
            Duration failureWindow,
            Duration slowCallThreshold,
            Duration callTimeout,
            Set<Class<? extends Throwable>> ignoredExceptions) {
        if (failureThreshold < 1) {
            throw new ConfigurationException("failureThreshold must be >= 1, was " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new ConfigurationException("successThreshold must be >= 1, was " + successThreshold);
        }
        requirePositive("timeout", timeout);
        requirePositive("maxTimeout", maxTimeout);
        requirePositive("failureWindow", failureWindow);
        requirePositive("slowCallThreshold", slowCallThreshold);
        if (maxTimeout.compareTo(timeout) < 0) {
            throw new ConfigurationException("maxTimeout " + maxTimeout + " is shorter than timeout " + timeout);
        }
        if (callTimeout != null && callTimeout.isNegative()) {
            throw new ConfigurationException("callTimeout must not be negative");
        }
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.timeout = timeout;
        this.maxTimeout = maxTimeout;
        this.failureWindow = failureWindow;
        this.slowCallThreshold = slowCallThreshold;
        this.callTimeout = callTimeout != null ? callTimeout : Duration.ZERO;
        this.ignoredExceptions = ignoredExceptions != null ? Set.copyOf(ignoredExceptions) : Set.of();
    }

    /** Builder pre-filled with the platform defaults. */
    public static CircuitBreakerConfigBuilder defaults() {
        return builder()
                .failureThreshold(5)
                .successThreshold(3)
                .timeout(Duration.ofSeconds(60))
                .maxTimeout(Duration.ofSeconds(300))
                .failureWindow(Duration.ofSeconds(60))
                .slowCallThreshold(Duration.ofMillis(5000))
                .callTimeout(Duration.ofSeconds(30))
                .ignoredExceptions(Set.of());
    }

    public boolean isIgnored(Throwable error) {
        for (Class<? extends Throwable> type : ignoredExceptions) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(field + " must be a positive duration, was " + value);
        }
    }
}
