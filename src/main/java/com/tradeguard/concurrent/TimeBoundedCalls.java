package com.tradeguard.concurrent;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs callables on a worker pool under a Resilience4j {@link TimeLimiter}.
 *
 * <p>On expiry the caller gets a {@link java.util.concurrent.TimeoutException} and
 * the worker is interrupted. Failures thrown by the callable surface unwrapped.
 * A zero or null timeout runs the callable on the calling thread.
 */
public class TimeBoundedCalls {

    private final ExecutorService executor;
    private final Map<Duration, TimeLimiter> limiters = new ConcurrentHashMap<>();

    public TimeBoundedCalls(ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(Callable<T> operation, Duration timeout) throws Exception {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return operation.call();
        }
        TimeLimiter limiter = limiters.computeIfAbsent(timeout, this::newLimiter);
        return limiter.executeFutureSupplier(() -> executor.submit(operation));
    }

    private TimeLimiter newLimiter(Duration timeout) {
        return TimeLimiter.of(
                "call-" + timeout.toMillis() + "ms",
                TimeLimiterConfig.custom()
                        .timeoutDuration(timeout)
                        .cancelRunningFuture(true)
                        .build());
    }
}
