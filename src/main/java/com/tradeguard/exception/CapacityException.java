package com.tradeguard.exception;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;

/**
 * A call was refused because a guard is protecting capacity, not because the
 * operation itself failed. Callers get a hint of when to retry.
 */
@Getter
public abstract class CapacityException extends BaseException {

    private final Duration retryAfter;

    protected CapacityException(ErrorCode errorCode, String message, Duration retryAfter, Map<String, Object> details) {
        super(errorCode, message, details);
        this.retryAfter = retryAfter != null && !retryAfter.isNegative() ? retryAfter : Duration.ZERO;
    }

    /** Retry delay rounded up to whole seconds, as sent in a Retry-After header. */
    public long getRetryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return (millis + 999) / 1000;
    }
}
