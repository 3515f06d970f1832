package com.tradeguard.resilience;

public enum CircuitState {
    /** Calls flow through; failures are counted in the sliding window. */
    CLOSED,
    /** Calls are rejected until the recovery timeout elapses. */
    OPEN,
    /** One probe call at a time is let through to test recovery. */
    HALF_OPEN
}
