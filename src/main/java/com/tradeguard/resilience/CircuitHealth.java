package com.tradeguard.resilience;

/** Coarse health label reported alongside breaker statistics. */
public enum CircuitHealth {
    HEALTHY,
    /** Closed, but more than half of the successful calls were slow. */
    DEGRADED,
    RECOVERING,
    UNHEALTHY
}
