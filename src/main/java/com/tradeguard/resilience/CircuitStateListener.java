package com.tradeguard.resilience;

@FunctionalInterface
public interface CircuitStateListener {

    /** Invoked under the breaker's lock; implementations must not block. */
    void onStateChange(CircuitStateChangedEvent event);
}
