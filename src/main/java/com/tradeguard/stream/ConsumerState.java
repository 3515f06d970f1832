package com.tradeguard.stream;

public enum ConsumerState {
    STARTING,
    /** Claiming and reprocessing entries left pending by crashed or timed-out consumers. */
    RECOVERING_PENDING,
    CONSUMING,
    /** Paused by the resource gate or after a broker error. */
    BACKING_OFF,
    STOPPED
}
