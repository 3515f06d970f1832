package com.tradeguard.resilience;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Admission priority for guarded calls. Lower level means more important.
 *
 * <p>CRITICAL calls bypass the concurrency limit, CRITICAL and HIGH keep running
 * under severe resource pressure, MEDIUM and LOW are shed first.
 */
@Getter
@RequiredArgsConstructor
public enum CallPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4);

    private final int level;

    /** True for CRITICAL and HIGH. */
    public boolean survivesResourcePressure() {
        return level <= HIGH.level;
    }
}
