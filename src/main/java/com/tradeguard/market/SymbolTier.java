package com.tradeguard.market;

import java.time.Duration;
import lombok.Getter;

/**
 * Trading activity class of a symbol. Hot pairs get the shortest cache lifetime
 * and the most aggressive REST fallback polling.
 */
@Getter
public enum SymbolTier {
    HOT(Duration.ofSeconds(1), Duration.ofSeconds(1)),
    WARM(Duration.ofSeconds(5), Duration.ofSeconds(2)),
    COLD(Duration.ofSeconds(15), Duration.ofSeconds(5));

    /** How long a cached price stays fresh. */
    private final Duration cacheTtl;

    /** Fallback poll interval before backoff and jitter. */
    private final Duration fallbackBaseInterval;

    SymbolTier(Duration cacheTtl, Duration fallbackBaseInterval) {
        this.cacheTtl = cacheTtl;
        this.fallbackBaseInterval = fallbackBaseInterval;
    }
}
