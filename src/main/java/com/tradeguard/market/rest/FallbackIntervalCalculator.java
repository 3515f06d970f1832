package com.tradeguard.market.rest;

import com.tradeguard.market.SymbolTier;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Poll interval for a symbol's REST fallback: the tier's base interval, doubled
 * for each consecutive failure up to 8×, spread by ±10% jitter and clamped to
 * [{@code min}, {@code max}].
 */
public class FallbackIntervalCalculator {

    static final int MAX_BACKOFF_MULTIPLIER = 8;
    static final double JITTER = 0.1;

    private final Duration min;
    private final Duration max;
    private final DoubleSupplier random;

    public FallbackIntervalCalculator(Duration min, Duration max) {
        this(min, max, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random uniform source in [0, 1) */
    public FallbackIntervalCalculator(Duration min, Duration max, DoubleSupplier random) {
        this.min = min;
        this.max = max;
        this.random = random;
    }

    public Duration calculate(SymbolTier tier, int consecutiveFailures) {
        long baseMs = tier.getFallbackBaseInterval().toMillis() * backoffMultiplier(consecutiveFailures);
        double jitter = (random.getAsDouble() * 2 - 1) * JITTER;
        long intervalMs = Math.round(baseMs * (1 + jitter));
        return Duration.ofMillis(Math.max(min.toMillis(), Math.min(intervalMs, max.toMillis())));
    }

    static long backoffMultiplier(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return 1;
        }
        if (consecutiveFailures >= 3) {
            return MAX_BACKOFF_MULTIPLIER;
        }
        return 1L << consecutiveFailures;
    }
}
