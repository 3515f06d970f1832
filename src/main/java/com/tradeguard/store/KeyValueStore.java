package com.tradeguard.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key-value cache with per-entry expiry. Used for breaker state sync and
 * the market-data price cache.
 *
 * <p>Implementations degrade rather than throw: an unreachable backend makes
 * reads miss and writes local-only.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /** True if entries are visible to other processes. */
    boolean isShared();
}
