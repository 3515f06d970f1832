package com.tradeguard.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-local store backed by a Caffeine cache.
 *
 * <p>Expiry is checked against the injected {@link Clock} on every read, so an
 * entry is never served past its TTL even before Caffeine evicts it.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final long MAXIMUM_ENTRIES = 100_000;

    private final Clock clock;
    private final Cache<String, Entry> cache;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(MAXIMUM_ENTRIES)
                .expireAfter(new TtlExpiry())
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, clock.instant().plus(ttl), ttl));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public boolean isShared() {
        return false;
    }

    private record Entry(String value, Instant expiresAt, Duration ttl) {}

    private static final class TtlExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
