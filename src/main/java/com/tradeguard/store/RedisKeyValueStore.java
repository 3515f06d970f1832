package com.tradeguard.store;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed store with a local mirror.
 *
 * <p>Every write also lands in the local {@link InMemoryKeyValueStore}. When Redis
 * errors, reads are answered from the mirror so the process keeps working on
 * its own view until Redis is back.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private final StringRedisTemplate redisTemplate;
    private final InMemoryKeyValueStore localMirror;

    private volatile boolean redisAvailable = true;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate, InMemoryKeyValueStore localMirror) {
        this.redisTemplate = redisTemplate;
        this.localMirror = localMirror;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            markAvailable();
            return Optional.ofNullable(value);
        } catch (DataAccessException e) {
            markUnavailable(e);
            return localMirror.get(key);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        localMirror.set(key, value, ttl);
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
            markAvailable();
        } catch (DataAccessException e) {
            markUnavailable(e);
        }
    }

    @Override
    public void delete(String key) {
        localMirror.delete(key);
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            markUnavailable(e);
        }
    }

    @Override
    public boolean isShared() {
        return redisAvailable;
    }

    private void markAvailable() {
        if (!redisAvailable) {
            redisAvailable = true;
            log.info("Redis key-value store reachable again");
        }
    }

    private void markUnavailable(DataAccessException e) {
        if (redisAvailable) {
            redisAvailable = false;
            log.warn("Redis key-value store unavailable, serving from local cache: {}", e.getMessage());
        }
    }
}
