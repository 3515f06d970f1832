package com.tradeguard.config;

import com.tradeguard.store.InMemoryKeyValueStore;
import com.tradeguard.store.KeyValueStore;
import com.tradeguard.store.RedisKeyValueStore;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.resource.ClientResources;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis wiring for the key-value store and the stream broker.
 *
 * <p>All keys are prefixed with "tg:" because the Redis server is shared with the
 * rest of the platform. Streams use their catalog names unprefixed so other
 * services can produce to and consume from them.
 *
 * <p>Key schema:
 * <pre>
 *   tg:circuit:{name}:state   → circuit breaker snapshot JSON (TTL 300 s)
 *   tg:price:{symbol}         → latest MarketDataPoint JSON (TTL by symbol tier)
 *   tg:last_price:{symbol}    → last price seen by the change detector (TTL 300 s)
 * </pre>
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    /** Global prefix for all keys. */
    public static final String KEY_PREFIX = "tg:";

    public static final String CIRCUIT_KEY_PREFIX = KEY_PREFIX + "circuit:";
    public static final String PRICE_KEY_PREFIX = KEY_PREFIX + "price:";
    public static final String LAST_PRICE_KEY_PREFIX = KEY_PREFIX + "last_price:";

    @Value("${tradeguard.store.backend:redis}")
    private String storeBackend;

    @Bean
    public InMemoryKeyValueStore localKeyValueStore(Clock clock) {
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    @Primary
    public KeyValueStore keyValueStore(StringRedisTemplate stringRedisTemplate, InMemoryKeyValueStore localKeyValueStore) {
        if ("memory".equalsIgnoreCase(storeBackend)) {
            log.info("Key-value store: in-process only, breaker state is not shared between instances");
            return localKeyValueStore;
        }
        log.info("Key-value store: Redis with local fallback");
        return new RedisKeyValueStore(stringRedisTemplate, localKeyValueStore);
    }

    /**
     * Dedicated Lettuce client for Redis Streams. Blocking group reads need their own
     * connections, which the shared template connection cannot provide.
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(name = "tradeguard.streams.broker", havingValue = "redis", matchIfMissing = true)
    public RedisClient streamRedisClient(RedisProperties redisProperties, ClientResources clientResources) {
        RedisURI.Builder uri = RedisURI.builder()
                .withHost(redisProperties.getHost())
                .withPort(redisProperties.getPort())
                .withDatabase(redisProperties.getDatabase())
                .withSsl(redisProperties.getSsl().isEnabled());
        if (redisProperties.getPassword() != null) {
            if (redisProperties.getUsername() != null) {
                uri.withAuthentication(redisProperties.getUsername(), redisProperties.getPassword());
            } else {
                uri.withPassword(redisProperties.getPassword().toCharArray());
            }
        }
        if (redisProperties.getTimeout() != null) {
            uri.withTimeout(redisProperties.getTimeout());
        }
        return RedisClient.create(clientResources, uri.build());
    }
}
