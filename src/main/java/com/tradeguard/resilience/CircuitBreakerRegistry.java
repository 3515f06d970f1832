package com.tradeguard.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.concurrent.TimeBoundedCalls;
import com.tradeguard.config.RedisConfig;
import com.tradeguard.store.KeyValueStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

/**
 * Process-wide set of named {@link CircuitBreaker}s.
 *
 * <p>Breakers are created lazily on first lookup and live for the process
 * lifetime. Names in the catalog get their configured settings; any other name
 * gets the default config. A background loop exchanges breaker state with the
 * shared {@link KeyValueStore} every {@code syncInterval}: the snapshot with the
 * newer state change wins, so one process opening a circuit is seen by its
 * siblings within one interval.
 */
public class CircuitBreakerRegistry implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreakerConfig> catalog;
    private final CircuitBreakerConfig defaultConfig;
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TimeBoundedCalls timeBoundedCalls;
    private final ApplicationEventPublisher eventPublisher;
    private final Duration syncInterval;
    private final Duration stateTtl;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<Consumer<CircuitBreaker>> creationListeners = new ArrayList<>();

    private volatile TaskSupervisor supervisor;

    public CircuitBreakerRegistry(
            Map<String, CircuitBreakerConfig> catalog,
            CircuitBreakerConfig defaultConfig,
            KeyValueStore store,
            ObjectMapper objectMapper,
            Clock clock,
            TimeBoundedCalls timeBoundedCalls,
            ApplicationEventPublisher eventPublisher,
            Duration syncInterval,
            Duration stateTtl) {
        this.catalog = Map.copyOf(catalog);
        this.defaultConfig = defaultConfig;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeBoundedCalls = timeBoundedCalls;
        this.eventPublisher = eventPublisher;
        this.syncInterval = syncInterval;
        this.stateTtl = stateTtl;
    }

    /** Returns the breaker for {@code name}, creating it on first use. */
    public CircuitBreaker get(String name) {
        CircuitBreaker existing = breakers.get(name);
        if (existing != null) {
            return existing;
        }
        CircuitBreaker[] created = new CircuitBreaker[1];
        CircuitBreaker breaker = breakers.computeIfAbsent(name, key -> created[0] = create(key));
        if (created[0] != null) {
            synchronized (creationListeners) {
                creationListeners.forEach(listener -> listener.accept(breaker));
            }
        }
        return breaker;
    }

    /**
     * Registers a callback for breakers created from now on, and replays it for
     * the ones that already exist.
     */
    public void onBreakerCreated(Consumer<CircuitBreaker> listener) {
        synchronized (creationListeners) {
            creationListeners.add(listener);
            breakers.values().forEach(listener);
        }
    }

    private CircuitBreaker create(String name) {
        CircuitBreakerConfig config = catalog.get(name);
        if (config == null) {
            log.info("Creating circuit breaker {} with default config", name);
            config = defaultConfig;
        } else {
            log.info("Creating circuit breaker {}: {}", name, config);
        }
        return new CircuitBreaker(name, config, clock, timeBoundedCalls, eventPublisher::publishEvent);
    }

    public Collection<CircuitBreaker> getAll() {
        return breakers.values();
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * One exchange round with the shared store. Remote snapshots with a newer
     * state change are adopted; otherwise the local snapshot is written back,
     * unless the breaker has no state history of its own yet.
     */
    public void syncWithStore() {
        for (CircuitBreaker breaker : breakers.values()) {
            String key = stateKey(breaker.getName());
            try {
                Optional<String> remote = store.get(key);
                if (remote.isPresent()) {
                    CircuitBreakerSnapshot snapshot = objectMapper.readValue(remote.get(), CircuitBreakerSnapshot.class);
                    if (breaker.restore(snapshot)) {
                        continue;
                    }
                }
                if (!breaker.hasStateHistory()) {
                    continue;
                }
                store.set(key, objectMapper.writeValueAsString(breaker.snapshot()), stateTtl);
            } catch (JsonProcessingException e) {
                log.warn("Discarding unreadable shared state for circuit {}: {}", breaker.getName(), e.getOriginalMessage());
                store.delete(key);
            } catch (RuntimeException e) {
                log.warn("Circuit state sync failed for {}: {}", breaker.getName(), e.getMessage());
            }
        }
    }

    static String stateKey(String name) {
        return RedisConfig.CIRCUIT_KEY_PREFIX + name + ":state";
    }

    @Override
    public synchronized void start() {
        if (supervisor != null) {
            return;
        }
        catalog.keySet().forEach(this::get);
        supervisor = new TaskSupervisor("circuit-sync");
        supervisor.spawn("state-sync", this::syncLoop);
        log.info("CircuitBreakerRegistry started: {} catalog breakers, sync every {}ms",
                catalog.size(), syncInterval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (supervisor == null) {
            return;
        }
        supervisor.shutdown(syncInterval);
        supervisor = null;
        log.info("CircuitBreakerRegistry stopped");
    }

    @Override
    public boolean isRunning() {
        return supervisor != null;
    }

    @Override
    public int getPhase() {
        return 10;
    }

    private void syncLoop() {
        TaskSupervisor owner = supervisor;
        try {
            while (!owner.sleep(syncInterval)) {
                syncWithStore();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Aggregated view: per-breaker stats plus the names that are not closed. */
    public RegistryStatus getStatus() {
        Map<String, CircuitBreakerStats> stats = new LinkedHashMap<>();
        List<String> open = new ArrayList<>();
        List<String> halfOpen = new ArrayList<>();
        breakers.values().stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(breaker -> {
                    CircuitBreakerStats breakerStats = breaker.getStats();
                    stats.put(breaker.getName(), breakerStats);
                    if (breakerStats.getState() == CircuitState.OPEN) {
                        open.add(breaker.getName());
                    } else if (breakerStats.getState() == CircuitState.HALF_OPEN) {
                        halfOpen.add(breaker.getName());
                    }
                });
        return new RegistryStatus(stats, open, halfOpen);
    }

    public record RegistryStatus(
            Map<String, CircuitBreakerStats> breakers, List<String> openCircuits, List<String> halfOpenCircuits) {

        public boolean isHealthy() {
            return openCircuits.isEmpty();
        }
    }
}
