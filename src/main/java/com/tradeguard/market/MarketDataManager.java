package com.tradeguard.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.config.RedisConfig;
import com.tradeguard.exception.CapacityException;
import com.tradeguard.market.feed.ExchangeConnectionConfig;
import com.tradeguard.market.feed.ExchangeConnectionSupervisor;
import com.tradeguard.market.feed.ExchangeFeed;
import com.tradeguard.market.feed.WebSocketConnector;
import com.tradeguard.market.rest.FallbackIntervalCalculator;
import com.tradeguard.market.rest.RestPriceClient;
import com.tradeguard.resilience.CallPriority;
import com.tradeguard.resilience.DefaultCircuitBreakers;
import com.tradeguard.resilience.GuardedCallService;
import com.tradeguard.store.KeyValueStore;
import com.tradeguard.stream.EventStreamManager;
import com.tradeguard.stream.EventType;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * WebSocket-first market data with per-symbol REST fallback.
 *
 * <p>Exchange connections push normalized points into {@link #updatePriceData}, which
 * caches them with a tier-dependent TTL, republishes them as PRICE_UPDATE events and
 * fans them out to subscribers on a bounded executor. One fallback poller per symbol
 * stays idle while the symbol's latest point is a live WebSocket point and polls the
 * REST source through the {@code external_apis} breaker otherwise.
 *
 * <p>{@link #getCurrentPrice(String)} serves the cache while it is fresh and falls
 * back to a single guarded REST fetch; it never blocks on WebSocket recovery.
 */
public class MarketDataManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MarketDataManager.class);

    private final MarketDataProperties properties;
    private final SymbolTiers symbolTiers;
    private final Map<ExchangeFeed, ExchangeConnectionConfig> feeds;
    private final WebSocketConnector connector;
    private final RestPriceClient restPriceClient;
    private final GuardedCallService guardedCallService;
    private final KeyValueStore store;
    private final EventStreamManager eventStreamManager;
    private final Executor subscriberExecutor;
    private final FallbackIntervalCalculator fallbackIntervals;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, MarketDataPoint> latest = new ConcurrentHashMap<>();
    private final Map<String, List<ListenerRegistration>> listeners = new ConcurrentHashMap<>();
    private final Map<String, FallbackState> fallbackStates = new ConcurrentHashMap<>();
    private final List<ExchangeConnectionSupervisor> connections = new CopyOnWriteArrayList<>();

    private final AtomicLong totalUpdates = new AtomicLong();
    private final Map<DataSource, AtomicLong> sourceCounts = new EnumMap<>(DataSource.class);
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong restFallbackCalls = new AtomicLong();
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong subscriberErrors = new AtomicLong();
    private final AtomicLong subscriberRejections = new AtomicLong();

    private volatile boolean running;
    private TaskSupervisor supervisor;

    public MarketDataManager(
            MarketDataProperties properties,
            Map<ExchangeFeed, ExchangeConnectionConfig> feeds,
            WebSocketConnector connector,
            RestPriceClient restPriceClient,
            GuardedCallService guardedCallService,
            KeyValueStore store,
            EventStreamManager eventStreamManager,
            Executor subscriberExecutor,
            FallbackIntervalCalculator fallbackIntervals,
            ObjectMapper objectMapper,
            Clock clock) {
        this.properties = properties;
        this.symbolTiers = new SymbolTiers(properties.getHotSymbols(), properties.getWarmSymbols());
        this.feeds = new LinkedHashMap<>(feeds);
        this.connector = connector;
        this.restPriceClient = restPriceClient;
        this.guardedCallService = guardedCallService;
        this.store = store;
        this.eventStreamManager = eventStreamManager;
        this.subscriberExecutor = subscriberExecutor;
        this.fallbackIntervals = fallbackIntervals;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (DataSource source : DataSource.values()) {
            sourceCounts.put(source, new AtomicLong());
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        if (!properties.isEnabled()) {
            log.info("Market data feeds disabled; prices are served from REST on demand only");
            return;
        }

        supervisor = new TaskSupervisor("market-data");
        List<String> symbols = List.copyOf(properties.getSymbols());
        feeds.forEach((feed, config) -> {
            ExchangeConnectionSupervisor connection =
                    new ExchangeConnectionSupervisor(feed, config, connector, symbols, this::updatePriceData, clock);
            connections.add(connection);
            supervisor.spawn(feed.name() + "-ws", () -> connection.run(supervisor));
        });
        for (String symbol : symbols) {
            TaskSupervisor owner = supervisor;
            owner.spawn(symbol + "-fallback", () -> fallbackLoop(symbol, owner));
        }
        log.info("Market data started: {} exchanges, {} symbols", connections.size(), symbols.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (supervisor != null) {
            supervisor.shutdown(properties.getShutdownGracePeriod());
            supervisor = null;
        }
        log.info("Market data stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Last to start, first to stop: publishes into the event streams. */
    @Override
    public int getPhase() {
        return 200;
    }

    /**
     * Records a new point: cache, PRICE_UPDATE event, subscribers. Cache and publish
     * failures are logged and do not stop delivery to subscribers.
     */
    public void updatePriceData(MarketDataPoint point) {
        latest.put(point.getSymbol(), point);
        totalUpdates.incrementAndGet();
        sourceCounts.get(point.getSource()).incrementAndGet();

        cache(point);
        publish(point);
        notifySubscribers(point);
        log.debug("Price updated: {}={} source={} exchange={}",
                point.getSymbol(), point.getPrice(), point.getSource(), point.getExchange());
    }

    /**
     * Current price: the cached point while it is fresh for the symbol's tier, otherwise
     * one REST fetch through the {@code external_apis} breaker at HIGH priority.
     *
     * @return empty if there is no fresh cache entry and the REST path produced nothing
     * @throws CapacityException if the breaker or backpressure refused the REST fetch;
     *     it carries the guard's own retry-after
     */
    public Optional<MarketDataPoint> getCurrentPrice(String symbol) {
        Optional<MarketDataPoint> cached = readCache(symbol);
        if (cached.isPresent() && isFresh(cached.get())) {
            cacheHits.incrementAndGet();
            sourceCounts.get(DataSource.CACHED).incrementAndGet();
            return Optional.of(cached.get().toBuilder().source(DataSource.CACHED).build());
        }

        Optional<MarketDataPoint> fetched = fetchRestGuarded(symbol, CallPriority.HIGH);
        fetched.ifPresent(this::updatePriceData);
        return fetched;
    }

    /** True unless the symbol's latest point is a WebSocket point no older than the staleness threshold. */
    public boolean needsFallback(String symbol) {
        MarketDataPoint point = latest.get(symbol);
        if (point == null || point.getSource() != DataSource.WEBSOCKET) {
            return true;
        }
        return point.ageAt(clock.instant()).compareTo(properties.getStalenessThreshold()) > 0;
    }

    /**
     * Registers a listener for one symbol. Listeners run on the subscriber executor;
     * a listener that throws is logged and stays registered.
     */
    public Subscription subscribe(String symbol, MarketDataListener listener) {
        ListenerRegistration registration = new ListenerRegistration(symbol, listener);
        listeners.computeIfAbsent(symbol, key -> new CopyOnWriteArrayList<>()).add(registration);
        log.info("Subscribed to {} updates", symbol);
        return registration;
    }

    public Optional<MarketDataPoint> getLatest(String symbol) {
        return Optional.ofNullable(latest.get(symbol));
    }

    public SymbolTier tierOf(String symbol) {
        return symbolTiers.tierOf(symbol);
    }

    /**
     * One fallback poll for a symbol. Success lowers the symbol's failure count by one;
     * an empty result, a breaker or backpressure refusal, or an error raises it.
     *
     * @return true if a price was fetched and ingested
     */
    public boolean pollFallbackOnce(String symbol) {
        FallbackState state = fallbackState(symbol);
        state.polls.incrementAndGet();
        Optional<MarketDataPoint> fetched = fetchRest(symbol, CallPriority.MEDIUM);
        if (fetched.isEmpty()) {
            int failures = state.failures.incrementAndGet();
            log.debug("REST fallback for {} got nothing, {} consecutive failures", symbol, failures);
            return false;
        }
        updatePriceData(fetched.get());
        state.failures.updateAndGet(failures -> Math.max(0, failures - 1));
        return true;
    }

    private void fallbackLoop(String symbol, TaskSupervisor owner) {
        FallbackState state = fallbackState(symbol);
        SymbolTier tier = symbolTiers.tierOf(symbol);
        try {
            while (!owner.isCancelled()) {
                if (!needsFallback(symbol)) {
                    if (state.active) {
                        log.info("WebSocket data for {} is live again, REST fallback idle", symbol);
                        state.active = false;
                    }
                    if (owner.sleep(properties.getHealthyCheckInterval())) {
                        break;
                    }
                    continue;
                }
                if (!state.active) {
                    log.warn("No live WebSocket data for {}, starting REST fallback", symbol);
                    state.active = true;
                }
                pollFallbackOnce(symbol);
                if (owner.sleep(fallbackIntervals.calculate(tier, state.failures.get()))) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Poller variant: a guard refusal is one more failed poll, not an error. */
    private Optional<MarketDataPoint> fetchRest(String symbol, CallPriority priority) {
        try {
            return fetchRestGuarded(symbol, priority);
        } catch (CapacityException e) {
            log.debug("REST price for {} refused: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    /** REST fetch through the guards. Refusals propagate; other errors are logged as an empty result. */
    private Optional<MarketDataPoint> fetchRestGuarded(String symbol, CallPriority priority) {
        try {
            Optional<MarketDataPoint> fetched = guardedCallService.call(
                    DefaultCircuitBreakers.EXTERNAL_APIS, () -> restPriceClient.fetchPrice(symbol), priority, true);
            if (fetched.isPresent()) {
                restFallbackCalls.incrementAndGet();
            }
            return fetched;
        } catch (CapacityException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            log.warn("REST price fetch for {} failed: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isFresh(MarketDataPoint point) {
        Duration ttl = symbolTiers.tierOf(point.getSymbol()).getCacheTtl();
        Duration limit = ttl.compareTo(properties.getStalenessThreshold()) < 0 ? ttl : properties.getStalenessThreshold();
        return point.ageAt(clock.instant()).compareTo(limit) < 0;
    }

    private void cache(MarketDataPoint point) {
        try {
            store.set(RedisConfig.PRICE_KEY_PREFIX + point.getSymbol(),
                    objectMapper.writeValueAsString(point),
                    symbolTiers.tierOf(point.getSymbol()).getCacheTtl());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to cache price for {}: {}", point.getSymbol(), e.getMessage());
        }
    }

    private Optional<MarketDataPoint> readCache(String symbol) {
        Optional<String> json;
        try {
            json = store.get(RedisConfig.PRICE_KEY_PREFIX + symbol);
        } catch (RuntimeException e) {
            log.warn("Price cache lookup for {} failed: {}", symbol, e.getMessage());
            return Optional.empty();
        }
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), MarketDataPoint.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cached price for {}: {}", symbol, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void publish(MarketDataPoint point) {
        if (eventStreamManager.getLifecycle() != EventStreamManager.Lifecycle.RUNNING) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("symbol", point.getSymbol());
        data.put("price", plain(point.getPrice()));
        data.put("change_24h", plain(point.getChange24h()));
        data.put("change_percent_24h", plain(point.getChangePercent24h()));
        data.put("volume_24h", plain(point.getVolume24h()));
        data.put("high_24h", plain(point.getHigh24h()));
        data.put("low_24h", plain(point.getLow24h()));
        data.put("exchange", point.getExchange());
        data.put("source", point.getSource().name());
        try {
            eventStreamManager.publish(EventType.PRICE_UPDATE, data);
        } catch (RuntimeException e) {
            publishFailures.incrementAndGet();
            log.warn("Failed to publish price update for {}: {}", point.getSymbol(), e.getMessage());
        }
    }

    private void notifySubscribers(MarketDataPoint point) {
        List<ListenerRegistration> registrations = listeners.get(point.getSymbol());
        if (registrations == null) {
            return;
        }
        for (ListenerRegistration registration : registrations) {
            try {
                subscriberExecutor.execute(() -> deliver(registration, point));
            } catch (RejectedExecutionException e) {
                subscriberRejections.incrementAndGet();
                log.warn("Subscriber executor full, dropped {} update for one listener", point.getSymbol());
            }
        }
    }

    private void deliver(ListenerRegistration registration, MarketDataPoint point) {
        try {
            registration.listener.onPrice(point);
        } catch (Exception e) {
            subscriberErrors.incrementAndGet();
            log.warn("Subscriber callback failed for {}: {}", point.getSymbol(), e.getMessage(), e);
        }
    }

    private FallbackState fallbackState(String symbol) {
        return fallbackStates.computeIfAbsent(symbol, key -> new FallbackState());
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    public MarketDataStatus getStatus() {
        List<ExchangeConnectionSupervisor.ExchangeStatus> exchanges = new ArrayList<>();
        connections.forEach(connection -> exchanges.add(connection.getStatus()));

        Map<DataSource, Long> sources = new EnumMap<>(DataSource.class);
        sourceCounts.forEach((source, count) -> sources.put(source, count.get()));

        Map<String, FallbackStatus> fallback = new LinkedHashMap<>();
        fallbackStates.forEach((symbol, state) ->
                fallback.put(symbol, new FallbackStatus(state.active, state.failures.get(), state.polls.get())));

        Instant now = clock.instant();
        Map<String, Long> ages = new LinkedHashMap<>();
        latest.forEach((symbol, point) -> ages.put(symbol, point.ageAt(now).toMillis()));

        return MarketDataStatus.builder()
                .running(running)
                .exchanges(exchanges)
                .totalUpdates(totalUpdates.get())
                .sourceCounts(sources)
                .cacheHits(cacheHits.get())
                .restFallbackCalls(restFallbackCalls.get())
                .publishFailures(publishFailures.get())
                .subscriberErrors(subscriberErrors.get())
                .subscriberRejections(subscriberRejections.get())
                .activeSubscriptions(listeners.values().stream().mapToInt(List::size).sum())
                .fallback(fallback)
                .latestAgeMs(ages)
                .build();
    }

    public record FallbackStatus(boolean active, int consecutiveFailures, long polls) {}

    @Value
    @Builder
    public static class MarketDataStatus {
        boolean running;
        List<ExchangeConnectionSupervisor.ExchangeStatus> exchanges;
        long totalUpdates;
        Map<DataSource, Long> sourceCounts;
        long cacheHits;
        long restFallbackCalls;
        long publishFailures;
        long subscriberErrors;
        long subscriberRejections;
        int activeSubscriptions;
        Map<String, FallbackStatus> fallback;
        Map<String, Long> latestAgeMs;
    }

    private static final class FallbackState {
        private final AtomicInteger failures = new AtomicInteger();
        private final AtomicLong polls = new AtomicLong();
        private volatile boolean active;
    }

    private final class ListenerRegistration implements Subscription {

        private final String symbol;
        private final MarketDataListener listener;

        private ListenerRegistration(String symbol, MarketDataListener listener) {
            this.symbol = symbol;
            this.listener = listener;
        }

        @Override
        public void cancel() {
            List<ListenerRegistration> registrations = listeners.get(symbol);
            if (registrations != null && registrations.remove(this)) {
                log.info("Unsubscribed from {} updates", symbol);
            }
        }
    }
}
