package com.tradeguard.market.feed;

import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.exception.MalformedMarketDataException;
import com.tradeguard.market.MarketDataPoint;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one exchange's ticker WebSocket connected and feeds its normalized points
 * to a sink.
 *
 * <p>A session that fails to connect or drops counts as a consecutive failure;
 * the next attempt waits {@code reconnectDelay × 2^(n-1)}, capped at
 * {@code maxReconnectDelay}. Receiving any ticker resets the count. After
 * {@code maxRetries} consecutive failures the exchange is marked
 * {@link ExchangeConnectionState#UNHEALTHY} and left alone; REST fallback covers
 * its symbols from then on.
 */
public class ExchangeConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConnectionSupervisor.class);

    private final ExchangeFeed feed;
    private final ExchangeConnectionConfig config;
    private final WebSocketConnector connector;
    private final List<String> symbols;
    private final Consumer<MarketDataPoint> sink;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong connectAttempts = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong malformedMessages = new AtomicLong();

    private volatile ExchangeConnectionState state = ExchangeConnectionState.CONNECTING;
    private volatile Instant lastMessageAt;
    private volatile String lastError;

    public ExchangeConnectionSupervisor(
            ExchangeFeed feed,
            ExchangeConnectionConfig config,
            WebSocketConnector connector,
            List<String> symbols,
            Consumer<MarketDataPoint> sink,
            Clock clock) {
        this.feed = feed;
        this.config = config;
        this.connector = connector;
        this.symbols = symbols.size() > config.getSymbolsPerConnection()
                ? List.copyOf(symbols.subList(0, config.getSymbolsPerConnection()))
                : List.copyOf(symbols);
        this.sink = sink;
        this.clock = clock;
        if (symbols.size() > this.symbols.size()) {
            log.warn("{} connection limited to {} of {} symbols",
                    feed.name(), this.symbols.size(), symbols.size());
        }
    }

    /** Connection loop. Returns on cancellation or once the exchange is declared unhealthy. */
    public void run(TaskSupervisor supervisor) {
        try {
            while (!supervisor.isCancelled()) {
                runSession(supervisor);
                if (supervisor.isCancelled()) {
                    break;
                }

                int failures = consecutiveFailures.incrementAndGet();
                if (failures >= config.getMaxRetries()) {
                    state = ExchangeConnectionState.UNHEALTHY;
                    log.error("{} WebSocket failed {} consecutive times, marking exchange unhealthy: {}",
                            feed.name(), failures, lastError);
                    return;
                }
                Duration delay = reconnectDelay(failures);
                state = ExchangeConnectionState.RECONNECT_BACKOFF;
                log.info("{} reconnect attempt {}/{} in {}ms", feed.name(), failures, config.getMaxRetries(),
                        delay.toMillis());
                if (supervisor.sleep(delay)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        state = ExchangeConnectionState.STOPPED;
    }

    private void runSession(TaskSupervisor supervisor) throws InterruptedException {
        state = ExchangeConnectionState.CONNECTING;
        connectAttempts.incrementAndGet();
        URI uri = feed.endpoint(symbols);
        WebSocketChannel channel = null;
        try {
            log.info("Connecting to {} WebSocket for {} symbols", feed.name(), symbols.size());
            channel = connector.connect(uri, config.getConnectTimeout(), this::onMessage);
            Optional<String> subscribe = feed.subscribeMessage(symbols);
            if (subscribe.isPresent()) {
                channel.send(subscribe.get());
            }
            state = ExchangeConnectionState.STREAMING;
            while (channel.isOpen()) {
                if (supervisor.sleep(config.getClosePollInterval())) {
                    return;
                }
            }
            lastError = "connection closed by peer";
            log.warn("{} WebSocket closed", feed.name());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.warn("{} WebSocket session failed: {}", feed.name(), lastError);
        } finally {
            if (channel != null) {
                channel.close();
            }
        }
    }

    /** Parses a frame and hands its points to the sink. Malformed frames are logged and dropped. */
    void onMessage(String payload) {
        List<MarketDataPoint> points;
        try {
            points = feed.parse(payload, clock.instant());
        } catch (MalformedMarketDataException e) {
            malformedMessages.incrementAndGet();
            log.warn("Dropping malformed {} message: {}", feed.name(), e.getMessage());
            return;
        }
        if (points.isEmpty()) {
            return;
        }
        messagesReceived.incrementAndGet();
        lastMessageAt = clock.instant();
        consecutiveFailures.set(0);
        for (MarketDataPoint point : points) {
            try {
                sink.accept(point);
            } catch (RuntimeException e) {
                log.error("Failed to ingest {} point for {}", feed.name(), point.getSymbol(), e);
            }
        }
    }

    /** {@code reconnectDelay × 2^(attempt-1)}, capped at {@code maxReconnectDelay}. */
    public Duration reconnectDelay(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delayMs = config.getReconnectDelay().toMillis() * (1L << shift);
        return Duration.ofMillis(Math.min(delayMs, config.getMaxReconnectDelay().toMillis()));
    }

    public String getExchange() {
        return feed.name();
    }

    public ExchangeConnectionState getState() {
        return state;
    }

    public ExchangeStatus getStatus() {
        Instant last = lastMessageAt;
        return ExchangeStatus.builder()
                .exchange(feed.name())
                .state(state)
                .symbols(symbols.size())
                .consecutiveFailures(consecutiveFailures.get())
                .connectAttempts(connectAttempts.get())
                .messagesReceived(messagesReceived.get())
                .malformedMessages(malformedMessages.get())
                .lastMessageAgeMs(last != null ? Duration.between(last, clock.instant()).toMillis() : null)
                .lastError(lastError)
                .build();
    }

    @Value
    @Builder
    public static class ExchangeStatus {
        String exchange;
        ExchangeConnectionState state;
        int symbols;
        int consecutiveFailures;
        long connectAttempts;
        long messagesReceived;
        long malformedMessages;
        Long lastMessageAgeMs;
        String lastError;
    }
}
