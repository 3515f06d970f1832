package com.tradeguard.stream.handler;

import com.tradeguard.config.RedisConfig;
import com.tradeguard.store.KeyValueStore;
import com.tradeguard.stream.EventStreamCatalog;
import com.tradeguard.stream.EventType;
import com.tradeguard.stream.StreamEntry;
import com.tradeguard.stream.StreamEventHandler;
import com.tradeguard.stream.StreamPublisher;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches price updates and raises a PORTFOLIO_CHANGE event when a symbol moves
 * enough to matter for open positions: 0.5% for the majors, 1% for everything else,
 * measured against the last price this detector saw.
 */
public class PriceChangeDetector implements StreamEventHandler {

    private static final Logger log = LoggerFactory.getLogger(PriceChangeDetector.class);

    static final Set<String> MAJOR_SYMBOLS = Set.of("BTCUSDT", "ETHUSDT");
    static final BigDecimal MAJOR_THRESHOLD_PERCENT = new BigDecimal("0.5");
    static final BigDecimal DEFAULT_THRESHOLD_PERCENT = BigDecimal.ONE;
    static final Duration LAST_PRICE_TTL = Duration.ofSeconds(300);

    private final KeyValueStore store;
    private final StreamPublisher publisher;

    public PriceChangeDetector(KeyValueStore store, StreamPublisher publisher) {
        this.store = store;
        this.publisher = publisher;
    }

    @Override
    public String serviceName() {
        return EventStreamCatalog.MARKET_DATA_PROCESSOR;
    }

    @Override
    public void handle(StreamEntry entry) {
        if (!EventType.PRICE_UPDATE.name().equals(entry.eventType())) {
            return;
        }
        String symbol = entry.field("symbol");
        BigDecimal price = parsePrice(entry.field("price"));
        if (symbol == null || price == null) {
            log.warn("Dropping price update {} without symbol or price: {}", entry.id(), entry.fields());
            return;
        }

        String key = RedisConfig.LAST_PRICE_KEY_PREFIX + symbol;
        Optional<BigDecimal> previous = store.get(key).map(PriceChangeDetector::parsePrice);
        store.set(key, price.toPlainString(), LAST_PRICE_TTL);

        if (previous.isEmpty() || previous.get().signum() == 0) {
            return;
        }
        BigDecimal changePercent = price.subtract(previous.get())
                .multiply(BigDecimal.valueOf(100))
                .divide(previous.get(), 4, RoundingMode.HALF_UP);
        if (changePercent.abs().compareTo(thresholdFor(symbol)) <= 0) {
            return;
        }

        Map<String, Object> change = new LinkedHashMap<>();
        change.put("symbol", symbol);
        change.put("previous_price", previous.get().toPlainString());
        change.put("price", price.toPlainString());
        change.put("change_percent", changePercent.toPlainString());
        change.put("source_entry", entry.id().toString());
        publisher.publish(EventType.PORTFOLIO_CHANGE, change);
        log.info("Significant move on {}: {} -> {} ({}%)", symbol, previous.get(), price, changePercent);
    }

    static BigDecimal thresholdFor(String symbol) {
        return MAJOR_SYMBOLS.contains(symbol) ? MAJOR_THRESHOLD_PERCENT : DEFAULT_THRESHOLD_PERCENT;
    }

    private static BigDecimal parsePrice(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
