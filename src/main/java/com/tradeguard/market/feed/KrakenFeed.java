package com.tradeguard.market.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.exception.MalformedMarketDataException;
import com.tradeguard.market.DataSource;
import com.tradeguard.market.MarketDataPoint;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Kraken public WebSocket (v1) {@code ticker} subscription. Ticker frames are
 * arrays, {@code [channelId, {...}, "ticker", "XBT/USDT"]}; system and
 * subscription status frames are objects and are ignored.
 */
public class KrakenFeed extends AbstractExchangeFeed {

    public static final String NAME = "kraken";

    public KrakenFeed(ObjectMapper objectMapper, String baseUrl) {
        super(objectMapper, baseUrl);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public URI endpoint(List<String> symbols) {
        return URI.create(baseUrl);
    }

    @Override
    public Optional<String> subscribeMessage(List<String> symbols) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("event", "subscribe");
        message.put("pair", symbols.stream().map(KrakenFeed::pairName).toList());
        message.put("subscription", Map.of("name", "ticker"));
        return Optional.of(writeJson(message));
    }

    @Override
    public List<MarketDataPoint> parse(String payload, Instant receivedAt) {
        JsonNode root = readTree(payload);
        if (!root.isArray()) {
            return List.of();
        }
        if (root.size() < 4 || !root.get(1).isObject() || !"ticker".equals(root.get(2).asText())) {
            throw new MalformedMarketDataException(NAME, "unexpected array frame of size " + root.size());
        }
        JsonNode ticker = root.get(1);
        String pair = root.get(3).asText();
        int slash = pair.indexOf('/');
        if (slash <= 0) {
            throw new MalformedMarketDataException(NAME, "ticker with bad pair '" + pair + "'");
        }

        BigDecimal price = requiredDecimal(ticker.path("c").path(0), "last trade price");
        BigDecimal open = decimal(ticker.path("o").path(1));
        return List.of(MarketDataPoint.builder()
                .symbol(Symbols.canonical(fromKrakenAsset(pair.substring(0, slash))))
                .price(price)
                .change24h(open != null ? price.subtract(open) : null)
                .changePercent24h(percentChange(open, price))
                .volume24h(decimal(ticker.path("v").path(1)))
                .high24h(decimal(ticker.path("h").path(1)))
                .low24h(decimal(ticker.path("l").path(1)))
                .exchange(NAME)
                .timestamp(receivedAt)
                .source(DataSource.WEBSOCKET)
                .build());
    }

    static String pairName(String symbol) {
        String base = Symbols.baseAsset(symbol);
        return ("BTC".equals(base) ? "XBT" : base) + "/" + Symbols.CANONICAL_QUOTE;
    }

    private static String fromKrakenAsset(String asset) {
        return "XBT".equalsIgnoreCase(asset) ? "BTC" : asset;
    }
}
