package com.tradeguard.market.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.exception.MalformedMarketDataException;
import com.tradeguard.market.DataSource;
import com.tradeguard.market.MarketDataPoint;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Binance 24h ticker via the combined stream endpoint. Subscription is part of
 * the URL ({@code /stream?streams=btcusdt@ticker/ethusdt@ticker}); frames arrive
 * wrapped as {@code {"stream": ..., "data": {...}}}.
 */
public class BinanceFeed extends AbstractExchangeFeed {

    public static final String NAME = "binance";

    private static final String TICKER_SUFFIX = "@ticker";

    public BinanceFeed(ObjectMapper objectMapper, String baseUrl) {
        super(objectMapper, baseUrl);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public URI endpoint(List<String> symbols) {
        String streams = symbols.stream()
                .map(symbol -> symbol.toLowerCase() + TICKER_SUFFIX)
                .collect(Collectors.joining("/"));
        return URI.create(baseUrl + "/stream?streams=" + streams);
    }

    @Override
    public Optional<String> subscribeMessage(List<String> symbols) {
        return Optional.empty();
    }

    @Override
    public List<MarketDataPoint> parse(String payload, Instant receivedAt) {
        JsonNode root = readTree(payload);
        JsonNode ticker = root.has("data") ? root.get("data") : root;
        if (!"24hrTicker".equals(ticker.path("e").asText()) && !(ticker.has("s") && ticker.has("c"))) {
            return List.of();
        }
        String symbol = ticker.path("s").asText(null);
        if (symbol == null || symbol.isBlank()) {
            throw new MalformedMarketDataException(NAME, "ticker without symbol");
        }
        return List.of(MarketDataPoint.builder()
                .symbol(symbol.toUpperCase())
                .price(requiredDecimal(ticker.get("c"), "last price"))
                .change24h(decimal(ticker.get("p")))
                .changePercent24h(decimal(ticker.get("P")))
                .volume24h(decimal(ticker.get("v")))
                .high24h(decimal(ticker.get("h")))
                .low24h(decimal(ticker.get("l")))
                .exchange(NAME)
                .timestamp(receivedAt)
                .source(DataSource.WEBSOCKET)
                .build());
    }
}
