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
 * Coinbase Exchange {@code ticker} channel. Products are USD-quoted
 * ({@code BTC-USD}) and are reported back under the canonical symbol.
 */
public class CoinbaseFeed extends AbstractExchangeFeed {

    public static final String NAME = "coinbase";

    public CoinbaseFeed(ObjectMapper objectMapper, String baseUrl) {
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
        message.put("type", "subscribe");
        message.put("product_ids", symbols.stream().map(CoinbaseFeed::productId).toList());
        message.put("channels", List.of("ticker"));
        return Optional.of(writeJson(message));
    }

    @Override
    public List<MarketDataPoint> parse(String payload, Instant receivedAt) {
        JsonNode root = readTree(payload);
        if (!"ticker".equals(root.path("type").asText())) {
            return List.of();
        }
        String productId = root.path("product_id").asText("");
        int dash = productId.indexOf('-');
        if (dash <= 0) {
            throw new MalformedMarketDataException(NAME, "ticker with bad product_id '" + productId + "'");
        }
        BigDecimal price = requiredDecimal(root.get("price"), "price");
        BigDecimal open = decimal(root.get("open_24h"));
        return List.of(MarketDataPoint.builder()
                .symbol(Symbols.canonical(productId.substring(0, dash)))
                .price(price)
                .change24h(open != null ? price.subtract(open) : null)
                .changePercent24h(percentChange(open, price))
                .volume24h(decimal(root.get("volume_24h")))
                .high24h(decimal(root.get("high_24h")))
                .low24h(decimal(root.get("low_24h")))
                .exchange(NAME)
                .timestamp(receivedAt)
                .source(DataSource.WEBSOCKET)
                .build());
    }

    static String productId(String symbol) {
        return Symbols.baseAsset(symbol) + "-USD";
    }
}
