package com.tradeguard.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.exception.MalformedMarketDataException;
import com.tradeguard.market.DataSource;
import com.tradeguard.market.MarketDataPoint;
import com.tradeguard.market.feed.BinanceFeed;
import com.tradeguard.market.feed.CoinbaseFeed;
import com.tradeguard.market.feed.KrakenFeed;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExchangeFeedsTest {

    private static final Instant RECEIVED = Instant.parse("2026-03-02T09:00:00Z");
    private static final List<String> SYMBOLS = List.of("BTCUSDT", "ETHUSDT");

    private final ObjectMapper objectMapper = new ObjectMapper();

    // ===== BINANCE =====

    @Nested
    @DisplayName("Binance")
    class Binance {

        private final BinanceFeed feed = new BinanceFeed(objectMapper, "wss://stream.binance.com:9443");

        @Test
        @DisplayName("Subscribes through the combined stream URL")
        void subscribesInUrl() {
            assertThat(feed.endpoint(SYMBOLS).toString())
                    .isEqualTo("wss://stream.binance.com:9443/stream?streams=btcusdt@ticker/ethusdt@ticker");
            assertThat(feed.subscribeMessage(SYMBOLS)).isEmpty();
        }

        @Test
        @DisplayName("Parses a wrapped 24h ticker")
        void parsesTicker() {
            String frame = """
                    {"stream":"btcusdt@ticker","data":{"e":"24hrTicker","s":"BTCUSDT","c":"65000.10",
                    "p":"120.50","P":"0.186","v":"1234.5","h":"65500.00","l":"64000.00"}}
                    """;

            List<MarketDataPoint> points = feed.parse(frame, RECEIVED);

            assertThat(points).hasSize(1);
            MarketDataPoint point = points.get(0);
            assertThat(point.getSymbol()).isEqualTo("BTCUSDT");
            assertThat(point.getPrice()).isEqualByComparingTo("65000.10");
            assertThat(point.getChangePercent24h()).isEqualByComparingTo("0.186");
            assertThat(point.getLow24h()).isEqualByComparingTo("64000");
            assertThat(point.getExchange()).isEqualTo("binance");
            assertThat(point.getSource()).isEqualTo(DataSource.WEBSOCKET);
            assertThat(point.getTimestamp()).isEqualTo(RECEIVED);
        }

        @Test
        @DisplayName("Ignores subscription acknowledgements")
        void ignoresAcks() {
            assertThat(feed.parse("{\"result\":null,\"id\":1}", RECEIVED)).isEmpty();
        }

        @Test
        @DisplayName("Rejects unparseable frames and tickers without a price")
        void rejectsMalformed() {
            assertThatThrownBy(() -> feed.parse("not json", RECEIVED))
                    .isInstanceOf(MalformedMarketDataException.class);
            assertThatThrownBy(() -> feed.parse("{\"e\":\"24hrTicker\",\"s\":\"BTCUSDT\"}", RECEIVED))
                    .isInstanceOf(MalformedMarketDataException.class)
                    .hasMessageContaining("last price");
        }
    }

    // ===== COINBASE =====

    @Nested
    @DisplayName("Coinbase")
    class Coinbase {

        private final CoinbaseFeed feed = new CoinbaseFeed(objectMapper, "wss://ws-feed.exchange.coinbase.com");

        @Test
        @DisplayName("Subscribes to USD products on the ticker channel")
        void subscribeMessage() {
            assertThat(feed.subscribeMessage(SYMBOLS)).contains(
                    "{\"type\":\"subscribe\",\"product_ids\":[\"BTC-USD\",\"ETH-USD\"],\"channels\":[\"ticker\"]}");
            assertThat(feed.endpoint(SYMBOLS).toString()).isEqualTo("wss://ws-feed.exchange.coinbase.com");
        }

        @Test
        @DisplayName("Maps the product back to the canonical symbol and derives the 24h change")
        void parsesTicker() {
            String frame = """
                    {"type":"ticker","product_id":"ETH-USD","price":"3150.25","open_24h":"3000.00",
                    "volume_24h":"1000.5","high_24h":"3200.00","low_24h":"2950.00"}
                    """;

            MarketDataPoint point = feed.parse(frame, RECEIVED).get(0);

            assertThat(point.getSymbol()).isEqualTo("ETHUSDT");
            assertThat(point.getChange24h()).isEqualByComparingTo("150.25");
            assertThat(point.getChangePercent24h()).isEqualByComparingTo("5.0083");
            assertThat(point.getExchange()).isEqualTo("coinbase");
        }

        @Test
        @DisplayName("Ignores non-ticker messages and rejects bad product ids")
        void nonTickerAndMalformed() {
            assertThat(feed.parse("{\"type\":\"subscriptions\",\"channels\":[]}", RECEIVED)).isEmpty();
            assertThatThrownBy(() -> feed.parse("{\"type\":\"ticker\",\"product_id\":\"BTCUSD\",\"price\":\"1\"}",
                            RECEIVED))
                    .isInstanceOf(MalformedMarketDataException.class);
        }
    }

    // ===== KRAKEN =====

    @Nested
    @DisplayName("Kraken")
    class Kraken {

        private final KrakenFeed feed = new KrakenFeed(objectMapper, "wss://ws.kraken.com");

        @Test
        @DisplayName("Subscribes with Kraken pair names, XBT for bitcoin")
        void subscribeMessage() {
            assertThat(feed.subscribeMessage(SYMBOLS)).contains(
                    "{\"event\":\"subscribe\",\"pair\":[\"XBT/USDT\",\"ETH/USDT\"],\"subscription\":{\"name\":\"ticker\"}}");
        }

        @Test
        @DisplayName("Parses an array ticker frame")
        void parsesTicker() {
            String frame = """
                    [340,{"c":["65000.1","0.01"],"o":["64000.0","63900.0"],"v":["100","1500.5"],
                    "h":["65500","66000"],"l":["63000","62000"]},"ticker","XBT/USDT"]
                    """;

            MarketDataPoint point = feed.parse(frame, RECEIVED).get(0);

            assertThat(point.getSymbol()).isEqualTo("BTCUSDT");
            assertThat(point.getPrice()).isEqualByComparingTo("65000.1");
            assertThat(point.getChange24h()).isEqualByComparingTo("1100.1");
            assertThat(point.getVolume24h()).isEqualByComparingTo("1500.5");
            assertThat(point.getHigh24h()).isEqualByComparingTo("66000");
        }

        @Test
        @DisplayName("Ignores heartbeats and rejects unexpected arrays")
        void heartbeatAndMalformed() {
            assertThat(feed.parse("{\"event\":\"heartbeat\"}", RECEIVED)).isEmpty();
            assertThatThrownBy(() -> feed.parse("[1,\"x\"]", RECEIVED))
                    .isInstanceOf(MalformedMarketDataException.class);
        }
    }
}
