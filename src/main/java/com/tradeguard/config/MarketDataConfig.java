package com.tradeguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.exception.ConfigurationException;
import com.tradeguard.market.MarketDataManager;
import com.tradeguard.market.MarketDataProperties;
import com.tradeguard.market.feed.BinanceFeed;
import com.tradeguard.market.feed.CoinbaseFeed;
import com.tradeguard.market.feed.ExchangeConnectionConfig;
import com.tradeguard.market.feed.ExchangeFeed;
import com.tradeguard.market.feed.KrakenFeed;
import com.tradeguard.market.feed.SpringWebSocketConnector;
import com.tradeguard.market.feed.WebSocketConnector;
import com.tradeguard.market.rest.CoinGeckoPriceClient;
import com.tradeguard.market.rest.FallbackIntervalCalculator;
import com.tradeguard.market.rest.RestPriceClient;
import com.tradeguard.resilience.GuardedCallService;
import com.tradeguard.store.KeyValueStore;
import com.tradeguard.stream.EventStreamManager;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/** Market data wiring: exchange feeds, the WebSocket client, the REST fallback source and the manager. */
@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    @Bean
    public WebSocketConnector webSocketConnector() {
        return new SpringWebSocketConnector(new StandardWebSocketClient());
    }

    @Bean
    public RestPriceClient restPriceClient(MarketDataProperties properties, Clock clock) {
        MarketDataProperties.Rest rest = properties.getRest();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(rest.getConnectTimeout());
        requestFactory.setReadTimeout(rest.getReadTimeout());
        RestClient restClient = RestClient.builder()
                .baseUrl(rest.getBaseUrl())
                .requestFactory(requestFactory)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("coingecko", RateLimiterConfig.custom()
                .limitForPeriod(rest.getRequestsPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());

        return new CoinGeckoPriceClient(restClient, rateLimiter, rest.getCoinIds(), clock);
    }

    @Bean
    public MarketDataManager marketDataManager(
            MarketDataProperties properties,
            WebSocketConnector webSocketConnector,
            RestPriceClient restPriceClient,
            GuardedCallService guardedCallService,
            KeyValueStore keyValueStore,
            EventStreamManager eventStreamManager,
            @Qualifier("subscriberExecutor") ThreadPoolTaskExecutor subscriberExecutor,
            ObjectMapper objectMapper,
            Clock clock) {
        return new MarketDataManager(
                properties,
                exchangeFeeds(properties, objectMapper),
                webSocketConnector,
                restPriceClient,
                guardedCallService,
                keyValueStore,
                eventStreamManager,
                subscriberExecutor,
                new FallbackIntervalCalculator(properties.getFallbackMinInterval(), properties.getFallbackMaxInterval()),
                objectMapper,
                clock);
    }

    private static Map<ExchangeFeed, ExchangeConnectionConfig> exchangeFeeds(
            MarketDataProperties properties, ObjectMapper objectMapper) {
        Map<ExchangeFeed, ExchangeConnectionConfig> feeds = new LinkedHashMap<>();
        properties.getExchanges().forEach((name, exchange) -> {
            if (!exchange.isEnabled()) {
                log.info("Exchange {} disabled", name);
                return;
            }
            feeds.put(feedFor(name, exchange.getUrl(), objectMapper), exchange.toConfig());
        });
        return feeds;
    }

    private static ExchangeFeed feedFor(String name, String url, ObjectMapper objectMapper) {
        return switch (name) {
            case BinanceFeed.NAME -> new BinanceFeed(objectMapper, url);
            case CoinbaseFeed.NAME -> new CoinbaseFeed(objectMapper, url);
            case KrakenFeed.NAME -> new KrakenFeed(objectMapper, url);
            default -> throw new ConfigurationException("Unknown exchange '" + name
                    + "' under tradeguard.market-data.exchanges, expected binance, coinbase or kraken");
        };
    }
}
