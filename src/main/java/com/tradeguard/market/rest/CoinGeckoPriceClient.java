package com.tradeguard.market.rest;

import com.tradeguard.market.DataSource;
import com.tradeguard.market.MarketDataPoint;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

/**
 * CoinGecko {@code /simple/price}. Requests beyond the rate limiter's permits are
 * refused locally and reported as "no price" rather than as errors, so they never
 * count against the breaker.
 */
public class CoinGeckoPriceClient implements RestPriceClient {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoPriceClient.class);

    public static final String EXCHANGE = "coingecko_rest";

    private static final ParameterizedTypeReference<Map<String, Map<String, BigDecimal>>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final RateLimiter rateLimiter;
    private final Map<String, String> coinIds;
    private final Clock clock;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong throttled = new AtomicLong();

    /**
     * @param coinIds canonical symbol to CoinGecko coin id; unmapped symbols use the
     *     lower-cased base asset
     */
    public CoinGeckoPriceClient(RestClient restClient, RateLimiter rateLimiter, Map<String, String> coinIds, Clock clock) {
        this.restClient = restClient;
        this.rateLimiter = rateLimiter;
        this.coinIds = Map.copyOf(coinIds);
        this.clock = clock;
    }

    @Override
    public Optional<MarketDataPoint> fetchPrice(String symbol) {
        if (!rateLimiter.acquirePermission()) {
            throttled.incrementAndGet();
            log.debug("CoinGecko request for {} throttled locally", symbol);
            return Optional.empty();
        }
        String coinId = coinId(symbol);
        requests.incrementAndGet();
        Map<String, Map<String, BigDecimal>> body = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/simple/price")
                        .queryParam("ids", coinId)
                        .queryParam("vs_currencies", "usd")
                        .queryParam("include_24hr_vol", "true")
                        .queryParam("include_24hr_change", "true")
                        .build())
                .retrieve()
                .body(RESPONSE_TYPE);

        Map<String, BigDecimal> quote = body != null ? body.get(coinId) : null;
        if (quote == null || quote.get("usd") == null) {
            log.warn("CoinGecko has no USD price for {} (id {})", symbol, coinId);
            return Optional.empty();
        }
        BigDecimal price = quote.get("usd");
        BigDecimal changePercent = quote.get("usd_24h_change");
        return Optional.of(MarketDataPoint.builder()
                .symbol(symbol)
                .price(price)
                .changePercent24h(changePercent != null ? changePercent.setScale(4, RoundingMode.HALF_UP) : null)
                .volume24h(quote.get("usd_24h_vol"))
                .exchange(EXCHANGE)
                .timestamp(clock.instant())
                .source(DataSource.REST_FALLBACK)
                .build());
    }

    String coinId(String symbol) {
        String mapped = coinIds.get(symbol);
        if (mapped != null) {
            return mapped;
        }
        String lower = symbol.toLowerCase();
        return lower.endsWith("usdt") && lower.length() > 4 ? lower.substring(0, lower.length() - 4) : lower;
    }

    public long getRequestCount() {
        return requests.get();
    }

    public long getThrottledCount() {
        return throttled.get();
    }
}
