package com.tradeguard.unit.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tradeguard.market.DataSource;
import com.tradeguard.market.MarketDataPoint;
import com.tradeguard.market.SymbolTier;
import com.tradeguard.market.rest.CoinGeckoPriceClient;
import com.tradeguard.market.rest.FallbackIntervalCalculator;
import com.tradeguard.unit.support.MutableClock;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

class RestFallbackTest {

    // ===== COINGECKO CLIENT =====

    @Nested
    @DisplayName("CoinGeckoPriceClient")
    class CoinGecko {

        private MutableClock clock;
        private MockRestServiceServer server;
        private RestClient.Builder builder;

        @BeforeEach
        void setUp() {
            clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
            builder = RestClient.builder().baseUrl("https://api.coingecko.com/api/v3");
            server = MockRestServiceServer.bindTo(builder).build();
        }

        private CoinGeckoPriceClient client(int requestsPerMinute) {
            RateLimiter limiter = RateLimiter.of("coingecko", RateLimiterConfig.custom()
                    .limitForPeriod(requestsPerMinute)
                    .limitRefreshPeriod(Duration.ofMinutes(1))
                    .timeoutDuration(Duration.ZERO)
                    .build());
            return new CoinGeckoPriceClient(builder.build(), limiter, Map.of("BTCUSDT", "bitcoin"), clock);
        }

        @Test
        @DisplayName("Maps a simple/price quote to a REST_FALLBACK point")
        void fetchesQuote() {
            CoinGeckoPriceClient client = client(10);
            server.expect(requestTo(containsString("/simple/price?ids=bitcoin&vs_currencies=usd")))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("""
                            {"bitcoin":{"usd":65000.5,"usd_24h_vol":28123456789.12,"usd_24h_change":1.2345678}}
                            """, MediaType.APPLICATION_JSON));

            Optional<MarketDataPoint> point = client.fetchPrice("BTCUSDT");

            server.verify();
            assertThat(point).isPresent();
            assertThat(point.get().getPrice()).isEqualByComparingTo("65000.5");
            assertThat(point.get().getChangePercent24h()).isEqualByComparingTo("1.2346");
            assertThat(point.get().getSource()).isEqualTo(DataSource.REST_FALLBACK);
            assertThat(point.get().getExchange()).isEqualTo(CoinGeckoPriceClient.EXCHANGE);
            assertThat(point.get().getTimestamp()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Unmapped symbols fall back to the lower-cased base asset as coin id")
        void derivesCoinId() {
            CoinGeckoPriceClient client = client(10);
            server.expect(requestTo(containsString("ids=doge&")))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchPrice("DOGEUSDT")).isEmpty();
            server.verify();
        }

        @Test
        @DisplayName("Requests over the rate limit are refused locally as empty")
        void throttlesLocally() {
            CoinGeckoPriceClient client = client(1);
            server.expect(requestTo(containsString("ids=bitcoin")))
                    .andRespond(withSuccess("{\"bitcoin\":{\"usd\":65000}}", MediaType.APPLICATION_JSON));

            assertThat(client.fetchPrice("BTCUSDT")).isPresent();
            assertThat(client.fetchPrice("BTCUSDT")).isEmpty();

            server.verify();
            assertThat(client.getRequestCount()).isEqualTo(1);
            assertThat(client.getThrottledCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("HTTP errors propagate so the breaker can count them")
        void serverErrorPropagates() {
            CoinGeckoPriceClient client = client(10);
            server.expect(requestTo(containsString("ids=bitcoin"))).andRespond(withServerError());

            assertThatThrownBy(() -> client.fetchPrice("BTCUSDT")).isInstanceOf(RestClientException.class);
        }
    }

    // ===== POLL INTERVALS =====

    @Nested
    @DisplayName("FallbackIntervalCalculator")
    class Intervals {

        private final FallbackIntervalCalculator noJitter =
                new FallbackIntervalCalculator(Duration.ofSeconds(1), Duration.ofSeconds(30), () -> 0.5);

        @Test
        @DisplayName("Uses the tier base interval with no failures")
        void baseInterval() {
            assertThat(noJitter.calculate(SymbolTier.HOT, 0)).isEqualTo(Duration.ofSeconds(1));
            assertThat(noJitter.calculate(SymbolTier.WARM, 0)).isEqualTo(Duration.ofSeconds(2));
            assertThat(noJitter.calculate(SymbolTier.COLD, 0)).isEqualTo(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("Doubles per failure up to eight times, then clamps to the maximum")
        void backoff() {
            assertThat(noJitter.calculate(SymbolTier.WARM, 1)).isEqualTo(Duration.ofSeconds(4));
            assertThat(noJitter.calculate(SymbolTier.WARM, 2)).isEqualTo(Duration.ofSeconds(8));
            assertThat(noJitter.calculate(SymbolTier.WARM, 3)).isEqualTo(Duration.ofSeconds(16));
            assertThat(noJitter.calculate(SymbolTier.WARM, 12)).isEqualTo(Duration.ofSeconds(16));
            assertThat(noJitter.calculate(SymbolTier.COLD, 3)).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("Jitter stays within ten percent and never drops below the minimum")
        void jitterBounds() {
            FallbackIntervalCalculator low =
                    new FallbackIntervalCalculator(Duration.ofSeconds(1), Duration.ofSeconds(30), () -> 0.0);
            FallbackIntervalCalculator high =
                    new FallbackIntervalCalculator(Duration.ofSeconds(1), Duration.ofSeconds(30), () -> 0.999);

            assertThat(low.calculate(SymbolTier.COLD, 0)).isEqualTo(Duration.ofMillis(4500));
            assertThat(high.calculate(SymbolTier.COLD, 0)).isBetween(Duration.ofMillis(5490), Duration.ofMillis(5500));
            assertThat(low.calculate(SymbolTier.HOT, 0)).isEqualTo(Duration.ofSeconds(1));
        }
    }
}
