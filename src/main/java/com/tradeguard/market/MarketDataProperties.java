package com.tradeguard.market;

import com.tradeguard.market.feed.ExchangeConnectionConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds to {@code tradeguard.market-data.*}.
 *
 * <p>Exchange entries are bound as a whole: an exchange configured in
 * application.properties should set all of its fields.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tradeguard.market-data")
public class MarketDataProperties {

    private boolean enabled = true;

    /** Symbols streamed from the exchanges and covered by REST fallback, in canonical form. */
    @NotEmpty
    private List<String> symbols = new ArrayList<>(List.of(
            "BTCUSDT", "ETHUSDT", "SOLUSDT", "ADAUSDT", "DOTUSDT", "MATICUSDT", "LINKUSDT", "UNIUSDT"));

    private List<String> hotSymbols = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "ADAUSDT"));

    private List<String> warmSymbols = new ArrayList<>(List.of("DOTUSDT", "MATICUSDT", "LINKUSDT", "UNIUSDT"));

    /** A WebSocket point older than this no longer counts as live; fallback polling takes over. */
    @NotNull
    private Duration stalenessThreshold = Duration.ofSeconds(10);

    /** How often an idle fallback poller rechecks whether it is needed. */
    @NotNull
    private Duration healthyCheckInterval = Duration.ofSeconds(5);

    @NotNull
    private Duration fallbackMinInterval = Duration.ofSeconds(1);

    @NotNull
    private Duration fallbackMaxInterval = Duration.ofSeconds(30);

    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(5);

    @Valid
    private Subscribers subscribers = new Subscribers();

    @Valid
    private Rest rest = new Rest();

    @Valid
    private Map<String, Exchange> exchanges = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Subscribers {

        @Min(1)
        private int threads = 4;

        @Min(1)
        private int queueCapacity = 1000;
    }

    @Getter
    @Setter
    public static class Rest {

        @NotBlank
        private String baseUrl = "https://api.coingecko.com/api/v3";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        @Min(1)
        private int requestsPerMinute = 50;

        /** Canonical symbol to CoinGecko coin id. */
        private Map<String, String> coinIds = new LinkedHashMap<>(Map.of(
                "BTCUSDT", "bitcoin",
                "ETHUSDT", "ethereum",
                "SOLUSDT", "solana",
                "ADAUSDT", "cardano",
                "DOTUSDT", "polkadot",
                "MATICUSDT", "matic-network",
                "LINKUSDT", "chainlink",
                "UNIUSDT", "uniswap"));
    }

    @Getter
    @Setter
    public static class Exchange {

        private boolean enabled = true;

        @NotBlank
        private String url;

        @NotNull
        private Duration reconnectDelay = Duration.ofSeconds(5);

        @NotNull
        private Duration maxReconnectDelay = Duration.ofMinutes(2);

        @Min(1)
        private int maxRetries = 10;

        @Min(1)
        private int symbolsPerConnection = 100;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        public ExchangeConnectionConfig toConfig() {
            return ExchangeConnectionConfig.builder()
                    .reconnectDelay(reconnectDelay)
                    .maxReconnectDelay(maxReconnectDelay)
                    .maxRetries(maxRetries)
                    .symbolsPerConnection(symbolsPerConnection)
                    .connectTimeout(connectTimeout)
                    .build();
        }
    }
}
