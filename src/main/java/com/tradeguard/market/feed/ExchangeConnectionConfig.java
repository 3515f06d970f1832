package com.tradeguard.market.feed;

import com.tradeguard.exception.ConfigurationException;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Reconnect policy and limits for one exchange connection. */
@Getter
@ToString
public class ExchangeConnectionConfig {

    private final Duration reconnectDelay;
    private final Duration maxReconnectDelay;
    private final int maxRetries;
    private final int symbolsPerConnection;
    private final Duration connectTimeout;

    /** How often a streaming connection is checked for having closed. */
    private final Duration closePollInterval;

    @Builder
    private ExchangeConnectionConfig(
            Duration reconnectDelay,
            Duration maxReconnectDelay,
            int maxRetries,
            int symbolsPerConnection,
            Duration connectTimeout,
            Duration closePollInterval) {
        if (reconnectDelay == null || reconnectDelay.isNegative() || reconnectDelay.isZero()) {
            throw new ConfigurationException("reconnectDelay must be positive");
        }
        if (maxReconnectDelay == null || maxReconnectDelay.compareTo(reconnectDelay) < 0) {
            throw new ConfigurationException("maxReconnectDelay must be >= reconnectDelay");
        }
        if (maxRetries < 1) {
            throw new ConfigurationException("maxRetries must be >= 1, was " + maxRetries);
        }
        if (symbolsPerConnection < 1) {
            throw new ConfigurationException("symbolsPerConnection must be >= 1, was " + symbolsPerConnection);
        }
        this.reconnectDelay = reconnectDelay;
        this.maxReconnectDelay = maxReconnectDelay;
        this.maxRetries = maxRetries;
        this.symbolsPerConnection = symbolsPerConnection;
        this.connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
        this.closePollInterval = closePollInterval != null ? closePollInterval : Duration.ofSeconds(1);
    }
}
