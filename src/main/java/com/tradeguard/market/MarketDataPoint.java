package com.tradeguard.market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical price record, whatever exchange or API it came from. Symbols are in
 * Binance form ({@code BTCUSDT}). Fields an exchange does not report are null.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MarketDataPoint {

    String symbol;
    BigDecimal price;
    BigDecimal change24h;
    BigDecimal changePercent24h;
    BigDecimal volume24h;
    BigDecimal high24h;
    BigDecimal low24h;
    String exchange;
    Instant timestamp;
    DataSource source;

    public Duration ageAt(Instant now) {
        return Duration.between(timestamp, now);
    }
}
