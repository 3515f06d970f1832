package com.tradeguard.exception;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;

@Getter
public class PriceUnavailableException extends CapacityException {

    private final String symbol;

    public PriceUnavailableException(String symbol, Duration retryAfter) {
        super(
                ErrorCode.PRICE_UNAVAILABLE,
                "No fresh price available for " + symbol,
                retryAfter,
                Map.of("symbol", symbol));
        this.symbol = symbol;
    }
}
