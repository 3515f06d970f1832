package com.tradeguard.exception;

import java.util.Map;

/** A feed message that looked like a ticker but could not be turned into a price. */
public class MalformedMarketDataException extends BaseException {

    public MalformedMarketDataException(String exchange, String message) {
        super(ErrorCode.MALFORMED_MARKET_DATA, message, Map.of("exchange", exchange));
    }

    public MalformedMarketDataException(String exchange, String message, Throwable cause) {
        super(ErrorCode.MALFORMED_MARKET_DATA, exchange + ": " + message, cause);
    }
}
