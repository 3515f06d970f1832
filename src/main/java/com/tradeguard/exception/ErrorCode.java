package com.tradeguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    NOT_FOUND("NOT_FOUND", 404),
    BACKPRESSURE("BACKPRESSURE", 429),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500),
    STREAM_ERROR("STREAM_ERROR", 502),
    MALFORMED_MARKET_DATA("MALFORMED_MARKET_DATA", 502),
    CIRCUIT_OPEN("CIRCUIT_OPEN", 503),
    PRICE_UNAVAILABLE("PRICE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
