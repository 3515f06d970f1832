package com.tradeguard.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for every {@code /api} response. Prices and health reports
 * are wrapped by {@link com.tradeguard.config.ApiResponseAdvice}; the timestamp
 * is when the response was built, not when the price was observed.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
