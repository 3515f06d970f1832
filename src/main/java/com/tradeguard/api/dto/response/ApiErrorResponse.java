package com.tradeguard.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradeguard.exception.CapacityException;
import com.tradeguard.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope. Capacity refusals also carry {@code retryAfterSeconds}, the same
 * value as the Retry-After header, for clients that only read the body.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(detail(errorCode, message, details, path).build());
    }

    public static ApiErrorResponse of(CapacityException ex, String path) {
        return new ApiErrorResponse(detail(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path)
                .retryAfterSeconds(ex.getRetryAfterSeconds())
                .build());
    }

    private static ErrorDetail.ErrorDetailBuilder detail(
            ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path);
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
        private final Long retryAfterSeconds;
    }
}
