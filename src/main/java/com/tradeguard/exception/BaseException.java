package com.tradeguard.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's exceptions. The {@link ErrorCode} fixes the HTTP status
 * and the details map travels into {@code ApiErrorResponse} unchanged, so put
 * only values a client can act on there: a circuit name, a symbol, a stream.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
