package com.tradeguard.exception;

public class StreamBrokerException extends BaseException {

    public StreamBrokerException(String message) {
        super(ErrorCode.STREAM_ERROR, message);
    }

    public StreamBrokerException(String message, Throwable cause) {
        super(ErrorCode.STREAM_ERROR, message, cause);
    }
}
