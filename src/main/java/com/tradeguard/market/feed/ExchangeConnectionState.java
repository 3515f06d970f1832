package com.tradeguard.market.feed;

public enum ExchangeConnectionState {
    CONNECTING,
    STREAMING,
    RECONNECT_BACKOFF,
    /** Retries exhausted; the exchange stays down until restart. */
    UNHEALTHY,
    STOPPED
}
