package com.tradeguard.market;

/** Where a price point came from. */
public enum DataSource {
    WEBSOCKET,
    REST_FALLBACK,
    CACHED
}
