package com.tradeguard.stream;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EventType {
    PRICE_UPDATE(EventStreamCatalog.MARKET_UPDATES),
    TRADE_SIGNAL(EventStreamCatalog.TRADE_SIGNALS),
    PORTFOLIO_CHANGE(EventStreamCatalog.PORTFOLIO_CHANGES),
    RISK_ALERT(EventStreamCatalog.RISK_ALERTS),
    SYSTEM_HEALTH(EventStreamCatalog.SYSTEM_EVENTS),
    BALANCE_UPDATE(EventStreamCatalog.BALANCE_UPDATES),
    CLEANUP_REQUEST(EventStreamCatalog.CLEANUP_EVENTS);

    private final String defaultStream;

    /** Resolves a stored event type name; unknown names map to {@code null}. */
    public static EventType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (EventType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        return null;
    }
}
