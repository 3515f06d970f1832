package com.tradeguard.market;

/** Handle returned by {@link MarketDataManager#subscribe}; cancelling is idempotent. */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
