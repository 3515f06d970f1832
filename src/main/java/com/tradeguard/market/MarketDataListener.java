package com.tradeguard.market;

/** Receives price updates for a subscribed symbol. Runs on the subscriber executor, never on a feed thread. */
@FunctionalInterface
public interface MarketDataListener {

    void onPrice(MarketDataPoint point) throws Exception;
}
