package com.tradeguard.market.rest;

import com.tradeguard.market.MarketDataPoint;
import java.util.Optional;

/** REST price source used when the WebSocket feeds have nothing fresh. */
public interface RestPriceClient {

    /**
     * @return the current price with source {@code REST_FALLBACK}, or empty if the
     *     source has no price for the symbol or refused the request locally
     * @throws org.springframework.web.client.RestClientException on transport or HTTP errors
     */
    Optional<MarketDataPoint> fetchPrice(String symbol);
}
