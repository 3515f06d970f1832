package com.tradeguard.api.controller;

import com.tradeguard.exception.PriceUnavailableException;
import com.tradeguard.market.MarketDataManager;
import com.tradeguard.market.MarketDataPoint;
import java.time.Duration;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to current prices.
 *
 * <ul>
 *   <li>GET /api/prices/{symbol} -- fresh cached price or a guarded REST fetch; 503 with Retry-After if neither</li>
 * </ul>
 *
 * <p>An open breaker or a backpressure refusal propagates as is, so Retry-After
 * carries the guard's own delay. The tier's poll interval is the hint only when
 * the REST source answered with nothing.
 */
@RestController
@RequestMapping("/api/prices")
public class PriceController {

    private final MarketDataManager marketDataManager;

    public PriceController(MarketDataManager marketDataManager) {
        this.marketDataManager = marketDataManager;
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<MarketDataPoint> getPrice(@PathVariable String symbol) {
        String canonical = symbol.toUpperCase();
        return marketDataManager.getCurrentPrice(canonical)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PriceUnavailableException(canonical, retryAfter(canonical)));
    }

    private Duration retryAfter(String symbol) {
        return marketDataManager.tierOf(symbol).getFallbackBaseInterval();
    }
}
