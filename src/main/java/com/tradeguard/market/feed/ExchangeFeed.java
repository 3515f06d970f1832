package com.tradeguard.market.feed;

import com.tradeguard.market.MarketDataPoint;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Wire format of one exchange's ticker WebSocket: where to connect, what to send
 * after connecting, and how to read what comes back.
 */
public interface ExchangeFeed {

    /** Lower-case exchange name, used in logs, status and the {@code exchange} field of points. */
    String name();

    URI endpoint(List<String> symbols);

    /** Message to send once connected, if the exchange subscribes in-band. */
    Optional<String> subscribeMessage(List<String> symbols);

    /**
     * Parses one text frame. Heartbeats, acknowledgements and other non-ticker
     * messages yield an empty list.
     *
     * @throws com.tradeguard.exception.MalformedMarketDataException if the frame is a
     *     ticker that cannot be read
     */
    List<MarketDataPoint> parse(String payload, Instant receivedAt);
}
