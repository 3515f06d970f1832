package com.tradeguard.market.feed;

import java.net.URI;
import java.time.Duration;
import java.util.function.Consumer;

/** Opens WebSocket connections whose text frames are delivered to a callback. */
public interface WebSocketConnector {

    /**
     * Connects and completes the handshake within {@code connectTimeout}.
     *
     * @param onMessage called on the transport thread for every text frame
     * @throws Exception if the connection cannot be established in time
     */
    WebSocketChannel connect(URI uri, Duration connectTimeout, Consumer<String> onMessage) throws Exception;
}
