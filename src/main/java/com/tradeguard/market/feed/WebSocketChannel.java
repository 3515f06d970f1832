package com.tradeguard.market.feed;

import java.io.IOException;

/** An open WebSocket connection as the supervisor sees it. */
public interface WebSocketChannel extends AutoCloseable {

    void send(String text) throws IOException;

    boolean isOpen();

    /** Idempotent; never throws. */
    @Override
    void close();
}
