package com.tradeguard.market.feed;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/** {@link WebSocketConnector} on Spring's JSR-356 client. */
public class SpringWebSocketConnector implements WebSocketConnector {

    private static final Logger log = LoggerFactory.getLogger(SpringWebSocketConnector.class);

    /** Binance combined-stream frames for many symbols exceed the container default. */
    static final int TEXT_MESSAGE_SIZE_LIMIT = 512 * 1024;

    private final WebSocketClient client;

    public SpringWebSocketConnector(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public WebSocketChannel connect(URI uri, Duration connectTimeout, Consumer<String> onMessage) throws Exception {
        WebSocketSession session = client.execute(new FrameHandler(uri, onMessage), new WebSocketHttpHeaders(), uri)
                .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return new SessionChannel(session);
    }

    private static final class FrameHandler extends TextWebSocketHandler {

        private final URI uri;
        private final Consumer<String> onMessage;

        private FrameHandler(URI uri, Consumer<String> onMessage) {
            this.uri = uri;
            this.onMessage = onMessage;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            session.setTextMessageSizeLimit(TEXT_MESSAGE_SIZE_LIMIT);
            log.debug("WebSocket session {} open to {}", session.getId(), uri.getHost());
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            onMessage.accept(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.warn("WebSocket transport error from {}: {}", uri.getHost(), exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            log.info("WebSocket to {} closed: {}", uri.getHost(), status);
        }
    }

    private static final class SessionChannel implements WebSocketChannel {

        private final WebSocketSession session;

        private SessionChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public synchronized void send(String text) throws IOException {
            session.sendMessage(new TextMessage(text));
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
